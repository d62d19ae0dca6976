package com.lux032.coverart.provider;

import lombok.Data;

/**
 * 来源返回的原始图片（尚未校验）
 */
@Data
public class RawImage {
    private final String url;
    private final byte[] bytes;

    public RawImage(String url, byte[] bytes) {
        this.url = url;
        this.bytes = bytes;
    }
}
