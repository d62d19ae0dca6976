package com.lux032.coverart.provider;

import com.lux032.coverart.model.ProviderName;

import java.io.Closeable;
import java.util.List;

/**
 * 封面来源
 * 每个实现对应一个外部 API：搜索曲目、解析出图片地址、下载图片。
 * 无结果和任何失败都返回空列表，不抛异常。
 */
public interface CoverArtProvider extends Closeable {

    ProviderName getName();

    /**
     * 未启用的来源不参与请求，也不分配候选名额
     */
    boolean isEnabled();

    /**
     * @param artist 艺术家，可能为空字符串
     * @param title 标题，可能为空字符串
     * @param limit 返回图片数量的软上限
     */
    List<RawImage> fetchCandidateImages(String artist, String title, int limit);
}
