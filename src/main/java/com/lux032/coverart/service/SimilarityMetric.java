package com.lux032.coverart.service;

import com.lux032.coverart.model.Fingerprint;

/**
 * 指纹相似度
 * 把指纹看作位串，返回相同位所占比例（1 - 归一化汉明距离）
 */
public class SimilarityMetric {

    /**
     * @return [0, 1] 之间的相似度；空指纹或长度不同的指纹返回 0
     */
    public double similarity(Fingerprint a, Fingerprint b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.bitLength() != b.bitLength()) {
            return 0.0;
        }

        byte[] left = a.toBytes();
        byte[] right = b.toBytes();

        int differences = 0;
        for (int i = 0; i < left.length; i++) {
            differences += Integer.bitCount((left[i] ^ right[i]) & 0xff);
        }

        return 1.0 - (double) differences / a.bitLength();
    }
}
