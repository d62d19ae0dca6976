package com.lux032.coverart.model;

import lombok.Getter;

import java.util.Objects;

/**
 * 封面候选
 * 一张已通过校验/压缩的图片及其来源信息。
 * 除 similarityScore 和 selected 外全部不可变，这两个字段只能由共识选择写入一次。
 */
@Getter
public class CoverArtCandidate {

    private final String sourceUrl;
    private final ProviderName providerName;
    private final byte[] imageBytes;
    private final int width;
    private final int height;
    private final Fingerprint fingerprint;

    private double similarityScore;
    private boolean selected;

    public CoverArtCandidate(String sourceUrl, ProviderName providerName, byte[] imageBytes,
                             int width, int height, Fingerprint fingerprint) {
        this.sourceUrl = sourceUrl;
        this.providerName = Objects.requireNonNull(providerName, "providerName");
        this.imageBytes = Objects.requireNonNull(imageBytes, "imageBytes").clone();
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("分辨率不能为负数: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.fingerprint = fingerprint == null ? Fingerprint.EMPTY : fingerprint;
    }

    /**
     * 图片数据副本
     */
    public byte[] getImageBytes() {
        return imageBytes.clone();
    }

    public int getSizeBytes() {
        return imageBytes.length;
    }

    public long getPixelCount() {
        return (long) width * height;
    }

    /**
     * 标记为本次获取的最终结果（只能调用一次）
     * @param score 与获胜分组成员的平均相似度
     */
    public synchronized void markSelected(double score) {
        if (selected) {
            throw new IllegalStateException("候选已被选中，不能重复标记: " + sourceUrl);
        }
        if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("相似度必须在 0 到 1 之间: " + score);
        }
        this.similarityScore = score;
        this.selected = true;
    }

    @Override
    public String toString() {
        return String.format("CoverArtCandidate{source=%s, resolution=%dx%d, size=%d, selected=%s, score=%.3f, url='%s'}",
            providerName, width, height, imageBytes.length, selected, similarityScore, sourceUrl);
    }
}
