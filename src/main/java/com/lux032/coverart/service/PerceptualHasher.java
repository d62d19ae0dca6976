package com.lux032.coverart.service;

import com.lux032.coverart.model.Fingerprint;
import lombok.extern.slf4j.Slf4j;

import java.awt.Graphics2D;
import java.awt.Image;
import java.awt.image.BufferedImage;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * 基于颜色直方图的图片指纹
 * 缩放到 8x8 后统计 RGB 三个通道各 8 个区间的像素数，再对计数序列做 MD5。
 * 能容忍重新压缩和缩略图尺寸差异，对旋转和裁剪敏感。
 */
@Slf4j
public class PerceptualHasher {

    static final int GRID_SIZE = 8;
    static final int BINS_PER_CHANNEL = 8;

    private static final int BIN_WIDTH = 256 / BINS_PER_CHANNEL;
    private static final String DIGEST_ALGORITHM = "MD5";

    /**
     * 计算图片指纹
     * @param imageBytes 图片数据
     * @return 16 字节指纹，无法解码时返回 {@link Fingerprint#EMPTY}
     */
    public Fingerprint fingerprint(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            return Fingerprint.EMPTY;
        }

        BufferedImage image = ImageCompressor.decode(imageBytes);
        if (image == null) {
            log.warn("无法解码图片，指纹为空");
            return Fingerprint.EMPTY;
        }

        return fingerprint(image);
    }

    Fingerprint fingerprint(BufferedImage image) {
        int[] histogram = histogram(downsample(image));
        return Fingerprint.of(digest(histogram));
    }

    /**
     * 统计直方图，按 R、G、B 顺序拼接
     */
    static int[] histogram(BufferedImage grid) {
        int[] counts = new int[BINS_PER_CHANNEL * 3];
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                int rgb = grid.getRGB(x, y);
                int r = (rgb >> 16) & 0xff;
                int g = (rgb >> 8) & 0xff;
                int b = rgb & 0xff;
                counts[r / BIN_WIDTH]++;
                counts[BINS_PER_CHANNEL + g / BIN_WIDTH]++;
                counts[2 * BINS_PER_CHANNEL + b / BIN_WIDTH]++;
            }
        }
        return counts;
    }

    private static BufferedImage downsample(BufferedImage image) {
        BufferedImage rgb = dropAlpha(image);
        // SCALE_SMOOTH 使用区域平均，结果与运行环境无关
        Image scaled = rgb.getScaledInstance(GRID_SIZE, GRID_SIZE, Image.SCALE_SMOOTH);

        BufferedImage grid = new BufferedImage(GRID_SIZE, GRID_SIZE, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = grid.createGraphics();
        try {
            g.drawImage(scaled, 0, 0, null);
        } finally {
            g.dispose();
        }
        return grid;
    }

    /**
     * 转为 RGB，直接丢弃透明度通道，保留像素原本的颜色（不与背景合成）
     */
    static BufferedImage dropAlpha(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        int width = image.getWidth();
        int height = image.getHeight();
        BufferedImage rgb = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            rgb.setRGB(0, y, width, 1, row, 0, width);
        }
        return rgb;
    }

    private static byte[] digest(int[] histogram) {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance(DIGEST_ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5算法不可用", e);
        }
        // 8x8 网格每个区间最多 64，单字节即可表示
        for (int count : histogram) {
            md.update((byte) count);
        }
        return md.digest();
    }
}
