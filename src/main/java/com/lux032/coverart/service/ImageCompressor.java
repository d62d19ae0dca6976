package com.lux032.coverart.service;

import com.lux032.coverart.util.I18nUtil;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Image;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;
import java.util.Optional;

/**
 * 图片校验与压缩服务
 * 拒绝无法解码的数据；超过字节上限的图片先逐步降低 JPEG 质量，仍然超限再逐步缩小尺寸
 */
@Slf4j
public class ImageCompressor {

    private static final int INITIAL_QUALITY_PERCENT = 95;
    private static final int MIN_QUALITY_PERCENT = 10;
    private static final int QUALITY_STEP_PERCENT = 5;

    private static final int INITIAL_SCALE_PERCENT = 90;
    private static final int MIN_SCALE_PERCENT = 30;
    private static final int SCALE_STEP_PERCENT = 10;
    private static final float SCALED_QUALITY = 0.75f;

    // JPEG 不支持透明度，透明区域铺白底
    private static final Color FLATTEN_BACKGROUND = Color.WHITE;

    /**
     * 校验并压缩图片
     * @param rawBytes 下载得到的原始数据
     * @param targetMaxBytes 字节上限
     * @return 校验通过的图片；无法解码时返回 empty
     */
    public Optional<CompressedImage> validateAndCompress(byte[] rawBytes, long targetMaxBytes) {
        if (rawBytes == null || rawBytes.length == 0) {
            log.debug("图片数据为空，拒绝");
            return Optional.empty();
        }

        BufferedImage image = decode(rawBytes);
        if (image == null) {
            log.debug("无法解码为图片 ({} 字节)，拒绝", rawBytes.length);
            return Optional.empty();
        }

        int width = image.getWidth();
        int height = image.getHeight();

        if (rawBytes.length <= targetMaxBytes) {
            log.debug("图片大小: {} KB，无需压缩", rawBytes.length / 1024);
            return Optional.of(new CompressedImage(rawBytes.clone(), width, height, false, false));
        }

        log.debug("原始图片大小: {} KB ({}x{})，开始压缩...", rawBytes.length / 1024, width, height);

        try {
            return Optional.of(compress(image, targetMaxBytes));
        } catch (IOException e) {
            log.warn("图片压缩失败，拒绝该图片: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 判断响应是否像一张图片（Content-Type 或 URL 后缀）
     */
    public static boolean looksLikeImage(String contentType, String url) {
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("image")) {
            return true;
        }
        if (url == null) {
            return false;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        int query = lower.indexOf('?');
        if (query >= 0) {
            lower = lower.substring(0, query);
        }
        return lower.endsWith(".jpg") || lower.endsWith(".jpeg") || lower.endsWith(".png");
    }

    /**
     * 根据文件头判断图片 MIME 类型，无法识别时按 JPEG 处理
     */
    public static String detectMimeType(byte[] data) {
        if (data != null && data.length >= 8
            && (data[0] & 0xff) == 0x89 && data[1] == 'P' && data[2] == 'N' && data[3] == 'G') {
            return "image/png";
        }
        if (data != null && data.length >= 6 && data[0] == 'G' && data[1] == 'I' && data[2] == 'F') {
            return "image/gif";
        }
        if (data != null && data.length >= 2 && data[0] == 'B' && data[1] == 'M') {
            return "image/bmp";
        }
        return "image/jpeg";
    }

    /**
     * 读取图片，失败或不是栅格图片时返回 null
     */
    static BufferedImage decode(byte[] data) {
        try {
            return ImageIO.read(new ByteArrayInputStream(data));
        } catch (IOException | RuntimeException e) {
            log.debug("图片解码失败: {}", e.getMessage());
            return null;
        }
    }

    private CompressedImage compress(BufferedImage original, long targetMaxBytes) throws IOException {
        BufferedImage rgbImage = flatten(original);
        byte[] smallest = null;
        int smallestWidth = rgbImage.getWidth();
        int smallestHeight = rgbImage.getHeight();

        // 1. 逐步降低质量
        for (int quality = INITIAL_QUALITY_PERCENT; quality >= MIN_QUALITY_PERCENT; quality -= QUALITY_STEP_PERCENT) {
            byte[] encoded = compressToJPEG(rgbImage, quality / 100f);
            if (encoded.length <= targetMaxBytes) {
                log.debug("压缩成功! 最终大小: {} KB, 质量: {}%", encoded.length / 1024, quality);
                return new CompressedImage(encoded, rgbImage.getWidth(), rgbImage.getHeight(), true, false);
            }
            if (smallest == null || encoded.length < smallest.length) {
                smallest = encoded;
            }
        }

        // 2. 最低质量仍然太大，逐步缩小尺寸
        log.debug("最低质量仍超过 {} 字节，开始缩小尺寸", targetMaxBytes);
        for (int scale = INITIAL_SCALE_PERCENT; scale >= MIN_SCALE_PERCENT; scale -= SCALE_STEP_PERCENT) {
            BufferedImage scaled = scaleImage(rgbImage, scale);
            byte[] encoded = compressToJPEG(scaled, SCALED_QUALITY);
            log.debug("尺寸: {}x{}, 大小: {} KB", scaled.getWidth(), scaled.getHeight(), encoded.length / 1024);
            if (encoded.length <= targetMaxBytes) {
                return new CompressedImage(encoded, scaled.getWidth(), scaled.getHeight(), true, false);
            }
            if (encoded.length < smallest.length) {
                smallest = encoded;
                smallestWidth = scaled.getWidth();
                smallestHeight = scaled.getHeight();
            }
        }

        log.warn(I18nUtil.getMessage("image.compress.floor", targetMaxBytes, smallest.length));
        return new CompressedImage(smallest, smallestWidth, smallestHeight, true, true);
    }

    /**
     * 转为 RGB，带透明通道或调色板的图片铺在固定背景色上
     */
    static BufferedImage flatten(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgbImage = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgbImage.createGraphics();
        try {
            g.setColor(FLATTEN_BACKGROUND);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgbImage;
    }

    /**
     * 按百分比缩放图片（保持宽高比）
     */
    private static BufferedImage scaleImage(BufferedImage original, int scalePercent) {
        int scaledWidth = Math.max(1, original.getWidth() * scalePercent / 100);
        int scaledHeight = Math.max(1, original.getHeight() * scalePercent / 100);

        Image scaledImage = original.getScaledInstance(scaledWidth, scaledHeight, Image.SCALE_SMOOTH);

        BufferedImage bufferedScaledImage = new BufferedImage(scaledWidth, scaledHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = bufferedScaledImage.createGraphics();
        try {
            g2d.drawImage(scaledImage, 0, 0, null);
        } finally {
            g2d.dispose();
        }
        return bufferedScaledImage;
    }

    /**
     * 将 RGB 图片编码为 JPEG
     */
    private static byte[] compressToJPEG(BufferedImage image, float quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpg");
        if (!writers.hasNext()) {
            throw new IOException("没有可用的JPEG写入器");
        }

        ImageWriter writer = writers.next();
        ImageWriteParam writeParam = writer.getDefaultWriteParam();
        writeParam.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        writeParam.setCompressionQuality(quality);

        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(baos)) {
            writer.setOutput(ios);
            writer.write(null, new IIOImage(image, null, null), writeParam);
        } finally {
            writer.dispose();
        }

        return baos.toByteArray();
    }

    /**
     * 校验/压缩结果
     */
    @Data
    public static class CompressedImage {
        private final byte[] bytes;
        private final int width;
        private final int height;
        // 是否重新编码过
        private final boolean recompressed;
        // 已到压缩下限仍未满足字节上限
        private final boolean floorReached;

        public CompressedImage(byte[] bytes, int width, int height, boolean recompressed, boolean floorReached) {
            this.bytes = bytes;
            this.width = width;
            this.height = height;
            this.recompressed = recompressed;
            this.floorReached = floorReached;
        }
    }
}
