package com.lux032.coverart.model;

import java.util.Arrays;

/**
 * 图片指纹（直方图摘要）
 * 不可变，EMPTY 表示图片无法解码时的空指纹
 */
public final class Fingerprint {

    public static final Fingerprint EMPTY = new Fingerprint(new byte[0]);

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] digest;

    private Fingerprint(byte[] digest) {
        this.digest = digest;
    }

    public static Fingerprint of(byte[] digest) {
        if (digest == null || digest.length == 0) {
            return EMPTY;
        }
        return new Fingerprint(digest.clone());
    }

    public boolean isEmpty() {
        return digest.length == 0;
    }

    /**
     * 指纹的位数
     */
    public int bitLength() {
        return digest.length * 8;
    }

    public byte[] toBytes() {
        return digest.clone();
    }

    public String toHex() {
        StringBuilder sb = new StringBuilder(digest.length * 2);
        for (byte b : digest) {
            sb.append(HEX[(b >> 4) & 0x0f]).append(HEX[b & 0x0f]);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Fingerprint)) {
            return false;
        }
        return Arrays.equals(digest, ((Fingerprint) o).digest);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(digest);
    }

    @Override
    public String toString() {
        return isEmpty() ? "Fingerprint{empty}" : "Fingerprint{" + toHex() + "}";
    }
}
