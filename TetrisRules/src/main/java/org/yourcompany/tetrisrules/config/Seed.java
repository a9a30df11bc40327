package org.yourcompany.tetrisrules.config;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * キューの乱数生成器に渡すシード値。
 * 文字列・数値・バイト列のいずれからでも作成でき、内部ではバイト列として保持します。
 */
public final class Seed {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final byte[] bytes;

    private Seed(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Seed of(byte[] bytes) {
        return new Seed(Arrays.copyOf(bytes, bytes.length));
    }

    public static Seed of(String text) {
        return new Seed(text.getBytes(StandardCharsets.UTF_8));
    }

    public static Seed of(long value) {
        return new Seed(ByteBuffer.allocate(Long.BYTES).putLong(value).array());
    }

    /**
     * シードが指定されなかった場合に使う、暗号論的に安全なランダムシードを生成します。
     */
    public static Seed random() {
        byte[] bytes = new byte[16];
        SECURE_RANDOM.nextBytes(bytes);
        return new Seed(bytes);
    }

    public byte[] getBytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * {@link java.util.Random} に渡す 64bit 値を求めます。
     * SHA-256 ダイジェストの先頭 8 バイトをビッグエンディアンで読み取ります。
     */
    public long toLong() {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(bytes);
            return ByteBuffer.wrap(digest, 0, Long.BYTES).getLong();
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 はすべての JDK で提供が義務付けられている
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Seed other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Seed[");
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.append(']').toString();
    }
}
