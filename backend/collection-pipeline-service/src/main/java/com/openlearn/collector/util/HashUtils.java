package com.openlearn.collector.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 헬퍼
 */
public final class HashUtils {

    private HashUtils() {
    }

    public static String sha256Hex(String text) {
        return sha256Hex(new String[]{text});
    }

    /**
     * 각 파트 사이에 구분자(0x00)를 넣어 해시합니다. null 파트는 빈 문자열로 취급합니다.
     */
    public static String sha256Hex(String... parts) {
        MessageDigest digest = newDigest();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                digest.update((byte) 0);
            }
            digest.update((parts[i] != null ? parts[i] : "").getBytes(StandardCharsets.UTF_8));
        }
        return toHex(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    private static String toHex(byte[] hash) {
        StringBuilder hexString = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) hexString.append('0');
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
