package com.webharvest.core.process;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/** 본문 MD5 hex. 중복 판정 전용(보안 용도 아님). */
public final class ContentHasher {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private ContentHasher() {}

    public static String md5Hex(String content) {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            // 모든 JDK 는 MD5 를 제공해야 함
            throw new IllegalStateException("MD5 not available", e);
        }
        byte[] digest = md.digest(content.getBytes(StandardCharsets.UTF_8));
        char[] out = new char[digest.length * 2];
        for (int i = 0; i < digest.length; i++) {
            out[i * 2] = HEX[(digest[i] >> 4) & 0xF];
            out[i * 2 + 1] = HEX[digest[i] & 0xF];
        }
        return new String(out);
    }
}
