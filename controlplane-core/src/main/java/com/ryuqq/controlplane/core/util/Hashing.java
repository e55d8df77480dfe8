package com.ryuqq.controlplane.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 해시 헬퍼 (복구 코드 저장용).
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class Hashing {

    private Hashing() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String sha256(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    public static String sha256(byte[] value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
