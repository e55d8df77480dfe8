package com.ryuqq.controlplane.core.util;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.UUID;

/**
 * 엔티티 식별자 및 비밀 값 생성기.
 *
 * <p>식별자는 {@code <prefix>_<uuid>} 형식입니다 (예: {@code usr_3f2a...}).
 * 비밀 값(토큰, 디바이스 코드, 복구 코드)은 {@link SecureRandom} 기반입니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class Ids {

    private static final SecureRandom RANDOM = new SecureRandom();

    private Ids() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String next(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be null or blank");
        }
        return prefix + "_" + UUID.randomUUID();
    }

    public static String secret(String prefix) {
        return prefix + "_" + randomHex(24);
    }

    /**
     * 사람이 입력하기 쉬운 {@code XXXX-XXXX} 형식의 코드.
     */
    public static String userCode() {
        String hex = randomHex(4).toUpperCase();
        return hex.substring(0, 4) + "-" + hex.substring(4);
    }

    public static String randomHex(int bytes) {
        byte[] buffer = new byte[bytes];
        RANDOM.nextBytes(buffer);
        return HexFormat.of().formatHex(buffer);
    }
}
