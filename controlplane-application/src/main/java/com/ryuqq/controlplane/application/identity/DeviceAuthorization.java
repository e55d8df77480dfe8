package com.ryuqq.controlplane.application.identity;

import java.time.Instant;

/**
 * 디바이스 흐름 시작 결과.
 *
 * @param deviceCode 교환에 사용할 코드
 * @param expiresAt 만료 시각
 * @author Control Plane Team
 * @since 1.0.0
 */
public record DeviceAuthorization(String deviceCode, Instant expiresAt) {
}
