package com.ryuqq.controlplane.application.identity;

import java.time.Instant;

/**
 * 로그인 그룹 요약.
 *
 * @param authSessionId 그룹 ID
 * @param activeTokens 활성 토큰 수
 * @param createdAt 가장 먼저 발급된 토큰 시각
 * @param expiresAt 가장 늦은 만료 시각
 * @param current 호출자 토큰이 속한 그룹인지
 * @author Control Plane Team
 * @since 1.0.0
 */
public record AuthSessionView(
    String authSessionId,
    int activeTokens,
    Instant createdAt,
    Instant expiresAt,
    boolean current
) {
}
