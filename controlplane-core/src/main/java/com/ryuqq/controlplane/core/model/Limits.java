package com.ryuqq.controlplane.core.model;

/**
 * 워크스페이스 실효 쿼터.
 *
 * @param maxTemplates 최대 템플릿 수
 * @param maxRunningSessions 최대 동시 실행 세션 수
 * @author Control Plane Team
 * @since 1.0.0
 */
public record Limits(int maxTemplates, int maxRunningSessions) {
}
