package com.ryuqq.controlplane.application.ledger;

/**
 * 워크스페이스 사용량 합계.
 *
 * @param runtimeMinutes 세션 실행 분
 * @param snapshots 생성된 스냅샷 수
 * @param templateBuilds 성공한 템플릿 빌드 수
 * @author Control Plane Team
 * @since 1.0.0
 */
public record UsageSummary(long runtimeMinutes, long snapshots, long templateBuilds) {
}
