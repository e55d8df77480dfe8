package com.ryuqq.controlplane.application.ledger;

/**
 * 워크스페이스 운영 리포트.
 *
 * @param workspaceId 워크스페이스 ID
 * @param members 멤버 수
 * @param templates 템플릿 수
 * @param buildsQueued QUEUED/RETRYING 빌드 수
 * @param buildsBuilding BUILDING 빌드 수
 * @param buildsStuck stuck 판정 기준을 넘긴 BUILDING 빌드 수
 * @param buildsDeadLettered DEAD_LETTERED 빌드 수
 * @param sessionsRunning 실행 중 세션 수
 * @param sessionsSleeping 슬립 세션 수
 * @param sessionsTotal 삭제되지 않은 세션 수
 * @param releases 바인딩 릴리스 수
 * @param activeUploadGrants 미사용이며 만료되지 않은 업로드 그랜트 수
 * @author Control Plane Team
 * @since 1.0.0
 */
public record AdminReport(
    String workspaceId,
    long members,
    long templates,
    long buildsQueued,
    long buildsBuilding,
    long buildsStuck,
    long buildsDeadLettered,
    long sessionsRunning,
    long sessionsSleeping,
    long sessionsTotal,
    long releases,
    long activeUploadGrants
) {
}
