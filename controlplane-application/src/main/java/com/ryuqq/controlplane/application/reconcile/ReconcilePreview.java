package com.ryuqq.controlplane.application.reconcile;

/**
 * 다음 스윕이 처리할 대상 수 (상태 변경 없음).
 */
public record ReconcilePreview(
    int stuckBuilds,
    int processableBuilds,
    int idleRunningSessions,
    int deletedSessions,
    int staleSleepingSessions,
    int orphanSnapshots,
    int expiredUploadGrants
) {
}
