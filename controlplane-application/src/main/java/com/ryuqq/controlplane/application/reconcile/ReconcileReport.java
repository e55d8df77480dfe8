package com.ryuqq.controlplane.application.reconcile;

/**
 * reconcile 스윕 1회 결과.
 *
 * @param recoveredStuckBuilds RETRYING으로 되돌린 stuck 빌드 수
 * @param processedBuilds 처리한 빌드 수
 * @param sleptSessions 유휴로 재운 세션 수
 * @param purgedDeletedSessions 제거한 DELETED 세션 수
 * @param purgedStaleSleepingSessions 보존 기간이 지나 제거한 SLEEPING 세션 수
 * @param purgedSnapshots 제거한 스냅샷 수 (세션과 함께 제거된 것 포함)
 * @param purgedUploadGrants 제거한 만료 업로드 그랜트 수
 * @author Control Plane Team
 * @since 1.0.0
 */
public record ReconcileReport(
    int recoveredStuckBuilds,
    int processedBuilds,
    int sleptSessions,
    int purgedDeletedSessions,
    int purgedStaleSleepingSessions,
    int purgedSnapshots,
    int purgedUploadGrants
) {

    public int total() {
        return recoveredStuckBuilds + processedBuilds + sleptSessions + purgedDeletedSessions
            + purgedStaleSleepingSessions + purgedSnapshots + purgedUploadGrants;
    }
}
