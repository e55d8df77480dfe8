package com.ryuqq.controlplane.application.ledger;

import com.ryuqq.controlplane.core.model.AuditLog;
import com.ryuqq.controlplane.core.model.UsageEvent;
import com.ryuqq.controlplane.core.model.UsageKind;
import com.ryuqq.controlplane.core.state.StateDocument;
import com.ryuqq.controlplane.core.util.Ids;

import java.time.Instant;
import java.util.Map;

/**
 * 감사 로그와 사용량 이벤트 기록.
 *
 * <p>항상 호출한 연산과 같은 트랜잭션 draft에 추가되므로 연산이 실패하면
 * 기록도 함께 사라집니다. 두 컬렉션 모두 추가 전용입니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class Ledger {

    private Ledger() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 감사 로그 추가.
     *
     * @param actorUserId 행위자 (시스템 동작이면 null)
     */
    public static AuditLog audit(
        StateDocument draft,
        Instant now,
        String workspaceId,
        String actorUserId,
        String action,
        String targetType,
        String targetId,
        Map<String, String> details
    ) {
        AuditLog entry = new AuditLog();
        entry.setId(Ids.next("audit"));
        entry.setWorkspaceId(workspaceId);
        entry.setActorUserId(actorUserId);
        entry.setAction(action);
        entry.setTargetType(targetType);
        entry.setTargetId(targetId);
        entry.setDetails(details);
        entry.setCreatedAt(now);
        draft.getAuditLogs().add(entry);
        return entry;
    }

    public static AuditLog audit(
        StateDocument draft,
        Instant now,
        String workspaceId,
        String actorUserId,
        String action,
        String targetType,
        String targetId
    ) {
        return audit(draft, now, workspaceId, actorUserId, action, targetType, targetId, Map.of());
    }

    /**
     * 사용량 이벤트 추가.
     */
    public static UsageEvent usage(
        StateDocument draft,
        Instant now,
        String workspaceId,
        UsageKind kind,
        long value,
        Map<String, String> details
    ) {
        UsageEvent event = new UsageEvent();
        event.setId(Ids.next("usage"));
        event.setWorkspaceId(workspaceId);
        event.setKind(kind);
        event.setValue(value);
        event.setDetails(details);
        event.setCreatedAt(now);
        draft.getUsageEvents().add(event);
        return event;
    }

    /**
     * 워크스페이스 사용량 합계 (선형 스캔).
     */
    public static UsageSummary summarize(StateDocument state, String workspaceId) {
        long runtimeMinutes = 0;
        long snapshots = 0;
        long templateBuilds = 0;
        for (UsageEvent event : state.getUsageEvents()) {
            if (!event.getWorkspaceId().equals(workspaceId)) {
                continue;
            }
            switch (event.getKind()) {
                case RUNTIME_MINUTES -> runtimeMinutes += event.getValue();
                case SNAPSHOT -> snapshots += event.getValue();
                case TEMPLATE_BUILD -> templateBuilds += event.getValue();
            }
        }
        return new UsageSummary(runtimeMinutes, snapshots, templateBuilds);
    }
}
