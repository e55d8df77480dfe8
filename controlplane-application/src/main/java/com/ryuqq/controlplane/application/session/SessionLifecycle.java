package com.ryuqq.controlplane.application.session;

import com.ryuqq.controlplane.application.ledger.Ledger;
import com.ryuqq.controlplane.application.support.StateQueries;
import com.ryuqq.controlplane.core.error.ControlPlaneException;
import com.ryuqq.controlplane.core.model.Session;
import com.ryuqq.controlplane.core.model.SessionEvent;
import com.ryuqq.controlplane.core.model.Template;
import com.ryuqq.controlplane.core.model.TemplateVersion;
import com.ryuqq.controlplane.core.model.UsageKind;
import com.ryuqq.controlplane.core.model.VersionStatus;
import com.ryuqq.controlplane.core.model.Workspace;
import com.ryuqq.controlplane.core.state.StateDocument;
import com.ryuqq.controlplane.core.statemachine.SessionState;
import com.ryuqq.controlplane.core.statemachine.SessionTransitions;
import com.ryuqq.controlplane.core.util.Ids;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 세션 상태 전이 공용 로직.
 *
 * <p>{@link SessionService}와 reconcile 스윕이 함께 사용합니다.
 * 모든 전이는 같은 draft에 {@link SessionEvent}와 감사 로그를 남깁니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class SessionLifecycle {

    public static final String REASON_RESTART = "restart";
    public static final String REASON_RECONCILE = "reconcile";

    private SessionLifecycle() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이 1단계를 적용하고 이벤트와 감사 로그를 기록합니다.
     *
     * @throws IllegalStateException 허용되지 않은 전이
     */
    public static SessionEvent transition(
        StateDocument draft,
        Session session,
        SessionState target,
        Instant now,
        String actorUserId,
        Map<String, String> details
    ) {
        SessionState from = session.getState();
        session.setState(SessionTransitions.transition(from, target));
        session.setUpdatedAt(now);
        if (target == SessionState.RUNNING) {
            session.setLastStartedAt(now);
        } else if (target == SessionState.SLEEPING) {
            session.setLastStoppedAt(now);
        }
        Map<String, String> eventDetails = new LinkedHashMap<>(details);
        eventDetails.put("from", from.wireName());
        return record(draft, session, now, actorUserId, "session." + target.wireName(), eventDetails);
    }

    /**
     * 상태 변화 없이 현재 상태로 이벤트를 기록합니다 (생성, 스냅샷 복원 등).
     */
    public static SessionEvent record(
        StateDocument draft,
        Session session,
        Instant now,
        String actorUserId,
        String action,
        Map<String, String> details
    ) {
        SessionEvent event = new SessionEvent();
        event.setId(Ids.next("sevt"));
        event.setSessionId(session.getId());
        event.setState(session.getState());
        event.setDetails(details);
        event.setCreatedAt(now);
        draft.getSessionEvents().add(event);
        Ledger.audit(draft, now, session.getWorkspaceId(), actorUserId, action, "session", session.getId(), details);
        return event;
    }

    /**
     * CREATED/SLEEPING 세션을 STARTING → RUNNING으로 시작합니다.
     *
     * <p>템플릿 활성 버전이 READY여야 하고, 실행 중 세션 수가 유효 한도 미만이어야 합니다.
     * 검사 실패 시 상태는 바뀌지 않습니다.</p>
     */
    public static void start(
        StateDocument draft,
        Session session,
        Workspace workspace,
        Instant now,
        String actorUserId,
        Map<String, String> details
    ) {
        if (!session.getState().isStartable()) {
            throw ControlPlaneException.conflict(
                "Session cannot be started from " + session.getState().wireName());
        }
        requireReadyActiveVersion(draft, session.getTemplateId());
        long running = StateQueries.runningSessionCount(draft, workspace.getId());
        if (running >= workspace.effectiveMaxRunningSessions()) {
            throw ControlPlaneException.conflict(
                "Running session limit reached (" + workspace.effectiveMaxRunningSessions() + ")");
        }
        transition(draft, session, SessionState.STARTING, now, actorUserId, details);
        transition(draft, session, SessionState.RUNNING, now, actorUserId, details);
        Ledger.usage(draft, now, workspace.getId(), UsageKind.RUNTIME_MINUTES, 1, Map.of("sessionId", session.getId()));
    }

    /**
     * STARTING/RUNNING 세션을 STOPPING → SLEEPING으로 재웁니다.
     */
    public static void sleep(
        StateDocument draft,
        Session session,
        Instant now,
        String actorUserId,
        Map<String, String> details
    ) {
        if (!session.getState().isStoppable()) {
            throw ControlPlaneException.conflict(
                "Session cannot be stopped from " + session.getState().wireName());
        }
        transition(draft, session, SessionState.STOPPING, now, actorUserId, details);
        transition(draft, session, SessionState.SLEEPING, now, actorUserId, details);
    }

    /**
     * 템플릿의 활성 버전 (READY 필수).
     */
    public static TemplateVersion requireReadyActiveVersion(StateDocument draft, String templateId) {
        Template template = StateQueries.findTemplate(draft, templateId)
            .orElseThrow(() -> ControlPlaneException.conflict("Session template no longer exists"));
        if (template.getActiveVersionId() == null) {
            throw ControlPlaneException.conflict("Template has no active version");
        }
        return StateQueries.findVersion(draft, template.getActiveVersionId())
            .filter(v -> v.getStatus() == VersionStatus.READY)
            .orElseThrow(() -> ControlPlaneException.conflict("Template active version is not ready"));
    }
}
