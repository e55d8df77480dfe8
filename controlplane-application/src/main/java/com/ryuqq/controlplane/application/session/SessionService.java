package com.ryuqq.controlplane.application.session;

import com.ryuqq.controlplane.application.identity.TokenIssuer;
import com.ryuqq.controlplane.application.ledger.Ledger;
import com.ryuqq.controlplane.application.support.AccessGuard;
import com.ryuqq.controlplane.application.support.AuthContext;
import com.ryuqq.controlplane.application.support.StateQueries;
import com.ryuqq.controlplane.core.config.ControlPlaneConfig;
import com.ryuqq.controlplane.core.error.ControlPlaneException;
import com.ryuqq.controlplane.core.model.AuthToken;
import com.ryuqq.controlplane.core.model.Session;
import com.ryuqq.controlplane.core.model.SessionEvent;
import com.ryuqq.controlplane.core.model.Snapshot;
import com.ryuqq.controlplane.core.model.Template;
import com.ryuqq.controlplane.core.model.TokenKind;
import com.ryuqq.controlplane.core.model.WorkspaceSecret;
import com.ryuqq.controlplane.core.state.StateDocument;
import com.ryuqq.controlplane.core.statemachine.SessionState;
import com.ryuqq.controlplane.core.store.StateStore;
import com.ryuqq.controlplane.core.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 세션 생명주기 관리.
 *
 * <p><strong>상태 흐름:</strong></p>
 * <pre>
 * created → starting → running → stopping → sleeping → starting → ...
 * (삭제되지 않은 모든 상태) → deleted
 * </pre>
 *
 * <p>시작 시 워크스페이스의 실행 중 세션 한도를 검사합니다 (STARTING/RUNNING 합계).
 * 세션 저장공간은 reconcile 스윕이 회수합니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final StateStore stateStore;
    private final Clock clock;
    private final ControlPlaneConfig config;

    public SessionService(StateStore stateStore, Clock clock, ControlPlaneConfig config) {
        if (stateStore == null) {
            throw new IllegalArgumentException("stateStore cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.stateStore = stateStore;
        this.clock = clock;
        this.config = config;
    }

    /**
     * 세션 생성 (CREATED). 템플릿의 활성 버전이 READY여야 합니다.
     */
    public Session createSession(String token, String name, String templateId) {
        if (name == null || name.isBlank()) {
            throw ControlPlaneException.badRequest("Session name is required");
        }
        String trimmed = name.trim();
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireWrite(state, token, now);
            Template template = StateQueries.requireTemplate(state, auth.workspaceId(), templateId);
            if (template.isArchived()) {
                throw ControlPlaneException.conflict("Template is archived");
            }
            SessionLifecycle.requireReadyActiveVersion(state, template.getId());
            boolean duplicate = state.getSessions().stream()
                .anyMatch(s -> s.getWorkspaceId().equals(auth.workspaceId())
                    && s.getState() != SessionState.DELETED
                    && s.getName().equalsIgnoreCase(trimmed));
            if (duplicate) {
                throw ControlPlaneException.conflict("Session name already exists");
            }

            Session session = new Session();
            session.setId(Ids.next("ses"));
            session.setWorkspaceId(auth.workspaceId());
            session.setTemplateId(template.getId());
            session.setName(trimmed);
            session.setState(SessionState.CREATED);
            session.setCreatedByUserId(auth.userId());
            session.setCreatedAt(now);
            session.setUpdatedAt(now);
            state.getSessions().add(session);
            SessionLifecycle.record(state, session, now, auth.userId(), "session.created",
                Map.of("templateId", template.getId()));
            return session;
        });
    }

    public Session startSession(String token, String sessionId) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireWrite(state, token, now);
            Session session = StateQueries.requireSession(state, auth.workspaceId(), sessionId);
            SessionLifecycle.start(state, session, auth.workspace(), now, auth.userId(), Map.of());
            log.info("Session {} started in workspace {}", session.getId(), auth.workspaceId());
            return session;
        });
    }

    public Session stopSession(String token, String sessionId) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireWrite(state, token, now);
            Session session = StateQueries.requireSession(state, auth.workspaceId(), sessionId);
            SessionLifecycle.sleep(state, session, now, auth.userId(), Map.of());
            return session;
        });
    }

    /**
     * 재시작. 실행 중이면 먼저 재운 뒤 다시 시작합니다.
     *
     * <p>이벤트에는 {@code reason=restart}가 남습니다.</p>
     */
    public Session restartSession(String token, String sessionId) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireWrite(state, token, now);
            Session session = StateQueries.requireSession(state, auth.workspaceId(), sessionId);
            Map<String, String> reason = Map.of("reason", SessionLifecycle.REASON_RESTART);
            if (session.getState().isStoppable()) {
                SessionLifecycle.sleep(state, session, now, auth.userId(), reason);
            }
            SessionLifecycle.start(state, session, auth.workspace(), now, auth.userId(), reason);
            return session;
        });
    }

    /**
     * 세션 삭제 (DELETED). 세션에 묶인 런타임 토큰을 폐기합니다.
     */
    public Session deleteSession(String token, String sessionId) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireWrite(state, token, now);
            Session session = StateQueries.requireSession(state, auth.workspaceId(), sessionId);
            SessionLifecycle.transition(state, session, SessionState.DELETED, now, auth.userId(), Map.of());
            int revoked = revokeRuntimeTokens(state, session.getId(), now);
            log.info("Session {} deleted ({} runtime tokens revoked)", session.getId(), revoked);
            return session;
        });
    }

    private static int revokeRuntimeTokens(StateDocument state, String sessionId, Instant now) {
        int revoked = 0;
        for (AuthToken authToken : state.getAuthTokens()) {
            if (authToken.getKind() == TokenKind.RUNTIME
                && sessionId.equals(authToken.getSessionId())
                && authToken.getRevokedAt() == null) {
                authToken.setRevokedAt(now);
                revoked++;
            }
        }
        return revoked;
    }

    public List<Session> listSessions(String token) {
        return stateStore.transact(state -> {
            AuthContext auth = AccessGuard.requireAuth(state, token, clock.instant());
            return state.getSessions().stream()
                .filter(s -> s.getWorkspaceId().equals(auth.workspaceId()) && s.getState() != SessionState.DELETED)
                .toList();
        });
    }

    public SessionDetail getSession(String token, String sessionId) {
        return stateStore.transact(state -> {
            AuthContext auth = AccessGuard.requireAuth(state, token, clock.instant());
            Session session = StateQueries.requireSession(state, auth.workspaceId(), sessionId);
            List<Snapshot> snapshots = state.getSnapshots().stream()
                .filter(s -> s.getSessionId().equals(session.getId()))
                .toList();
            return new SessionDetail(session, snapshots, eventsOf(state, session.getId()));
        });
    }

    public List<SessionEvent> listSessionEvents(String token, String sessionId) {
        return stateStore.transact(state -> {
            AuthContext auth = AccessGuard.requireAuth(state, token, clock.instant());
            Session session = StateQueries.requireSession(state, auth.workspaceId(), sessionId);
            return eventsOf(state, session.getId());
        });
    }

    private static List<SessionEvent> eventsOf(StateDocument state, String sessionId) {
        return state.getSessionEvents().stream().filter(e -> e.getSessionId().equals(sessionId)).toList();
    }

    /**
     * 스냅샷 복원 기록. 스냅샷은 같은 세션 소속이고 내용이 업로드되어 있어야 합니다.
     */
    public Session restoreSnapshot(String token, String sessionId, String snapshotId) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireWrite(state, token, now);
            Session session = StateQueries.requireSession(state, auth.workspaceId(), sessionId);
            Snapshot snapshot = state.getSnapshots().stream()
                .filter(s -> s.getId().equals(snapshotId))
                .findFirst()
                .orElseThrow(() -> ControlPlaneException.notFound("Snapshot not found"));
            if (!snapshot.getSessionId().equals(session.getId())) {
                throw ControlPlaneException.conflict("Snapshot belongs to another session");
            }
            if (snapshot.getUploadedAt() == null) {
                throw ControlPlaneException.conflict("Snapshot has no content");
            }
            session.setLastRestoredSnapshotId(snapshot.getId());
            session.setUpdatedAt(now);
            SessionLifecycle.record(state, session, now, auth.userId(), "session.snapshot_restored",
                Map.of("snapshotId", snapshot.getId()));
            return session;
        });
    }

    // ============================================================
    // 런타임 토큰
    // ============================================================

    /**
     * RUNNING 세션에 묶인 단기 런타임 토큰 발급.
     */
    public AuthToken issueRuntimeToken(String token, String sessionId) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireWrite(state, token, now);
            Session session = StateQueries.requireSession(state, auth.workspaceId(), sessionId);
            if (session.getState() != SessionState.RUNNING) {
                throw ControlPlaneException.conflict("Session is not running");
            }
            AuthToken runtimeToken = TokenIssuer.issue(state, now, auth.userId(), auth.workspaceId(),
                TokenKind.RUNTIME, auth.token().getAuthSessionId(), session.getId(), config.runtimeTokenTtl());
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "session.runtime_token_issued", "session",
                session.getId(), Map.of("expiresAt", runtimeToken.getExpiresAt().toString()));
            return runtimeToken;
        });
    }

    /**
     * 런타임 토큰 검증.
     *
     * @return 토큰이 묶인 실행 중 세션
     * @throws ControlPlaneException 런타임 토큰이 아니면 UNAUTHORIZED, 세션 불일치면 FORBIDDEN,
     *                               세션이 실행 중이 아니면 CONFLICT
     */
    public Session requireRuntimeToken(String token, String sessionId) {
        return stateStore.transact(state -> runtimeSession(state, token, sessionId, clock.instant()));
    }

    /**
     * 실행 중 세션에 주입할 워크스페이스 시크릿 (이름 순).
     *
     * <p>값을 돌려주는 유일한 경로이며 런타임 토큰으로만 호출할 수 있습니다.</p>
     */
    public Map<String, String> getRuntimeSecrets(String token, String sessionId) {
        return stateStore.transact(state -> {
            Session session = runtimeSession(state, token, sessionId, clock.instant());
            Map<String, String> secrets = new TreeMap<>();
            for (WorkspaceSecret secret : state.getWorkspaceSecrets()) {
                if (secret.getWorkspaceId().equals(session.getWorkspaceId())) {
                    secrets.put(secret.getName(), secret.getValue());
                }
            }
            return secrets;
        });
    }

    private static Session runtimeSession(StateDocument state, String token, String sessionId, Instant now) {
        AuthToken runtimeToken = AccessGuard.requireActiveToken(state, token, now);
        if (runtimeToken.getKind() != TokenKind.RUNTIME) {
            throw ControlPlaneException.unauthorized("Runtime token required");
        }
        if (!runtimeToken.getSessionId().equals(sessionId)) {
            throw ControlPlaneException.forbidden("Runtime token is bound to another session");
        }
        Session session = StateQueries.findSession(state, sessionId)
            .filter(s -> s.getState() != SessionState.DELETED)
            .orElseThrow(() -> ControlPlaneException.notFound("Session not found"));
        if (session.getState() != SessionState.RUNNING) {
            throw ControlPlaneException.conflict("Session is not running");
        }
        return session;
    }
}
