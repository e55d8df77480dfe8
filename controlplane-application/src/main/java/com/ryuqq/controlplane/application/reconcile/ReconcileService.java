package com.ryuqq.controlplane.application.reconcile;

import com.ryuqq.controlplane.application.ledger.Ledger;
import com.ryuqq.controlplane.application.session.SessionLifecycle;
import com.ryuqq.controlplane.application.support.AccessGuard;
import com.ryuqq.controlplane.application.support.AuthContext;
import com.ryuqq.controlplane.application.support.DispatchSupport;
import com.ryuqq.controlplane.application.support.StateQueries;
import com.ryuqq.controlplane.application.template.BuildPipeline;
import com.ryuqq.controlplane.core.config.ControlPlaneConfig;
import com.ryuqq.controlplane.core.model.Session;
import com.ryuqq.controlplane.core.model.Snapshot;
import com.ryuqq.controlplane.core.model.Template;
import com.ryuqq.controlplane.core.model.TemplateBuild;
import com.ryuqq.controlplane.core.model.TemplateVersion;
import com.ryuqq.controlplane.core.model.UploadGrant;
import com.ryuqq.controlplane.core.spi.JobDispatcher;
import com.ryuqq.controlplane.core.spi.ObjectStore;
import com.ryuqq.controlplane.core.spi.ObjectTarget;
import com.ryuqq.controlplane.core.state.StateDocument;
import com.ryuqq.controlplane.core.statemachine.SessionState;
import com.ryuqq.controlplane.core.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Reconcile 스윕.
 *
 * <p>한 트랜잭션 안에서 다음 단계를 순서대로 실행합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. stuck 빌드 복구 (BUILDING이 stuckBuildThreshold 초과 → RETRYING)
 * 2. 대기 빌드 처리 (QUEUED/RETRYING)
 * 3. 유휴 세션 재우기 (RUNNING이 runningIdleThreshold 초과 → SLEEPING)
 * 4. DELETED 세션 제거 (이벤트, 스냅샷, 런타임 토큰 포함)
 * 5. 보존 기간이 지난 SLEEPING 세션 제거
 * 6. 만료된 업로드 그랜트 제거
 * 7. 세션이 사라진 스냅샷 제거
 * </pre>
 *
 * <p>개별 엔티티 처리 중 예외가 나면 에러 로그를 남기고 다음 엔티티로 넘어갑니다.
 * 오브젝트 스토어 내용은 커밋 이후 삭제합니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class ReconcileService {

    private static final Logger log = LoggerFactory.getLogger(ReconcileService.class);

    private final StateStore stateStore;
    private final Clock clock;
    private final ControlPlaneConfig config;
    private final BuildPipeline buildPipeline;
    private final ObjectStore objectStore;
    private final JobDispatcher jobDispatcher;

    public ReconcileService(
        StateStore stateStore,
        Clock clock,
        ControlPlaneConfig config,
        BuildPipeline buildPipeline,
        ObjectStore objectStore,
        JobDispatcher jobDispatcher
    ) {
        if (stateStore == null) {
            throw new IllegalArgumentException("stateStore cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (buildPipeline == null) {
            throw new IllegalArgumentException("buildPipeline cannot be null");
        }
        if (objectStore == null) {
            throw new IllegalArgumentException("objectStore cannot be null");
        }
        if (jobDispatcher == null) {
            throw new IllegalArgumentException("jobDispatcher cannot be null");
        }
        this.stateStore = stateStore;
        this.clock = clock;
        this.config = config;
        this.buildPipeline = buildPipeline;
        this.objectStore = objectStore;
        this.jobDispatcher = jobDispatcher;
    }

    // ============================================================
    // 전체 스윕
    // ============================================================

    /**
     * 모든 워크스페이스 대상 시스템 스윕.
     */
    public ReconcileReport reconcile() {
        return sweep(null, Scope.everyWorkspace());
    }

    /**
     * 호출자 워크스페이스 대상 스윕 (owner/admin).
     */
    public ReconcileReport reconcile(String token) {
        return sweep(token, null);
    }

    private ReconcileReport sweep(String token, Scope fixedScope) {
        log.info("Reconcile sweep started");
        List<ObjectTarget> garbage = new ArrayList<>();
        ReconcileReport report = stateStore.transact(state -> {
            Instant now = clock.instant();
            Scope scope = fixedScope;
            String actor = null;
            if (scope == null) {
                AuthContext auth = AccessGuard.requireManage(state, token, now);
                scope = Scope.workspace(auth.workspaceId());
                actor = auth.userId();
            }
            garbage.clear();

            int recovered = buildPipeline.recoverStuck(state, now, scope.workspaces()).size();
            int processed = processBuilds(state, now, scope, actor);
            int slept = sleepIdleSessions(state, now, scope, actor);
            PurgeCount deleted = purgeSessions(state, now, scope, actor, deletedSessions(state, scope), garbage);
            PurgeCount stale = purgeSessions(state, now, scope, actor, staleSleepingSessions(state, now, scope),
                garbage);
            int grants = purgeUploadGrants(state, now, scope);
            int orphans = purgeOrphanSnapshots(state, scope, garbage);

            return new ReconcileReport(recovered, processed, slept, deleted.sessions(), stale.sessions(),
                deleted.snapshots() + stale.snapshots() + orphans, grants);
        });
        deleteContent(garbage);
        log.info("Reconcile sweep completed: {}", report);
        return report;
    }

    /**
     * 다음 스윕 대상 수를 계산합니다 (상태 변경 없음).
     */
    public ReconcilePreview previewReconcile(String token) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            Scope scope = Scope.workspace(auth.workspaceId());
            int stuck = (int) state.getTemplateBuilds().stream()
                .filter(b -> buildPipeline.isStuck(b, now) && scope.includesBuild(state, b))
                .count();
            int processable = (int) state.getTemplateBuilds().stream()
                .filter(b -> b.getStatus().isProcessable() && scope.includesBuild(state, b))
                .count();
            return new ReconcilePreview(
                stuck,
                processable,
                idleRunningSessions(state, now, scope).size(),
                deletedSessions(state, scope).size(),
                staleSleepingSessions(state, now, scope).size(),
                orphanSnapshots(state, scope).size(),
                expiredUploadGrants(state, now, scope).size()
            );
        });
    }

    /**
     * 스윕을 디스패처에 요청합니다.
     *
     * @return 디스패처가 요청을 받았으면 true
     */
    public boolean enqueueReconcile(String token) {
        stateStore.transact(state -> AccessGuard.requireManage(state, token, clock.instant()));
        return DispatchSupport.enqueueReconcile(jobDispatcher);
    }

    // ============================================================
    // 개별 단계
    // ============================================================

    public int recoverStuckBuilds(String token) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            return buildPipeline.recoverStuck(state, now, auth.workspaceId()::equals).size();
        });
    }

    public int sleepRunningSessions(String token) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            return sleepIdleSessions(state, now, Scope.workspace(auth.workspaceId()), auth.userId());
        });
    }

    public int purgeDeletedSessions(String token) {
        List<ObjectTarget> garbage = new ArrayList<>();
        int purged = stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            Scope scope = Scope.workspace(auth.workspaceId());
            garbage.clear();
            return purgeSessions(state, now, scope, auth.userId(), deletedSessions(state, scope), garbage).sessions();
        });
        deleteContent(garbage);
        return purged;
    }

    public int purgeStaleSleepingSessions(String token) {
        List<ObjectTarget> garbage = new ArrayList<>();
        int purged = stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            Scope scope = Scope.workspace(auth.workspaceId());
            garbage.clear();
            return purgeSessions(state, now, scope, auth.userId(), staleSleepingSessions(state, now, scope),
                garbage).sessions();
        });
        deleteContent(garbage);
        return purged;
    }

    private int processBuilds(StateDocument state, Instant now, Scope scope, String actor) {
        List<TemplateBuild> candidates = state.getTemplateBuilds().stream()
            .filter(b -> b.getStatus().isProcessable() && scope.includesBuild(state, b))
            .toList();
        int processed = 0;
        for (TemplateBuild build : candidates) {
            try {
                if (buildPipeline.process(state, build, now, actor)) {
                    processed++;
                }
            } catch (Exception e) {
                log.error("Failed to process build {} in reconcile sweep", build.getId(), e);
            }
        }
        return processed;
    }

    private int sleepIdleSessions(StateDocument state, Instant now, Scope scope, String actor) {
        int slept = 0;
        for (Session session : idleRunningSessions(state, now, scope)) {
            try {
                SessionLifecycle.sleep(state, session, now, actor,
                    Map.of("reason", SessionLifecycle.REASON_RECONCILE));
                slept++;
            } catch (Exception e) {
                log.error("Failed to sleep idle session {} in reconcile sweep", session.getId(), e);
            }
        }
        return slept;
    }

    private PurgeCount purgeSessions(
        StateDocument state,
        Instant now,
        Scope scope,
        String actor,
        List<Session> targets,
        List<ObjectTarget> garbage
    ) {
        int sessions = 0;
        int snapshots = 0;
        for (Session session : targets) {
            try {
                snapshots += purgeSession(state, session, now, actor, garbage);
                sessions++;
            } catch (Exception e) {
                log.error("Failed to purge session {} in reconcile sweep", session.getId(), e);
            }
        }
        return new PurgeCount(sessions, snapshots);
    }

    /**
     * 세션과 이벤트, 스냅샷, 세션 런타임 토큰을 제거합니다.
     *
     * @return 함께 제거된 스냅샷 수
     */
    private int purgeSession(StateDocument state, Session session, Instant now, String actor,
                             List<ObjectTarget> garbage) {
        List<Snapshot> snapshots = state.getSnapshots().stream()
            .filter(s -> s.getSessionId().equals(session.getId()))
            .toList();
        snapshots.forEach(s -> garbage.add(ObjectTarget.snapshot(s.getId())));
        state.getSnapshots().removeAll(snapshots);
        state.getSessionEvents().removeIf(e -> e.getSessionId().equals(session.getId()));
        state.getAuthTokens().removeIf(t -> session.getId().equals(t.getSessionId()));
        state.getSessions().remove(session);
        Ledger.audit(state, now, session.getWorkspaceId(), actor, "session.purged", "session", session.getId(),
            Map.of("state", session.getState().wireName(), "snapshots", String.valueOf(snapshots.size())));
        return snapshots.size();
    }

    private int purgeUploadGrants(StateDocument state, Instant now, Scope scope) {
        List<UploadGrant> expired = expiredUploadGrants(state, now, scope);
        state.getUploadGrants().removeAll(expired);
        return expired.size();
    }

    private int purgeOrphanSnapshots(StateDocument state, Scope scope, List<ObjectTarget> garbage) {
        List<Snapshot> orphans = orphanSnapshots(state, scope);
        for (Snapshot snapshot : orphans) {
            garbage.add(ObjectTarget.snapshot(snapshot.getId()));
            log.warn("Purging orphan snapshot {} (session {} missing)", snapshot.getId(), snapshot.getSessionId());
        }
        state.getSnapshots().removeAll(orphans);
        return orphans.size();
    }

    private void deleteContent(List<ObjectTarget> garbage) {
        for (ObjectTarget target : garbage) {
            try {
                objectStore.delete(target);
            } catch (Exception e) {
                log.error("Failed to delete {} {} after reconcile", target.kind(), target.id(), e);
            }
        }
    }

    // ============================================================
    // 대상 선정
    // ============================================================

    private List<Session> idleRunningSessions(StateDocument state, Instant now, Scope scope) {
        Instant cutoff = now.minus(config.runningIdleThreshold());
        return state.getSessions().stream()
            .filter(s -> s.getState() == SessionState.RUNNING && scope.includes(s.getWorkspaceId()))
            .filter(s -> s.getLastStartedAt() != null && !s.getLastStartedAt().isAfter(cutoff))
            .toList();
    }

    private static List<Session> deletedSessions(StateDocument state, Scope scope) {
        return state.getSessions().stream()
            .filter(s -> s.getState() == SessionState.DELETED && scope.includes(s.getWorkspaceId()))
            .toList();
    }

    private List<Session> staleSleepingSessions(StateDocument state, Instant now, Scope scope) {
        return state.getSessions().stream()
            .filter(s -> s.getState() == SessionState.SLEEPING && scope.includes(s.getWorkspaceId()))
            .filter(s -> s.getLastStoppedAt() != null
                && !s.getLastStoppedAt().plus(retentionOf(state, s)).isAfter(now))
            .toList();
    }

    /**
     * 활성 버전 매니페스트의 sleepTtlSeconds, 없으면 기본 보존 기간.
     */
    private Duration retentionOf(StateDocument state, Session session) {
        return StateQueries.findTemplate(state, session.getTemplateId())
            .map(Template::getActiveVersionId)
            .flatMap(versionId -> StateQueries.findVersion(state, versionId))
            .map(TemplateVersion::getManifest)
            .filter(manifest -> manifest.getSleepTtlSeconds() != null)
            .map(manifest -> Duration.ofSeconds(manifest.getSleepTtlSeconds()))
            .orElse(config.sleepingRetention());
    }

    private static List<UploadGrant> expiredUploadGrants(StateDocument state, Instant now, Scope scope) {
        return state.getUploadGrants().stream()
            .filter(g -> scope.includes(g.getWorkspaceId()) && !g.getExpiresAt().isAfter(now))
            .toList();
    }

    /**
     * 세션이 존재하지 않는 스냅샷. 소속 워크스페이스를 알 수 없으므로 전역 스윕에서만 대상입니다.
     */
    private static List<Snapshot> orphanSnapshots(StateDocument state, Scope scope) {
        if (!scope.global()) {
            return List.of();
        }
        Set<String> sessionIds = state.getSessions().stream().map(Session::getId).collect(Collectors.toSet());
        return state.getSnapshots().stream().filter(s -> !sessionIds.contains(s.getSessionId())).toList();
    }

    private record PurgeCount(int sessions, int snapshots) {
    }

    private record Scope(Predicate<String> workspaces, boolean global) {

        static Scope everyWorkspace() {
            return new Scope(workspaceId -> true, true);
        }

        static Scope workspace(String workspaceId) {
            return new Scope(workspaceId::equals, false);
        }

        boolean includes(String workspaceId) {
            return workspaces.test(workspaceId);
        }

        boolean includesBuild(StateDocument state, TemplateBuild build) {
            return StateQueries.templateOfBuild(state, build).map(t -> includes(t.getWorkspaceId())).orElse(false);
        }
    }
}
