package com.ryuqq.controlplane.application.ledger;

import com.ryuqq.controlplane.application.support.AccessGuard;
import com.ryuqq.controlplane.application.support.AuthContext;
import com.ryuqq.controlplane.application.support.StateQueries;
import com.ryuqq.controlplane.core.config.ControlPlaneConfig;
import com.ryuqq.controlplane.core.error.ControlPlaneException;
import com.ryuqq.controlplane.core.model.AuditLog;
import com.ryuqq.controlplane.core.model.TemplateBuild;
import com.ryuqq.controlplane.core.state.EntityCollection;
import com.ryuqq.controlplane.core.state.StateDocument;
import com.ryuqq.controlplane.core.statemachine.BuildStatus;
import com.ryuqq.controlplane.core.statemachine.SessionState;
import com.ryuqq.controlplane.core.store.StateStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 사용량, 감사 로그, 운영 리포트 조회.
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class UsageService {

    /** 감사 로그 조회 기본 개수. */
    public static final int DEFAULT_AUDIT_LIMIT = 50;

    private static final Set<EntityCollection> AUTH_SCOPE = EntityCollection.scope(
        EntityCollection.AUTH_TOKENS,
        EntityCollection.USERS,
        EntityCollection.WORKSPACES,
        EntityCollection.MEMBERSHIPS
    );

    private final StateStore stateStore;
    private final Clock clock;
    private final ControlPlaneConfig config;

    public UsageService(StateStore stateStore, Clock clock, ControlPlaneConfig config) {
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

    public UsageReport getUsage(String token) {
        return stateStore.transactCollections(with(EntityCollection.USAGE_EVENTS), state -> {
            AuthContext auth = AccessGuard.requireAuth(state, token, clock.instant());
            return new UsageReport(
                auth.workspace().getPlan(),
                auth.workspace().getLimits(),
                Ledger.summarize(state, auth.workspaceId())
            );
        });
    }

    /**
     * 최신 순 감사 로그.
     *
     * @param limit 최대 개수 (1 이상)
     */
    public List<AuditLog> getAudit(String token, int limit) {
        if (limit <= 0) {
            throw ControlPlaneException.badRequest("limit must be positive (current: " + limit + ")");
        }
        return stateStore.transactCollections(with(EntityCollection.AUDIT_LOGS), state -> {
            AuthContext auth = AccessGuard.requireAuth(state, token, clock.instant());
            List<AuditLog> items = new ArrayList<>();
            for (AuditLog entry : state.getAuditLogs()) {
                if (entry.getWorkspaceId() != null && entry.getWorkspaceId().equals(auth.workspaceId())) {
                    items.add(entry);
                }
            }
            Collections.reverse(items);
            return items.size() > limit ? new ArrayList<>(items.subList(0, limit)) : items;
        });
    }

    public List<AuditLog> getAudit(String token) {
        return getAudit(token, DEFAULT_AUDIT_LIMIT);
    }

    public AdminReport getAdminReport(String token) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            String workspaceId = auth.workspaceId();
            Instant stuckBefore = now.minus(config.stuckBuildThreshold());

            long queued = 0;
            long building = 0;
            long stuck = 0;
            long deadLettered = 0;
            for (TemplateBuild build : state.getTemplateBuilds()) {
                boolean inWorkspace = StateQueries.templateOfBuild(state, build)
                    .map(t -> t.getWorkspaceId().equals(workspaceId))
                    .orElse(false);
                if (!inWorkspace) {
                    continue;
                }
                if (build.getStatus().isProcessable()) {
                    queued++;
                } else if (build.getStatus() == BuildStatus.BUILDING) {
                    building++;
                    if (build.getStartedAt() != null && build.getStartedAt().isBefore(stuckBefore)) {
                        stuck++;
                    }
                } else if (build.getStatus() == BuildStatus.DEAD_LETTERED) {
                    deadLettered++;
                }
            }

            return new AdminReport(
                workspaceId,
                StateQueries.memberCount(state, workspaceId),
                state.getTemplates().stream().filter(t -> t.getWorkspaceId().equals(workspaceId)).count(),
                queued,
                building,
                stuck,
                deadLettered,
                countSessions(state, workspaceId, SessionState.RUNNING),
                countSessions(state, workspaceId, SessionState.SLEEPING),
                state.getSessions().stream()
                    .filter(s -> s.getWorkspaceId().equals(workspaceId) && s.getState() != SessionState.DELETED)
                    .count(),
                state.getBindingReleases().stream().filter(r -> r.getWorkspaceId().equals(workspaceId)).count(),
                state.getUploadGrants().stream()
                    .filter(g -> g.getWorkspaceId().equals(workspaceId))
                    .filter(g -> g.getUsedAt() == null && g.getExpiresAt().isAfter(now))
                    .count()
            );
        });
    }

    private static long countSessions(StateDocument state, String workspaceId, SessionState sessionState) {
        return state.getSessions().stream()
            .filter(s -> s.getWorkspaceId().equals(workspaceId) && s.getState() == sessionState)
            .count();
    }

    private static Set<EntityCollection> with(EntityCollection collection) {
        EnumSet<EntityCollection> scope = EnumSet.copyOf(AUTH_SCOPE);
        scope.add(collection);
        return scope;
    }
}
