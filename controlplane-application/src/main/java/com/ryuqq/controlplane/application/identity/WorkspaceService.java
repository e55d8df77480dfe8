package com.ryuqq.controlplane.application.identity;

import com.ryuqq.controlplane.application.ledger.Ledger;
import com.ryuqq.controlplane.application.support.AccessGuard;
import com.ryuqq.controlplane.application.support.AuthContext;
import com.ryuqq.controlplane.application.support.StateQueries;
import com.ryuqq.controlplane.core.config.ControlPlaneConfig;
import com.ryuqq.controlplane.core.error.ControlPlaneException;
import com.ryuqq.controlplane.core.model.InviteStatus;
import com.ryuqq.controlplane.core.model.MemberRole;
import com.ryuqq.controlplane.core.model.Membership;
import com.ryuqq.controlplane.core.model.Plan;
import com.ryuqq.controlplane.core.model.QuotaOverrides;
import com.ryuqq.controlplane.core.model.Session;
import com.ryuqq.controlplane.core.model.Snapshot;
import com.ryuqq.controlplane.core.model.Template;
import com.ryuqq.controlplane.core.model.TemplateBuild;
import com.ryuqq.controlplane.core.model.TemplateVersion;
import com.ryuqq.controlplane.core.model.User;
import com.ryuqq.controlplane.core.model.Workspace;
import com.ryuqq.controlplane.core.model.WorkspaceInvite;
import com.ryuqq.controlplane.core.model.WorkspaceSecret;
import com.ryuqq.controlplane.core.state.StateDocument;
import com.ryuqq.controlplane.core.store.StateStore;
import com.ryuqq.controlplane.core.util.Ids;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 워크스페이스 멤버십, 초대, 플랜, 쿼터 관리.
 *
 * <p><strong>권한:</strong></p>
 * <ul>
 *   <li>조회: 모든 멤버</li>
 *   <li>초대 생성, 역할 변경, 플랜/쿼터/이름 변경: owner 또는 admin</li>
 *   <li>시크릿 변경, 내보내기: owner 또는 admin</li>
 *   <li>owner 역할은 변경하거나 부여할 수 없음</li>
 * </ul>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class WorkspaceService {

    private static final Pattern SECRET_NAME = Pattern.compile("[A-Z_][A-Z0-9_]{0,63}");
    static final int MAX_SECRET_VALUE_LENGTH = 4096;

    private final StateStore stateStore;
    private final Clock clock;
    private final ControlPlaneConfig config;

    public WorkspaceService(StateStore stateStore, Clock clock, ControlPlaneConfig config) {
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
     * 호출자가 멤버인 워크스페이스 목록.
     */
    public List<WorkspaceView> listWorkspaces(String token) {
        return stateStore.transact(state -> {
            AuthContext auth = AccessGuard.requireAuth(state, token, clock.instant());
            List<WorkspaceView> views = new ArrayList<>();
            for (Membership membership : state.getMemberships()) {
                if (!membership.getUserId().equals(auth.userId())) {
                    continue;
                }
                StateQueries.findWorkspace(state, membership.getWorkspaceId()).ifPresent(workspace ->
                    views.add(new WorkspaceView(workspace, membership.getRole(),
                        StateQueries.memberCount(state, workspace.getId()))));
            }
            return views;
        });
    }

    /**
     * 멤버와 만료되지 않은 대기 초대.
     */
    public WorkspaceMembers listWorkspaceMembers(String token) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireAuth(state, token, now);
            List<Membership> members = state.getMemberships().stream()
                .filter(m -> m.getWorkspaceId().equals(auth.workspaceId()))
                .toList();
            List<WorkspaceInvite> invites = state.getWorkspaceInvites().stream()
                .filter(i -> i.getWorkspaceId().equals(auth.workspaceId()))
                .filter(i -> i.getStatus() == InviteStatus.PENDING && i.getExpiresAt().isAfter(now))
                .toList();
            return new WorkspaceMembers(members, invites);
        });
    }

    /**
     * 초대 생성.
     *
     * @param role admin, member, viewer 중 하나
     */
    public WorkspaceInvite createWorkspaceInvite(String token, String email, MemberRole role) {
        String normalized = StateQueries.normalizeEmail(email);
        if (normalized == null || normalized.isEmpty()) {
            throw ControlPlaneException.badRequest("Email is required");
        }
        MemberRole inviteRole = role == null ? MemberRole.MEMBER : role;
        if (inviteRole == MemberRole.OWNER) {
            throw ControlPlaneException.badRequest("Owner role cannot be granted by invite");
        }
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            boolean alreadyMember = StateQueries.findUserByEmail(state, normalized)
                .flatMap(user -> StateQueries.findMembership(state, auth.workspaceId(), user.getId()))
                .isPresent();
            if (alreadyMember) {
                throw ControlPlaneException.conflict("User is already a member");
            }
            WorkspaceInvite invite = new WorkspaceInvite();
            invite.setId(Ids.next("inv"));
            invite.setCode(Ids.secret("invite"));
            invite.setWorkspaceId(auth.workspaceId());
            invite.setEmail(normalized);
            invite.setRole(inviteRole);
            invite.setStatus(InviteStatus.PENDING);
            invite.setCreatedByUserId(auth.userId());
            invite.setCreatedAt(now);
            invite.setExpiresAt(now.plus(config.inviteTtl()));
            state.getWorkspaceInvites().add(invite);
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "workspace.invite_created",
                "workspace_invite", invite.getId(), Map.of("email", normalized, "role", inviteRole.wireName()));
            return invite;
        });
    }

    /**
     * 초대 수락. 호출자 이메일이 초대 이메일과 일치해야 합니다.
     */
    public Membership acceptWorkspaceInvite(String token, String code) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireAuth(state, token, now);
            WorkspaceInvite invite = state.getWorkspaceInvites().stream()
                .filter(i -> i.getCode().equals(code))
                .findFirst()
                .orElseThrow(() -> ControlPlaneException.notFound("Invite not found"));
            if (invite.getStatus() != InviteStatus.PENDING) {
                throw ControlPlaneException.conflict("Invite already used");
            }
            if (!invite.getExpiresAt().isAfter(now)) {
                throw ControlPlaneException.badRequest("Invite expired");
            }
            User user = auth.user();
            if (!invite.getEmail().equals(user.getEmail())) {
                throw ControlPlaneException.forbidden("Invite email does not match");
            }
            if (StateQueries.findMembership(state, invite.getWorkspaceId(), user.getId()).isPresent()) {
                throw ControlPlaneException.conflict("User is already a member");
            }
            Membership membership = new Membership();
            membership.setWorkspaceId(invite.getWorkspaceId());
            membership.setUserId(user.getId());
            membership.setRole(invite.getRole());
            membership.setCreatedAt(now);
            state.getMemberships().add(membership);
            invite.setStatus(InviteStatus.ACCEPTED);
            invite.setAcceptedAt(now);
            Ledger.audit(state, now, invite.getWorkspaceId(), user.getId(), "workspace.invite_accepted",
                "workspace_invite", invite.getId());
            return membership;
        });
    }

    public Membership updateWorkspaceMemberRole(String token, String userId, MemberRole role) {
        if (role == null) {
            throw ControlPlaneException.badRequest("Role is required");
        }
        if (role == MemberRole.OWNER) {
            throw ControlPlaneException.badRequest("Owner role cannot be granted");
        }
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            Membership membership = StateQueries.findMembership(state, auth.workspaceId(), userId)
                .orElseThrow(() -> ControlPlaneException.notFound("Member not found"));
            if (membership.getRole() == MemberRole.OWNER) {
                throw ControlPlaneException.conflict("Owner role cannot be changed");
            }
            membership.setRole(role);
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "workspace.member_role_updated",
                "membership", membership.key(), Map.of("role", role.wireName()));
            return membership;
        });
    }

    public Workspace setWorkspacePlan(String token, Plan plan) {
        if (plan == null) {
            throw ControlPlaneException.badRequest("Plan is required");
        }
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            auth.workspace().setPlan(plan);
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "workspace.plan_updated", "workspace",
                auth.workspaceId(), Map.of("plan", plan.wireName()));
            return auth.workspace();
        });
    }

    public Workspace renameWorkspace(String token, String name) {
        if (name == null || name.isBlank()) {
            throw ControlPlaneException.badRequest("Workspace name is required");
        }
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            auth.workspace().setName(name.trim());
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "workspace.settings_updated", "workspace",
                auth.workspaceId(), Map.of("name", name.trim()));
            return auth.workspace();
        });
    }

    /**
     * 쿼터 재정의. null 값은 플랜 기본값으로 되돌립니다.
     */
    public Workspace setQuotaOverrides(String token, Integer maxTemplates, Integer maxRunningSessions) {
        if ((maxTemplates != null && maxTemplates < 0) || (maxRunningSessions != null && maxRunningSessions < 0)) {
            throw ControlPlaneException.badRequest("Quota overrides must be non-negative");
        }
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            QuotaOverrides overrides = null;
            if (maxTemplates != null || maxRunningSessions != null) {
                overrides = new QuotaOverrides();
                overrides.setMaxTemplates(maxTemplates);
                overrides.setMaxRunningSessions(maxRunningSessions);
            }
            auth.workspace().setQuotaOverrides(overrides);
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "workspace.quota_overrides_updated",
                "workspace", auth.workspaceId(), Map.of(
                    "maxTemplates", String.valueOf(auth.workspace().effectiveMaxTemplates()),
                    "maxRunningSessions", String.valueOf(auth.workspace().effectiveMaxRunningSessions())));
            return auth.workspace();
        });
    }

    // ============================================================
    // 런타임 시크릿
    // ============================================================

    /**
     * 시크릿 생성 또는 값 교체. 이름은 대문자로 정규화됩니다.
     *
     * @param name 영문자/숫자/밑줄, 숫자로 시작 불가, 최대 64자
     * @param value 비어 있지 않은 값 (최대 4096자)
     * @return 값이 제거된 시크릿
     */
    public WorkspaceSecretView setWorkspaceSecret(String token, String name, String value) {
        String normalized = normalizeSecretName(name);
        if (value == null || value.isEmpty()) {
            throw ControlPlaneException.badRequest("Secret value is required");
        }
        if (value.length() > MAX_SECRET_VALUE_LENGTH) {
            throw ControlPlaneException.badRequest("Secret value is too long (max " + MAX_SECRET_VALUE_LENGTH + ")");
        }
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            Optional<WorkspaceSecret> existing = findSecret(state, auth.workspaceId(), normalized);
            WorkspaceSecret secret = existing.orElseGet(() -> {
                WorkspaceSecret created = new WorkspaceSecret();
                created.setId(Ids.next("sec"));
                created.setWorkspaceId(auth.workspaceId());
                created.setName(normalized);
                created.setCreatedAt(now);
                state.getWorkspaceSecrets().add(created);
                return created;
            });
            secret.setValue(value);
            secret.setUpdatedByUserId(auth.userId());
            secret.setUpdatedAt(now);
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "workspace.secret_set", "workspace_secret",
                secret.getId(), Map.of("name", normalized, "created", String.valueOf(existing.isEmpty())));
            return WorkspaceSecretView.of(secret);
        });
    }

    public List<WorkspaceSecretView> listWorkspaceSecrets(String token) {
        return stateStore.transact(state -> {
            AuthContext auth = AccessGuard.requireAuth(state, token, clock.instant());
            return secretViews(state, auth.workspaceId());
        });
    }

    public void deleteWorkspaceSecret(String token, String name) {
        String normalized = normalizeSecretName(name);
        stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            WorkspaceSecret secret = findSecret(state, auth.workspaceId(), normalized)
                .orElseThrow(() -> ControlPlaneException.notFound("Secret not found"));
            state.getWorkspaceSecrets().remove(secret);
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "workspace.secret_deleted",
                "workspace_secret", secret.getId(), Map.of("name", normalized));
            return null;
        });
    }

    static String normalizeSecretName(String name) {
        if (name == null || name.isBlank()) {
            throw ControlPlaneException.badRequest("Secret name is required");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if (!SECRET_NAME.matcher(normalized).matches()) {
            throw ControlPlaneException.badRequest("Invalid secret name: " + name.trim());
        }
        return normalized;
    }

    private static Optional<WorkspaceSecret> findSecret(StateDocument state, String workspaceId, String name) {
        return state.getWorkspaceSecrets().stream()
            .filter(s -> s.getWorkspaceId().equals(workspaceId) && s.getName().equals(name))
            .findFirst();
    }

    private static List<WorkspaceSecretView> secretViews(StateDocument state, String workspaceId) {
        return state.getWorkspaceSecrets().stream()
            .filter(s -> s.getWorkspaceId().equals(workspaceId))
            .sorted(Comparator.comparing(WorkspaceSecret::getName))
            .map(WorkspaceSecretView::of)
            .toList();
    }

    // ============================================================
    // 내보내기
    // ============================================================

    /**
     * 호출자 워크스페이스의 상태를 한 번에 내보냅니다.
     *
     * <p>{@code workspace.exported} 감사 로그는 결과를 만든 뒤 추가되므로
     * 결과의 감사 로그에는 포함되지 않습니다.</p>
     */
    public WorkspaceExport exportWorkspace(String token) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            String workspaceId = auth.workspaceId();

            List<Template> templates = state.getTemplates().stream()
                .filter(t -> t.getWorkspaceId().equals(workspaceId))
                .toList();
            Set<String> templateIds = templates.stream().map(Template::getId).collect(Collectors.toSet());
            List<TemplateVersion> versions = state.getTemplateVersions().stream()
                .filter(v -> templateIds.contains(v.getTemplateId()))
                .toList();
            Set<String> versionIds = versions.stream().map(TemplateVersion::getId).collect(Collectors.toSet());
            List<TemplateBuild> builds = state.getTemplateBuilds().stream()
                .filter(b -> versionIds.contains(b.getTemplateVersionId()))
                .toList();
            List<Session> sessions = state.getSessions().stream()
                .filter(s -> s.getWorkspaceId().equals(workspaceId))
                .toList();
            Set<String> sessionIds = sessions.stream().map(Session::getId).collect(Collectors.toSet());
            List<Snapshot> snapshots = state.getSnapshots().stream()
                .filter(s -> sessionIds.contains(s.getSessionId()))
                .toList();

            WorkspaceExport export = new WorkspaceExport(
                now,
                auth.workspace(),
                state.getMemberships().stream().filter(m -> m.getWorkspaceId().equals(workspaceId)).toList(),
                templates,
                versions,
                builds,
                state.getBindingReleases().stream().filter(r -> r.getWorkspaceId().equals(workspaceId)).toList(),
                sessions,
                snapshots,
                secretViews(state, workspaceId),
                Ledger.summarize(state, workspaceId),
                state.getAuditLogs().stream().filter(a -> workspaceId.equals(a.getWorkspaceId())).toList()
            );
            Ledger.audit(state, now, workspaceId, auth.userId(), "workspace.exported", "workspace", workspaceId,
                Map.of("templates", String.valueOf(templates.size()), "sessions", String.valueOf(sessions.size())));
            return export;
        });
    }
}
