package com.ryuqq.controlplane.application.identity;

import com.ryuqq.controlplane.application.ControlPlaneTestSupport;
import com.ryuqq.controlplane.core.error.ErrorKind;
import com.ryuqq.controlplane.core.model.AuditLog;
import com.ryuqq.controlplane.core.model.Membership;
import com.ryuqq.controlplane.core.model.MemberRole;
import com.ryuqq.controlplane.core.model.Plan;
import com.ryuqq.controlplane.core.model.Session;
import com.ryuqq.controlplane.core.model.Template;
import com.ryuqq.controlplane.core.model.Workspace;
import com.ryuqq.controlplane.core.model.WorkspaceInvite;
import com.ryuqq.controlplane.core.util.Jsons;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * WorkspaceService 시나리오 테스트 (초대, 역할, 플랜, 쿼터, 시크릿, 내보내기).
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
class WorkspaceServiceTest extends ControlPlaneTestSupport {

    private AuthResult owner;
    private AuthResult guest;

    @BeforeEach
    void setUp() {
        owner = register("owner@example.com");
        guest = register("guest@example.com");
    }

    private WorkspaceService workspaces() {
        return controlPlane.workspaces();
    }

    private AuthResult joinAs(MemberRole role) {
        WorkspaceInvite invite = workspaces().createWorkspaceInvite(owner.tokenValue(), "guest@example.com", role);
        workspaces().acceptWorkspaceInvite(guest.tokenValue(), invite.getCode());
        return controlPlane.identity().switchWorkspace(guest.tokenValue(), owner.workspace().getId());
    }

    @Test
    void 초대_수락하면_초대한_역할로_멤버가_됨() {
        // when
        AuthResult member = joinAs(MemberRole.VIEWER);

        // then
        WorkspaceMembers members = workspaces().listWorkspaceMembers(owner.tokenValue());
        assertThat(members.members()).extracting(Membership::getRole)
            .containsExactly(MemberRole.OWNER, MemberRole.VIEWER);
        assertThat(members.pendingInvites()).isEmpty();
        assertThat(workspaces().listWorkspaces(guest.tokenValue())).hasSize(2);
        assertThat(controlPlane.identity().authenticate(member.tokenValue()).role()).isEqualTo(MemberRole.VIEWER);
    }

    @Test
    void 초대_이메일과_다른_사용자는_수락할_수_없음() {
        // given
        WorkspaceInvite invite = workspaces().createWorkspaceInvite(owner.tokenValue(), "someone@example.com", null);

        // then
        assertThat(invite.getRole()).isEqualTo(MemberRole.MEMBER);
        assertKind(() -> workspaces().acceptWorkspaceInvite(guest.tokenValue(), invite.getCode()),
            ErrorKind.FORBIDDEN);
    }

    @Test
    void 초대는_한_번만_수락_가능() {
        // given
        WorkspaceInvite invite = workspaces().createWorkspaceInvite(owner.tokenValue(), "guest@example.com", null);

        // when
        workspaces().acceptWorkspaceInvite(guest.tokenValue(), invite.getCode());

        // then
        assertKind(() -> workspaces().acceptWorkspaceInvite(guest.tokenValue(), invite.getCode()),
            ErrorKind.CONFLICT);
        assertKind(() -> workspaces().acceptWorkspaceInvite(guest.tokenValue(), "invite_missing"),
            ErrorKind.NOT_FOUND);
    }

    @Test
    void 만료된_초대는_BAD_REQUEST() {
        // given
        WorkspaceInvite invite = workspaces().createWorkspaceInvite(owner.tokenValue(), "guest@example.com", null);

        // when
        clock.advance(Duration.ofDays(8));
        AuthResult fresh = controlPlane.identity().login("guest@example.com", null, null);

        // then
        assertKind(() -> workspaces().acceptWorkspaceInvite(fresh.tokenValue(), invite.getCode()),
            ErrorKind.BAD_REQUEST);
    }

    @Test
    void owner_역할은_초대로_부여할_수_없음() {
        assertKind(() -> workspaces().createWorkspaceInvite(owner.tokenValue(), "guest@example.com", MemberRole.OWNER),
            ErrorKind.BAD_REQUEST);
    }

    @Test
    void 이미_멤버인_사용자_초대는_CONFLICT() {
        joinAs(MemberRole.MEMBER);

        assertKind(() -> workspaces().createWorkspaceInvite(owner.tokenValue(), "guest@example.com", null),
            ErrorKind.CONFLICT);
    }

    @Test
    void member_역할은_관리_작업을_할_수_없음() {
        AuthResult member = joinAs(MemberRole.MEMBER);

        assertKind(() -> workspaces().setWorkspacePlan(member.tokenValue(), Plan.PRO), ErrorKind.FORBIDDEN);
        assertKind(() -> workspaces().createWorkspaceInvite(member.tokenValue(), "x@example.com", null),
            ErrorKind.FORBIDDEN);
    }

    @Test
    void viewer_역할은_쓰기_작업을_할_수_없음() {
        AuthResult viewer = joinAs(MemberRole.VIEWER);

        assertKind(() -> controlPlane.templates().createTemplate(viewer.tokenValue(), "node", ""),
            ErrorKind.FORBIDDEN);
    }

    @Test
    void 멤버_역할_변경_owner는_변경_불가() {
        // given
        joinAs(MemberRole.VIEWER);

        // when
        Membership updated = workspaces().updateWorkspaceMemberRole(owner.tokenValue(), guest.user().getId(),
            MemberRole.ADMIN);

        // then
        assertThat(updated.getRole()).isEqualTo(MemberRole.ADMIN);
        assertKind(() -> workspaces().updateWorkspaceMemberRole(owner.tokenValue(), owner.user().getId(),
            MemberRole.MEMBER), ErrorKind.CONFLICT);
        assertKind(() -> workspaces().updateWorkspaceMemberRole(owner.tokenValue(), "usr_missing",
            MemberRole.MEMBER), ErrorKind.NOT_FOUND);
    }

    @Test
    void 플랜과_쿼터_재정의가_유효_한도를_결정함() {
        // when
        Workspace pro = workspaces().setWorkspacePlan(owner.tokenValue(), Plan.PRO);
        Workspace overridden = workspaces().setQuotaOverrides(owner.tokenValue(), 1, null);

        // then
        assertThat(pro.getLimits().maxTemplates()).isEqualTo(100);
        assertThat(overridden.effectiveMaxTemplates()).isEqualTo(1);
        assertThat(overridden.effectiveMaxRunningSessions()).isEqualTo(20);

        controlPlane.templates().createTemplate(owner.tokenValue(), "first", "");
        assertKind(() -> controlPlane.templates().createTemplate(owner.tokenValue(), "second", ""),
            ErrorKind.CONFLICT);

        Workspace reset = workspaces().setQuotaOverrides(owner.tokenValue(), null, null);
        assertThat(reset.effectiveMaxTemplates()).isEqualTo(100);
    }

    @Test
    void 워크스페이스_이름_변경() {
        Workspace renamed = workspaces().renameWorkspace(owner.tokenValue(), "  Platform Team ");

        assertThat(renamed.getName()).isEqualTo("Platform Team");
        assertKind(() -> workspaces().renameWorkspace(owner.tokenValue(), " "), ErrorKind.BAD_REQUEST);
    }

    // ============================================================
    // 런타임 시크릿
    // ============================================================

    @Test
    @DisplayName("시크릿 이름은 대문자로 정규화되고 목록에는 값이 노출되지 않는다")
    void 시크릿_저장과_목록() {
        // when
        WorkspaceSecretView created = workspaces().setWorkspaceSecret(owner.tokenValue(), " api_token ", "first");
        clock.advance(Duration.ofMinutes(1));
        WorkspaceSecretView replaced = workspaces().setWorkspaceSecret(owner.tokenValue(), "API_TOKEN", "second");

        // then
        assertThat(created.name()).isEqualTo("API_TOKEN");
        assertThat(replaced.createdAt()).isEqualTo(created.createdAt());
        assertThat(replaced.updatedAt()).isAfter(created.updatedAt());
        assertThat(workspaces().listWorkspaceSecrets(owner.tokenValue()))
            .extracting(WorkspaceSecretView::name)
            .containsExactly("API_TOKEN");
        assertThat(backingStore.load().getWorkspaceSecrets())
            .singleElement()
            .satisfies(secret -> assertThat(secret.getValue()).isEqualTo("second"));
    }

    @Test
    void 시크릿_변경은_감사_로그에_값_없이_기록됨() {
        // when
        workspaces().setWorkspaceSecret(owner.tokenValue(), "DB_PASSWORD", "hunter2");
        workspaces().deleteWorkspaceSecret(owner.tokenValue(), "db_password");

        // then
        List<AuditLog> audit = controlPlane.usage().getAudit(owner.tokenValue(), 2);
        assertThat(audit).extracting(AuditLog::getAction)
            .containsExactly("workspace.secret_deleted", "workspace.secret_set");
        assertThat(audit).allSatisfy(entry -> assertThat(entry.getDetails().values()).doesNotContain("hunter2"));
        assertThat(workspaces().listWorkspaceSecrets(owner.tokenValue())).isEmpty();
        assertKind(() -> workspaces().deleteWorkspaceSecret(owner.tokenValue(), "DB_PASSWORD"), ErrorKind.NOT_FOUND);
    }

    @Test
    void 잘못된_시크릿_이름이나_값은_BAD_REQUEST() {
        String token = owner.tokenValue();

        assertKind(() -> workspaces().setWorkspaceSecret(token, "1ST", "v"), ErrorKind.BAD_REQUEST);
        assertKind(() -> workspaces().setWorkspaceSecret(token, "WITH-DASH", "v"), ErrorKind.BAD_REQUEST);
        assertKind(() -> workspaces().setWorkspaceSecret(token, " ", "v"), ErrorKind.BAD_REQUEST);
        assertKind(() -> workspaces().setWorkspaceSecret(token, "EMPTY", ""), ErrorKind.BAD_REQUEST);
        assertKind(() -> workspaces().setWorkspaceSecret(token, "HUGE",
            "x".repeat(WorkspaceService.MAX_SECRET_VALUE_LENGTH + 1)), ErrorKind.BAD_REQUEST);
    }

    @Test
    void member는_시크릿을_볼_수만_있고_바꿀_수_없음() {
        // given
        workspaces().setWorkspaceSecret(owner.tokenValue(), "API_TOKEN", "value");
        AuthResult member = joinAs(MemberRole.MEMBER);

        // when & then
        assertThat(workspaces().listWorkspaceSecrets(member.tokenValue())).hasSize(1);
        assertKind(() -> workspaces().setWorkspaceSecret(member.tokenValue(), "OTHER", "v"), ErrorKind.FORBIDDEN);
        assertKind(() -> workspaces().deleteWorkspaceSecret(member.tokenValue(), "API_TOKEN"), ErrorKind.FORBIDDEN);
    }

    @Test
    void 시크릿은_워크스페이스별로_분리됨() {
        // given
        workspaces().setWorkspaceSecret(owner.tokenValue(), "API_TOKEN", "owner");

        // when
        workspaces().setWorkspaceSecret(guest.tokenValue(), "API_TOKEN", "guest");

        // then
        assertThat(backingStore.load().getWorkspaceSecrets()).hasSize(2);
        assertThat(workspaces().listWorkspaceSecrets(guest.tokenValue())).hasSize(1);
    }

    // ============================================================
    // 내보내기
    // ============================================================

    @Test
    @DisplayName("내보내기는 워크스페이스 상태를 담고 시크릿 값은 제외한다")
    void 워크스페이스_내보내기() throws Exception {
        // given
        String token = owner.tokenValue();
        Template template = readyTemplate(token, "node");
        Session session = controlPlane.sessions().createSession(token, "dev", template.getId());
        controlPlane.uploads().createSnapshot(token, session.getId(), "nightly");
        workspaces().setWorkspaceSecret(token, "api_token", "super-secret");
        readyTemplate(guest.tokenValue(), "python");

        // when
        WorkspaceExport export = workspaces().exportWorkspace(token);

        // then
        assertThat(export.exportedAt()).isEqualTo(clock.instant());
        assertThat(export.workspace().getId()).isEqualTo(owner.workspace().getId());
        assertThat(export.members()).hasSize(1);
        assertThat(export.templates()).extracting(Template::getName).containsExactly("node");
        assertThat(export.templateVersions()).hasSize(1);
        assertThat(export.templateBuilds()).hasSize(1);
        assertThat(export.releases()).hasSize(1);
        assertThat(export.sessions()).extracting(Session::getId).containsExactly(session.getId());
        assertThat(export.snapshots()).hasSize(1);
        assertThat(export.runtimeSecrets()).extracting(WorkspaceSecretView::name).containsExactly("API_TOKEN");
        assertThat(Jsons.mapper().writeValueAsString(export)).doesNotContain("super-secret");
        assertThat(export.auditLogs()).noneMatch(entry -> "workspace.exported".equals(entry.getAction()));
        assertThat(controlPlane.usage().getAudit(token, 1).get(0).getAction()).isEqualTo("workspace.exported");
    }

    @Test
    void 내보내기는_owner와_admin만_가능() {
        // given
        AuthResult member = joinAs(MemberRole.MEMBER);

        // when & then
        assertKind(() -> workspaces().exportWorkspace(member.tokenValue()), ErrorKind.FORBIDDEN);
        assertKind(() -> workspaces().exportWorkspace("browser_unknown"), ErrorKind.UNAUTHORIZED);
    }
}
