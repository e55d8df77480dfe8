package com.ryuqq.controlplane.application.support;

import com.ryuqq.controlplane.core.error.ControlPlaneException;
import com.ryuqq.controlplane.core.model.AuthToken;
import com.ryuqq.controlplane.core.model.Membership;
import com.ryuqq.controlplane.core.model.Session;
import com.ryuqq.controlplane.core.model.Template;
import com.ryuqq.controlplane.core.model.TemplateBuild;
import com.ryuqq.controlplane.core.model.TemplateVersion;
import com.ryuqq.controlplane.core.model.User;
import com.ryuqq.controlplane.core.model.Workspace;
import com.ryuqq.controlplane.core.state.StateDocument;
import com.ryuqq.controlplane.core.statemachine.SessionState;

import java.util.Locale;
import java.util.Optional;

/**
 * 상태 문서 조회 헬퍼.
 *
 * <p>{@code require*} 메서드는 엔티티가 없거나 호출자의 워크스페이스 밖에 있으면
 * NOT_FOUND를 던집니다 (테넌트 경계 밖의 존재 여부를 드러내지 않음).</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class StateQueries {

    private StateQueries() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public static Optional<User> findUser(StateDocument state, String userId) {
        return state.getUsers().stream().filter(u -> u.getId().equals(userId)).findFirst();
    }

    public static Optional<User> findUserByEmail(StateDocument state, String email) {
        String normalized = normalizeEmail(email);
        return state.getUsers().stream().filter(u -> u.getEmail().equals(normalized)).findFirst();
    }

    public static Optional<Workspace> findWorkspace(StateDocument state, String workspaceId) {
        return state.getWorkspaces().stream().filter(w -> w.getId().equals(workspaceId)).findFirst();
    }

    public static Optional<Membership> findMembership(StateDocument state, String workspaceId, String userId) {
        return state.getMemberships().stream()
            .filter(m -> m.getWorkspaceId().equals(workspaceId) && m.getUserId().equals(userId))
            .findFirst();
    }

    public static Optional<AuthToken> findToken(StateDocument state, String token) {
        return state.getAuthTokens().stream().filter(t -> t.getToken().equals(token)).findFirst();
    }

    public static long memberCount(StateDocument state, String workspaceId) {
        return state.getMemberships().stream().filter(m -> m.getWorkspaceId().equals(workspaceId)).count();
    }

    public static Template requireTemplate(StateDocument state, String workspaceId, String templateId) {
        return state.getTemplates().stream()
            .filter(t -> t.getId().equals(templateId) && t.getWorkspaceId().equals(workspaceId))
            .findFirst()
            .orElseThrow(() -> ControlPlaneException.notFound("Template not found"));
    }

    public static Optional<TemplateVersion> findVersion(StateDocument state, String versionId) {
        return state.getTemplateVersions().stream().filter(v -> v.getId().equals(versionId)).findFirst();
    }

    public static TemplateVersion requireVersion(StateDocument state, String templateId, String versionId) {
        return state.getTemplateVersions().stream()
            .filter(v -> v.getId().equals(versionId) && v.getTemplateId().equals(templateId))
            .findFirst()
            .orElseThrow(() -> ControlPlaneException.notFound("Template version not found"));
    }

    public static Optional<TemplateBuild> findBuildForVersion(StateDocument state, String versionId) {
        return state.getTemplateBuilds().stream().filter(b -> b.getTemplateVersionId().equals(versionId)).findFirst();
    }

    public static Optional<Template> findTemplate(StateDocument state, String templateId) {
        return state.getTemplates().stream().filter(t -> t.getId().equals(templateId)).findFirst();
    }

    /**
     * 빌드가 속한 템플릿 (버전 → 템플릿 경로). 고아 빌드는 empty.
     */
    public static Optional<Template> templateOfBuild(StateDocument state, TemplateBuild build) {
        return findVersion(state, build.getTemplateVersionId())
            .flatMap(version -> findTemplate(state, version.getTemplateId()));
    }

    public static TemplateBuild requireBuild(StateDocument state, String workspaceId, String buildId) {
        TemplateBuild build = state.getTemplateBuilds().stream()
            .filter(b -> b.getId().equals(buildId))
            .findFirst()
            .orElseThrow(() -> ControlPlaneException.notFound("Build not found"));
        templateOfBuild(state, build)
            .filter(t -> t.getWorkspaceId().equals(workspaceId))
            .orElseThrow(() -> ControlPlaneException.notFound("Build not found"));
        return build;
    }

    /**
     * 삭제되지 않은 세션을 조회합니다.
     */
    public static Session requireSession(StateDocument state, String workspaceId, String sessionId) {
        return state.getSessions().stream()
            .filter(s -> s.getId().equals(sessionId)
                && s.getWorkspaceId().equals(workspaceId)
                && s.getState() != SessionState.DELETED)
            .findFirst()
            .orElseThrow(() -> ControlPlaneException.notFound("Session not found"));
    }

    public static Optional<Session> findSession(StateDocument state, String sessionId) {
        return state.getSessions().stream().filter(s -> s.getId().equals(sessionId)).findFirst();
    }

    /**
     * 워크스페이스에서 RUNNING 또는 STARTING인 세션 수.
     */
    public static long runningSessionCount(StateDocument state, String workspaceId) {
        return state.getSessions().stream()
            .filter(s -> s.getWorkspaceId().equals(workspaceId))
            .filter(s -> s.getState() == SessionState.RUNNING || s.getState() == SessionState.STARTING)
            .count();
    }
}
