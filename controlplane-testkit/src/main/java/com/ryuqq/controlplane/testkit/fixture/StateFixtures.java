package com.ryuqq.controlplane.testkit.fixture;

import com.ryuqq.controlplane.core.model.AuditLog;
import com.ryuqq.controlplane.core.model.AuthToken;
import com.ryuqq.controlplane.core.model.Manifest;
import com.ryuqq.controlplane.core.model.MemberRole;
import com.ryuqq.controlplane.core.model.Membership;
import com.ryuqq.controlplane.core.model.Plan;
import com.ryuqq.controlplane.core.model.Session;
import com.ryuqq.controlplane.core.model.Template;
import com.ryuqq.controlplane.core.model.TemplateBuild;
import com.ryuqq.controlplane.core.model.TemplateVersion;
import com.ryuqq.controlplane.core.model.TokenKind;
import com.ryuqq.controlplane.core.model.User;
import com.ryuqq.controlplane.core.model.VersionStatus;
import com.ryuqq.controlplane.core.model.Workspace;
import com.ryuqq.controlplane.core.model.WorkspaceSecret;
import com.ryuqq.controlplane.core.state.StateDocument;
import com.ryuqq.controlplane.core.statemachine.BuildStatus;
import com.ryuqq.controlplane.core.statemachine.SessionState;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Builders for populated {@link StateDocument}s used by contract tests.
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class StateFixtures {

    public static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private StateFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * A document with one entity or more in the identity, template and session collections.
     *
     * @param suffix appended to every id so several workspaces can coexist
     */
    public static StateDocument populated(String suffix) {
        StateDocument document = StateDocument.empty();
        addWorkspace(document, suffix);
        return document;
    }

    /**
     * Appends a user, workspace, membership, token, secret, template, version, build,
     * session and audit entry sharing the given id suffix.
     */
    public static void addWorkspace(StateDocument document, String suffix) {
        User user = new User();
        user.setId("usr_" + suffix);
        user.setEmail("dev-" + suffix + "@example.com");
        user.setName("Dev " + suffix);
        user.setCreatedAt(T0);
        document.getUsers().add(user);

        Workspace workspace = new Workspace();
        workspace.setId("ws_" + suffix);
        workspace.setName("Workspace " + suffix);
        workspace.setOwnerUserId(user.getId());
        workspace.setPlan(Plan.FREE);
        workspace.setCreatedAt(T0);
        document.getWorkspaces().add(workspace);

        Membership membership = new Membership();
        membership.setWorkspaceId(workspace.getId());
        membership.setUserId(user.getId());
        membership.setRole(MemberRole.OWNER);
        membership.setCreatedAt(T0);
        document.getMemberships().add(membership);

        AuthToken token = new AuthToken();
        token.setId("tok_" + suffix);
        token.setToken("browser_secret_" + suffix);
        token.setUserId(user.getId());
        token.setWorkspaceId(workspace.getId());
        token.setKind(TokenKind.BROWSER);
        token.setAuthSessionId("auth_" + suffix);
        token.setCreatedAt(T0);
        token.setExpiresAt(T0.plus(Duration.ofDays(7)));
        document.getAuthTokens().add(token);

        WorkspaceSecret secret = new WorkspaceSecret();
        secret.setId("sec_" + suffix);
        secret.setWorkspaceId(workspace.getId());
        secret.setName("API_TOKEN");
        secret.setValue("value-" + suffix);
        secret.setUpdatedByUserId(user.getId());
        secret.setCreatedAt(T0);
        secret.setUpdatedAt(T0);
        document.getWorkspaceSecrets().add(secret);

        Template template = new Template();
        template.setId("tpl_" + suffix);
        template.setWorkspaceId(workspace.getId());
        template.setName("node-" + suffix);
        template.setDescription("");
        template.setCreatedByUserId(user.getId());
        template.setCreatedAt(T0);
        document.getTemplates().add(template);

        Manifest manifest = new Manifest();
        manifest.setImage("registry.example.com/node:20");
        manifest.setFeatures(List.of("ssh", "browser"));
        manifest.setPersistedPaths(List.of("/workspace"));

        TemplateVersion version = new TemplateVersion();
        version.setId("tplv_" + suffix);
        version.setTemplateId(template.getId());
        version.setVersion("1.0.0");
        version.setStatus(VersionStatus.QUEUED);
        version.setNotes("");
        version.setManifest(manifest);
        version.setCreatedAt(T0);
        document.getTemplateVersions().add(version);

        TemplateBuild build = new TemplateBuild();
        build.setId("bld_" + suffix);
        build.setTemplateVersionId(version.getId());
        build.setStatus(BuildStatus.QUEUED);
        build.setCreatedAt(T0);
        build.setUpdatedAt(T0);
        document.getTemplateBuilds().add(build);

        Session session = new Session();
        session.setId("ses_" + suffix);
        session.setWorkspaceId(workspace.getId());
        session.setTemplateId(template.getId());
        session.setName("session-" + suffix);
        session.setState(SessionState.CREATED);
        session.setCreatedByUserId(user.getId());
        session.setCreatedAt(T0);
        session.setUpdatedAt(T0);
        document.getSessions().add(session);

        AuditLog audit = new AuditLog();
        audit.setId("audit_" + suffix);
        audit.setWorkspaceId(workspace.getId());
        audit.setActorUserId(user.getId());
        audit.setAction("user.registered");
        audit.setTargetType("user");
        audit.setTargetId(user.getId());
        audit.setDetails(Map.of("email", user.getEmail()));
        audit.setCreatedAt(T0);
        document.getAuditLogs().add(audit);
    }
}
