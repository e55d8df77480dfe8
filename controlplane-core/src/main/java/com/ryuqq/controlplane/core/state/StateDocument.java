package com.ryuqq.controlplane.core.state;

import com.ryuqq.controlplane.core.model.AuditLog;
import com.ryuqq.controlplane.core.model.AuthToken;
import com.ryuqq.controlplane.core.model.BindingRelease;
import com.ryuqq.controlplane.core.model.DeviceCode;
import com.ryuqq.controlplane.core.model.Membership;
import com.ryuqq.controlplane.core.model.Session;
import com.ryuqq.controlplane.core.model.SessionEvent;
import com.ryuqq.controlplane.core.model.Snapshot;
import com.ryuqq.controlplane.core.model.Template;
import com.ryuqq.controlplane.core.model.TemplateBuild;
import com.ryuqq.controlplane.core.model.TemplateVersion;
import com.ryuqq.controlplane.core.model.UploadGrant;
import com.ryuqq.controlplane.core.model.UsageEvent;
import com.ryuqq.controlplane.core.model.User;
import com.ryuqq.controlplane.core.model.Workspace;
import com.ryuqq.controlplane.core.model.WorkspaceInvite;
import com.ryuqq.controlplane.core.model.WorkspaceSecret;
import com.ryuqq.controlplane.core.util.Jsons;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 컨트롤 플레인 전체 상태 문서.
 *
 * <p>17개의 순서 있는 엔티티 컬렉션으로 구성됩니다. 트랜잭션은 로드한 문서를
 * {@link #deepCopy()}로 복제한 draft를 수정하고, 모든 백엔드 저장소는
 * 컬렉션 내 순서를 보존해야 합니다.</p>
 *
 * <p>scope 로드 시 요청하지 않은 컬렉션은 빈 리스트로 남습니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class StateDocument {

    private List<User> users = new ArrayList<>();
    private List<Workspace> workspaces = new ArrayList<>();
    private List<Membership> memberships = new ArrayList<>();
    private List<WorkspaceInvite> workspaceInvites = new ArrayList<>();
    private List<WorkspaceSecret> workspaceSecrets = new ArrayList<>();
    private List<AuthToken> authTokens = new ArrayList<>();
    private List<DeviceCode> deviceCodes = new ArrayList<>();
    private List<Template> templates = new ArrayList<>();
    private List<TemplateVersion> templateVersions = new ArrayList<>();
    private List<TemplateBuild> templateBuilds = new ArrayList<>();
    private List<BindingRelease> bindingReleases = new ArrayList<>();
    private List<Session> sessions = new ArrayList<>();
    private List<SessionEvent> sessionEvents = new ArrayList<>();
    private List<Snapshot> snapshots = new ArrayList<>();
    private List<UploadGrant> uploadGrants = new ArrayList<>();
    private List<UsageEvent> usageEvents = new ArrayList<>();
    private List<AuditLog> auditLogs = new ArrayList<>();

    public static StateDocument empty() {
        return new StateDocument();
    }

    /**
     * 공유 참조가 없는 완전한 사본을 만듭니다.
     *
     * @return 새 StateDocument
     */
    public StateDocument deepCopy() {
        return Jsons.deepCopy(this, StateDocument.class);
    }

    /**
     * 컬렉션별 엔티티 수.
     */
    public int size(EntityCollection collection) {
        return list(collection).size();
    }

    /**
     * 지정한 컬렉션을 source의 사본으로 교체합니다 (엔티티 참조는 공유).
     *
     * <p>전체 문서 저장소가 scope 저장을 반영할 때 사용합니다.</p>
     */
    public void replaceCollections(StateDocument source, Set<EntityCollection> collections) {
        for (EntityCollection collection : collections) {
            switch (collection) {
                case USERS -> users = new ArrayList<>(source.users);
                case WORKSPACES -> workspaces = new ArrayList<>(source.workspaces);
                case MEMBERSHIPS -> memberships = new ArrayList<>(source.memberships);
                case WORKSPACE_INVITES -> workspaceInvites = new ArrayList<>(source.workspaceInvites);
                case WORKSPACE_SECRETS -> workspaceSecrets = new ArrayList<>(source.workspaceSecrets);
                case AUTH_TOKENS -> authTokens = new ArrayList<>(source.authTokens);
                case DEVICE_CODES -> deviceCodes = new ArrayList<>(source.deviceCodes);
                case TEMPLATES -> templates = new ArrayList<>(source.templates);
                case TEMPLATE_VERSIONS -> templateVersions = new ArrayList<>(source.templateVersions);
                case TEMPLATE_BUILDS -> templateBuilds = new ArrayList<>(source.templateBuilds);
                case BINDING_RELEASES -> bindingReleases = new ArrayList<>(source.bindingReleases);
                case SESSIONS -> sessions = new ArrayList<>(source.sessions);
                case SESSION_EVENTS -> sessionEvents = new ArrayList<>(source.sessionEvents);
                case SNAPSHOTS -> snapshots = new ArrayList<>(source.snapshots);
                case UPLOAD_GRANTS -> uploadGrants = new ArrayList<>(source.uploadGrants);
                case USAGE_EVENTS -> usageEvents = new ArrayList<>(source.usageEvents);
                case AUDIT_LOGS -> auditLogs = new ArrayList<>(source.auditLogs);
            }
        }
    }

    private List<?> list(EntityCollection collection) {
        return switch (collection) {
            case USERS -> users;
            case WORKSPACES -> workspaces;
            case MEMBERSHIPS -> memberships;
            case WORKSPACE_INVITES -> workspaceInvites;
            case WORKSPACE_SECRETS -> workspaceSecrets;
            case AUTH_TOKENS -> authTokens;
            case DEVICE_CODES -> deviceCodes;
            case TEMPLATES -> templates;
            case TEMPLATE_VERSIONS -> templateVersions;
            case TEMPLATE_BUILDS -> templateBuilds;
            case BINDING_RELEASES -> bindingReleases;
            case SESSIONS -> sessions;
            case SESSION_EVENTS -> sessionEvents;
            case SNAPSHOTS -> snapshots;
            case UPLOAD_GRANTS -> uploadGrants;
            case USAGE_EVENTS -> usageEvents;
            case AUDIT_LOGS -> auditLogs;
        };
    }

    public List<User> getUsers() {
        return users;
    }

    public void setUsers(List<User> users) {
        this.users = users == null ? new ArrayList<>() : new ArrayList<>(users);
    }

    public List<Workspace> getWorkspaces() {
        return workspaces;
    }

    public void setWorkspaces(List<Workspace> workspaces) {
        this.workspaces = workspaces == null ? new ArrayList<>() : new ArrayList<>(workspaces);
    }

    public List<Membership> getMemberships() {
        return memberships;
    }

    public void setMemberships(List<Membership> memberships) {
        this.memberships = memberships == null ? new ArrayList<>() : new ArrayList<>(memberships);
    }

    public List<WorkspaceInvite> getWorkspaceInvites() {
        return workspaceInvites;
    }

    public void setWorkspaceInvites(List<WorkspaceInvite> workspaceInvites) {
        this.workspaceInvites = workspaceInvites == null ? new ArrayList<>() : new ArrayList<>(workspaceInvites);
    }

    public List<WorkspaceSecret> getWorkspaceSecrets() {
        return workspaceSecrets;
    }

    public void setWorkspaceSecrets(List<WorkspaceSecret> workspaceSecrets) {
        this.workspaceSecrets = workspaceSecrets == null ? new ArrayList<>() : new ArrayList<>(workspaceSecrets);
    }

    public List<AuthToken> getAuthTokens() {
        return authTokens;
    }

    public void setAuthTokens(List<AuthToken> authTokens) {
        this.authTokens = authTokens == null ? new ArrayList<>() : new ArrayList<>(authTokens);
    }

    public List<DeviceCode> getDeviceCodes() {
        return deviceCodes;
    }

    public void setDeviceCodes(List<DeviceCode> deviceCodes) {
        this.deviceCodes = deviceCodes == null ? new ArrayList<>() : new ArrayList<>(deviceCodes);
    }

    public List<Template> getTemplates() {
        return templates;
    }

    public void setTemplates(List<Template> templates) {
        this.templates = templates == null ? new ArrayList<>() : new ArrayList<>(templates);
    }

    public List<TemplateVersion> getTemplateVersions() {
        return templateVersions;
    }

    public void setTemplateVersions(List<TemplateVersion> templateVersions) {
        this.templateVersions = templateVersions == null ? new ArrayList<>() : new ArrayList<>(templateVersions);
    }

    public List<TemplateBuild> getTemplateBuilds() {
        return templateBuilds;
    }

    public void setTemplateBuilds(List<TemplateBuild> templateBuilds) {
        this.templateBuilds = templateBuilds == null ? new ArrayList<>() : new ArrayList<>(templateBuilds);
    }

    public List<BindingRelease> getBindingReleases() {
        return bindingReleases;
    }

    public void setBindingReleases(List<BindingRelease> bindingReleases) {
        this.bindingReleases = bindingReleases == null ? new ArrayList<>() : new ArrayList<>(bindingReleases);
    }

    public List<Session> getSessions() {
        return sessions;
    }

    public void setSessions(List<Session> sessions) {
        this.sessions = sessions == null ? new ArrayList<>() : new ArrayList<>(sessions);
    }

    public List<SessionEvent> getSessionEvents() {
        return sessionEvents;
    }

    public void setSessionEvents(List<SessionEvent> sessionEvents) {
        this.sessionEvents = sessionEvents == null ? new ArrayList<>() : new ArrayList<>(sessionEvents);
    }

    public List<Snapshot> getSnapshots() {
        return snapshots;
    }

    public void setSnapshots(List<Snapshot> snapshots) {
        this.snapshots = snapshots == null ? new ArrayList<>() : new ArrayList<>(snapshots);
    }

    public List<UploadGrant> getUploadGrants() {
        return uploadGrants;
    }

    public void setUploadGrants(List<UploadGrant> uploadGrants) {
        this.uploadGrants = uploadGrants == null ? new ArrayList<>() : new ArrayList<>(uploadGrants);
    }

    public List<UsageEvent> getUsageEvents() {
        return usageEvents;
    }

    public void setUsageEvents(List<UsageEvent> usageEvents) {
        this.usageEvents = usageEvents == null ? new ArrayList<>() : new ArrayList<>(usageEvents);
    }

    public List<AuditLog> getAuditLogs() {
        return auditLogs;
    }

    public void setAuditLogs(List<AuditLog> auditLogs) {
        this.auditLogs = auditLogs == null ? new ArrayList<>() : new ArrayList<>(auditLogs);
    }
}
