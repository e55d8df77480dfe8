package com.ryuqq.controlplane.application.template;

import com.ryuqq.controlplane.application.ledger.Ledger;
import com.ryuqq.controlplane.application.support.AccessGuard;
import com.ryuqq.controlplane.application.support.AuthContext;
import com.ryuqq.controlplane.application.support.DispatchSupport;
import com.ryuqq.controlplane.application.support.StateQueries;
import com.ryuqq.controlplane.core.error.ControlPlaneException;
import com.ryuqq.controlplane.core.model.BindingRelease;
import com.ryuqq.controlplane.core.model.Manifest;
import com.ryuqq.controlplane.core.model.Template;
import com.ryuqq.controlplane.core.model.TemplateBuild;
import com.ryuqq.controlplane.core.model.TemplateVersion;
import com.ryuqq.controlplane.core.model.VersionStatus;
import com.ryuqq.controlplane.core.model.Workspace;
import com.ryuqq.controlplane.core.spi.JobDispatcher;
import com.ryuqq.controlplane.core.spi.ObjectStore;
import com.ryuqq.controlplane.core.spi.ObjectTarget;
import com.ryuqq.controlplane.core.spi.StoredObject;
import com.ryuqq.controlplane.core.state.StateDocument;
import com.ryuqq.controlplane.core.statemachine.BuildStatus;
import com.ryuqq.controlplane.core.statemachine.BuildTransitions;
import com.ryuqq.controlplane.core.statemachine.SessionState;
import com.ryuqq.controlplane.core.store.StateStore;
import com.ryuqq.controlplane.core.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 템플릿, 버전, 빌드, 릴리스 관리.
 *
 * <p><strong>빌드 흐름:</strong></p>
 * <ol>
 *   <li>{@link #addTemplateVersion}: 버전과 빌드를 QUEUED로 생성, 커밋 후 디스패치</li>
 *   <li>{@link #processTemplateBuildById}: {@link BuildPipeline}으로 실행</li>
 *   <li>실패 시 {@link #retryTemplateBuild} 1회, 다시 실패하면 DEAD_LETTERED</li>
 *   <li>{@link #retryDeadLetteredBuilds}: 운영자 일괄 복구</li>
 *   <li>{@link #promoteTemplateVersion}: READY 버전을 활성화하고 릴리스 기록</li>
 * </ol>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class TemplateService {

    private static final Logger log = LoggerFactory.getLogger(TemplateService.class);

    private final StateStore stateStore;
    private final Clock clock;
    private final BuildPipeline buildPipeline;
    private final ObjectStore objectStore;
    private final JobDispatcher jobDispatcher;

    public TemplateService(
        StateStore stateStore,
        Clock clock,
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
        this.buildPipeline = buildPipeline;
        this.objectStore = objectStore;
        this.jobDispatcher = jobDispatcher;
    }

    // ============================================================
    // 템플릿
    // ============================================================

    /**
     * 템플릿 생성.
     *
     * <p>이름은 워크스페이스 안에서 대소문자 구분 없이 유일해야 하며,
     * 템플릿 수가 유효 한도 미만이어야 합니다.</p>
     */
    public Template createTemplate(String token, String name, String description) {
        if (name == null || name.isBlank()) {
            throw ControlPlaneException.badRequest("Template name is required");
        }
        String trimmed = name.trim();
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireWrite(state, token, now);
            Workspace workspace = auth.workspace();
            List<Template> existing = templatesOf(state, workspace.getId());
            if (existing.stream().anyMatch(t -> t.getName().equalsIgnoreCase(trimmed))) {
                throw ControlPlaneException.conflict("Template name already exists");
            }
            if (existing.size() >= workspace.effectiveMaxTemplates()) {
                throw ControlPlaneException.conflict(
                    "Template limit reached (" + workspace.effectiveMaxTemplates() + ")");
            }
            Template template = new Template();
            template.setId(Ids.next("tpl"));
            template.setWorkspaceId(workspace.getId());
            template.setName(trimmed);
            template.setDescription(description == null ? "" : description.trim());
            template.setCreatedByUserId(auth.userId());
            template.setCreatedAt(now);
            state.getTemplates().add(template);
            Ledger.audit(state, now, workspace.getId(), auth.userId(), "template.created", "template",
                template.getId(), Map.of("name", trimmed));
            return template;
        });
    }

    public List<Template> listTemplates(String token) {
        return stateStore.transact(state -> {
            AuthContext auth = AccessGuard.requireAuth(state, token, clock.instant());
            return templatesOf(state, auth.workspaceId());
        });
    }

    public TemplateDetail getTemplate(String token, String templateId) {
        return stateStore.transact(state -> {
            AuthContext auth = AccessGuard.requireAuth(state, token, clock.instant());
            Template template = StateQueries.requireTemplate(state, auth.workspaceId(), templateId);
            List<VersionDetail> versions = state.getTemplateVersions().stream()
                .filter(v -> v.getTemplateId().equals(template.getId()))
                .map(v -> new VersionDetail(v, StateQueries.findBuildForVersion(state, v.getId()).orElse(null)))
                .toList();
            return new TemplateDetail(template, versions, releasesOf(state, template.getId()));
        });
    }

    public Template archiveTemplate(String token, String templateId) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireWrite(state, token, now);
            Template template = StateQueries.requireTemplate(state, auth.workspaceId(), templateId);
            if (!template.isArchived()) {
                template.setArchivedAt(now);
                Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "template.archived", "template",
                    template.getId());
            }
            return template;
        });
    }

    public Template restoreTemplate(String token, String templateId) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireWrite(state, token, now);
            Template template = StateQueries.requireTemplate(state, auth.workspaceId(), templateId);
            if (template.isArchived()) {
                template.setArchivedAt(null);
                Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "template.restored", "template",
                    template.getId());
            }
            return template;
        });
    }

    /**
     * 템플릿과 버전, 빌드, 릴리스를 삭제하고 오브젝트 스토어의 번들/로그/아티팩트를 제거합니다.
     *
     * @throws ControlPlaneException 삭제되지 않은 세션이 템플릿을 사용 중이면 CONFLICT
     */
    public void deleteTemplate(String token, String templateId) {
        List<ObjectTarget> orphanedContent = stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            Template template = StateQueries.requireTemplate(state, auth.workspaceId(), templateId);
            boolean inUse = state.getSessions().stream()
                .anyMatch(s -> s.getTemplateId().equals(template.getId()) && s.getState() != SessionState.DELETED);
            if (inUse) {
                throw ControlPlaneException.conflict("Template is used by existing sessions");
            }

            Set<String> versionIds = state.getTemplateVersions().stream()
                .filter(v -> v.getTemplateId().equals(template.getId()))
                .map(TemplateVersion::getId)
                .collect(Collectors.toSet());
            List<ObjectTarget> targets = new ArrayList<>();
            for (String versionId : versionIds) {
                targets.add(ObjectTarget.bundle(versionId));
            }
            for (TemplateBuild build : state.getTemplateBuilds()) {
                if (versionIds.contains(build.getTemplateVersionId())) {
                    targets.add(ObjectTarget.buildLog(build.getId()));
                    targets.add(ObjectTarget.buildArtifact(build.getId()));
                }
            }

            state.getTemplateBuilds().removeIf(b -> versionIds.contains(b.getTemplateVersionId()));
            state.getTemplateVersions().removeIf(v -> versionIds.contains(v.getId()));
            state.getBindingReleases().removeIf(r -> r.getTemplateId().equals(template.getId()));
            state.getTemplates().remove(template);
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "template.deleted", "template",
                template.getId(), Map.of("name", template.getName()));
            return targets;
        });
        orphanedContent.forEach(objectStore::delete);
        log.info("Deleted template {} ({} stored objects removed)", templateId, orphanedContent.size());
    }

    // ============================================================
    // 버전
    // ============================================================

    /**
     * 버전 추가. 버전과 빌드를 QUEUED로 함께 만들고, 커밋 후 빌드를 디스패치합니다.
     */
    public VersionCreated addTemplateVersion(
        String token,
        String templateId,
        String version,
        Manifest manifest,
        String notes
    ) {
        if (version == null || version.isBlank()) {
            throw ControlPlaneException.badRequest("Version is required");
        }
        String trimmedVersion = version.trim();
        Manifest validated = ManifestValidator.validate(manifest);
        VersionCreated created = stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireWrite(state, token, now);
            Template template = StateQueries.requireTemplate(state, auth.workspaceId(), templateId);
            if (template.isArchived()) {
                throw ControlPlaneException.conflict("Template is archived");
            }
            boolean duplicate = state.getTemplateVersions().stream()
                .anyMatch(v -> v.getTemplateId().equals(template.getId()) && v.getVersion().equals(trimmedVersion));
            if (duplicate) {
                throw ControlPlaneException.conflict("Version already exists");
            }

            TemplateVersion templateVersion = new TemplateVersion();
            templateVersion.setId(Ids.next("tplv"));
            templateVersion.setTemplateId(template.getId());
            templateVersion.setVersion(trimmedVersion);
            templateVersion.setStatus(VersionStatus.QUEUED);
            templateVersion.setNotes(notes == null ? "" : notes);
            templateVersion.setManifest(validated);
            templateVersion.setCreatedAt(now);
            state.getTemplateVersions().add(templateVersion);

            TemplateBuild build = new TemplateBuild();
            build.setId(Ids.next("bld"));
            build.setTemplateVersionId(templateVersion.getId());
            build.setStatus(BuildStatus.QUEUED);
            build.setCreatedAt(now);
            build.setUpdatedAt(now);
            state.getTemplateBuilds().add(build);

            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "template.version_added",
                "template_version", templateVersion.getId(), Map.of("version", trimmedVersion));
            return new VersionCreated(templateVersion, build);
        });
        DispatchSupport.enqueueBuild(jobDispatcher, created.build().getId());
        return created;
    }

    /**
     * 버전 삭제. 활성 버전은 삭제할 수 없습니다.
     */
    public void deleteTemplateVersion(String token, String templateId, String versionId) {
        List<ObjectTarget> orphanedContent = stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            Template template = StateQueries.requireTemplate(state, auth.workspaceId(), templateId);
            TemplateVersion version = StateQueries.requireVersion(state, template.getId(), versionId);
            if (version.getId().equals(template.getActiveVersionId())) {
                throw ControlPlaneException.conflict("Active version cannot be deleted");
            }
            List<ObjectTarget> targets = new ArrayList<>();
            targets.add(ObjectTarget.bundle(version.getId()));
            StateQueries.findBuildForVersion(state, version.getId()).ifPresent(build -> {
                targets.add(ObjectTarget.buildLog(build.getId()));
                targets.add(ObjectTarget.buildArtifact(build.getId()));
            });
            state.getTemplateBuilds().removeIf(b -> b.getTemplateVersionId().equals(version.getId()));
            state.getTemplateVersions().remove(version);
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "template.version_deleted",
                "template_version", version.getId(), Map.of("version", version.getVersion()));
            return targets;
        });
        orphanedContent.forEach(objectStore::delete);
    }

    // ============================================================
    // 빌드
    // ============================================================

    public List<TemplateBuild> listTemplateBuilds(String token) {
        return stateStore.transact(state -> {
            AuthContext auth = AccessGuard.requireAuth(state, token, clock.instant());
            return state.getTemplateBuilds().stream()
                .filter(b -> StateQueries.templateOfBuild(state, b)
                    .map(t -> t.getWorkspaceId().equals(auth.workspaceId()))
                    .orElse(false))
                .toList();
        });
    }

    /**
     * 빌드 하나를 처리합니다 (시스템 작업, 디스패처 워커에서 호출).
     *
     * @return 처리된 빌드, 없거나 처리 대상이 아니면 empty
     */
    public Optional<TemplateBuild> processTemplateBuildById(String buildId) {
        return stateStore.transact(state -> {
            Optional<TemplateBuild> build = state.getTemplateBuilds().stream()
                .filter(b -> b.getId().equals(buildId))
                .findFirst();
            if (build.isEmpty()) {
                log.debug("Build {} not found, nothing to process", buildId);
                return Optional.<TemplateBuild>empty();
            }
            if (!buildPipeline.process(state, build.get(), clock.instant(), null)) {
                log.debug("Build {} not eligible ({})", buildId, build.get().getStatus());
                return Optional.<TemplateBuild>empty();
            }
            return build;
        });
    }

    /**
     * 호출자 워크스페이스의 대기 빌드를 모두 처리합니다.
     */
    public List<TemplateBuild> processTemplateBuilds(String token) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            return buildPipeline.drain(state, now, auth.workspaceId()::equals, auth.userId());
        });
    }

    /**
     * 실패한 빌드 재시도. FAILED 상태에서만 허용됩니다.
     */
    public TemplateBuild retryTemplateBuild(String token, String buildId) {
        TemplateBuild retried = stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            TemplateBuild build = StateQueries.requireBuild(state, auth.workspaceId(), buildId);
            if (build.getStatus() != BuildStatus.FAILED) {
                throw ControlPlaneException.conflict(
                    "Only failed builds can be retried (current: " + build.getStatus().wireName() + ")");
            }
            requeue(state, build, now);
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "template.build_retried",
                "template_build", build.getId());
            return build;
        });
        DispatchSupport.enqueueBuild(jobDispatcher, retried.getId());
        return retried;
    }

    /**
     * 워크스페이스의 DEAD_LETTERED 빌드를 모두 RETRYING으로 되돌리고 실패 횟수를 초기화합니다.
     */
    public BulkRetryResult retryDeadLetteredBuilds(String token) {
        BulkRetryResult result = stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            List<String> buildIds = new ArrayList<>();
            for (TemplateBuild build : state.getTemplateBuilds()) {
                if (build.getStatus() != BuildStatus.DEAD_LETTERED) {
                    continue;
                }
                boolean inWorkspace = StateQueries.templateOfBuild(state, build)
                    .map(t -> t.getWorkspaceId().equals(auth.workspaceId()))
                    .orElse(false);
                if (!inWorkspace) {
                    continue;
                }
                requeue(state, build, now);
                build.setFailures(0);
                buildIds.add(build.getId());
            }
            if (!buildIds.isEmpty()) {
                Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "template.dead_letters_retried",
                    "workspace", auth.workspaceId(), Map.of("count", String.valueOf(buildIds.size())));
            }
            return new BulkRetryResult(buildIds.size(), buildIds);
        });
        DispatchSupport.enqueueBuilds(jobDispatcher, result.buildIds());
        return result;
    }

    private void requeue(StateDocument state, TemplateBuild build, Instant now) {
        build.setStatus(BuildTransitions.transition(build.getStatus(), BuildStatus.RETRYING));
        build.setUpdatedAt(now);
        StateQueries.findVersion(state, build.getTemplateVersionId())
            .ifPresent(v -> v.setStatus(VersionStatus.QUEUED));
    }

    public String getBuildLog(String token, String buildId) {
        StoredObject stored = readBuildObject(token, buildId, ObjectTarget.buildLog(buildId), "Build log not found");
        return new String(stored.body(), StandardCharsets.UTF_8);
    }

    /**
     * 성공한 빌드의 아티팩트 JSON.
     */
    public String getBuildArtifact(String token, String buildId) {
        StoredObject stored = readBuildObject(token, buildId, ObjectTarget.buildArtifact(buildId),
            "Build artifact not found");
        return new String(stored.body(), StandardCharsets.UTF_8);
    }

    private StoredObject readBuildObject(String token, String buildId, ObjectTarget target, String missing) {
        stateStore.transact(state -> {
            AuthContext auth = AccessGuard.requireAuth(state, token, clock.instant());
            return StateQueries.requireBuild(state, auth.workspaceId(), buildId);
        });
        return objectStore.get(target).orElseThrow(() -> ControlPlaneException.notFound(missing));
    }

    // ============================================================
    // 승격 / 롤백
    // ============================================================

    /**
     * READY 버전을 활성 버전으로 승격하고 릴리스를 하나 추가합니다.
     */
    public PromotionResult promoteTemplateVersion(String token, String templateId, String versionId) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            Template template = StateQueries.requireTemplate(state, auth.workspaceId(), templateId);
            TemplateVersion version = StateQueries.requireVersion(state, template.getId(), versionId);
            if (version.getStatus() != VersionStatus.READY) {
                throw ControlPlaneException.conflict(
                    "Version is not ready (current: " + version.getStatus().wireName() + ")");
            }
            BindingRelease release = activate(state, template, version, now);
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "template.version_promoted",
                "template_version", version.getId(), Map.of("releaseId", release.getId()));
            return new PromotionResult(template, version, release);
        });
    }

    /**
     * 직전 릴리스의 버전으로 되돌립니다 (새 릴리스 기록 추가).
     *
     * @throws ControlPlaneException 되돌릴 READY 버전이 없으면 CONFLICT
     */
    public PromotionResult rollbackTemplate(String token, String templateId) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireManage(state, token, now);
            Template template = StateQueries.requireTemplate(state, auth.workspaceId(), templateId);
            List<BindingRelease> releases = releasesOf(state, template.getId());
            TemplateVersion target = null;
            for (int i = releases.size() - 1; i >= 0 && target == null; i--) {
                BindingRelease release = releases.get(i);
                if (release.getTemplateVersionId().equals(template.getActiveVersionId())) {
                    continue;
                }
                target = StateQueries.findVersion(state, release.getTemplateVersionId())
                    .filter(v -> v.getStatus() == VersionStatus.READY)
                    .orElse(null);
            }
            if (target == null) {
                throw ControlPlaneException.conflict("No previous release to roll back to");
            }
            String previousVersionId = template.getActiveVersionId();
            BindingRelease release = activate(state, template, target, now);
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "template.rolled_back",
                "template_version", target.getId(),
                Map.of("releaseId", release.getId(), "fromVersionId", String.valueOf(previousVersionId)));
            return new PromotionResult(template, target, release);
        });
    }

    private BindingRelease activate(StateDocument state, Template template, TemplateVersion version, Instant now) {
        TemplateBuild build = StateQueries.findBuildForVersion(state, version.getId()).orElse(null);
        template.setActiveVersionId(version.getId());
        BindingRelease release = new BindingRelease();
        release.setId(Ids.next("rel"));
        release.setWorkspaceId(template.getWorkspaceId());
        release.setTemplateId(template.getId());
        release.setTemplateVersionId(version.getId());
        release.setVersion(version.getVersion());
        release.setImageReference(build == null ? null : build.getImageReference());
        release.setImageDigest(build == null ? null : build.getImageDigest());
        release.setArtifactSource(version.getBundleBytes() != null ? "bundle" : "manifest");
        release.setCreatedAt(now);
        state.getBindingReleases().add(release);
        log.info("Template {} now serves version {} ({})", template.getId(), version.getVersion(),
            release.getImageReference());
        return release;
    }

    public List<BindingRelease> listBindingReleases(String token) {
        return stateStore.transact(state -> {
            AuthContext auth = AccessGuard.requireAuth(state, token, clock.instant());
            return state.getBindingReleases().stream()
                .filter(r -> r.getWorkspaceId().equals(auth.workspaceId()))
                .toList();
        });
    }

    private static List<Template> templatesOf(StateDocument state, String workspaceId) {
        return state.getTemplates().stream().filter(t -> t.getWorkspaceId().equals(workspaceId)).toList();
    }

    private static List<BindingRelease> releasesOf(StateDocument state, String templateId) {
        return state.getBindingReleases().stream().filter(r -> r.getTemplateId().equals(templateId)).toList();
    }
}
