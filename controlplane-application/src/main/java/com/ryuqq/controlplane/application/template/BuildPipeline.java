package com.ryuqq.controlplane.application.template;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.controlplane.application.ledger.Ledger;
import com.ryuqq.controlplane.application.support.StateQueries;
import com.ryuqq.controlplane.core.builder.BuildRequest;
import com.ryuqq.controlplane.core.builder.TemplateBuilder;
import com.ryuqq.controlplane.core.config.ControlPlaneConfig;
import com.ryuqq.controlplane.core.model.Template;
import com.ryuqq.controlplane.core.model.TemplateBuild;
import com.ryuqq.controlplane.core.model.TemplateVersion;
import com.ryuqq.controlplane.core.model.UsageKind;
import com.ryuqq.controlplane.core.model.VersionStatus;
import com.ryuqq.controlplane.core.outcome.BuildFailed;
import com.ryuqq.controlplane.core.outcome.BuildOutcome;
import com.ryuqq.controlplane.core.outcome.BuildSucceeded;
import com.ryuqq.controlplane.core.spi.ObjectStore;
import com.ryuqq.controlplane.core.spi.ObjectTarget;
import com.ryuqq.controlplane.core.state.StateDocument;
import com.ryuqq.controlplane.core.statemachine.BuildStatus;
import com.ryuqq.controlplane.core.statemachine.BuildTransitions;
import com.ryuqq.controlplane.core.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 템플릿 빌드 실행 파이프라인.
 *
 * <p>트랜잭션 본문 안에서 호출되며, 전달받은 draft만 수정합니다.
 * 빌드 로그와 아티팩트는 {@link ObjectStore}에 기록합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * QUEUED/RETRYING → BUILDING → SUCCEEDED
 *                            → FAILED         (연속 실패 1회)
 *                            → DEAD_LETTERED  (연속 실패 2회)
 * BUILDING (임계 시간 초과) → RETRYING          (stuck 복구)
 * </pre>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class BuildPipeline {

    private static final Logger log = LoggerFactory.getLogger(BuildPipeline.class);

    private static final String LOG_CONTENT_TYPE = "text/plain; charset=utf-8";
    private static final String ARTIFACT_CONTENT_TYPE = "application/json";

    private final TemplateBuilder templateBuilder;
    private final ObjectStore objectStore;
    private final ControlPlaneConfig config;

    public BuildPipeline(TemplateBuilder templateBuilder, ObjectStore objectStore, ControlPlaneConfig config) {
        if (templateBuilder == null) {
            throw new IllegalArgumentException("templateBuilder cannot be null");
        }
        if (objectStore == null) {
            throw new IllegalArgumentException("objectStore cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.templateBuilder = templateBuilder;
        this.objectStore = objectStore;
        this.config = config;
    }

    /**
     * 처리 가능한 빌드 하나를 실행합니다.
     *
     * @param actorUserId 감사 로그 행위자 (시스템 실행이면 null)
     * @return 처리했으면 true, 처리 대상이 아니거나 고아 빌드면 false
     */
    public boolean process(StateDocument draft, TemplateBuild build, Instant now, String actorUserId) {
        if (!build.getStatus().isProcessable()) {
            return false;
        }
        Optional<TemplateVersion> versionLookup = StateQueries.findVersion(draft, build.getTemplateVersionId());
        Optional<Template> templateLookup = versionLookup
            .flatMap(v -> StateQueries.findTemplate(draft, v.getTemplateId()));
        if (versionLookup.isEmpty() || templateLookup.isEmpty()) {
            log.warn("Skipping orphan build {} (version {} missing)", build.getId(), build.getTemplateVersionId());
            return false;
        }
        TemplateVersion version = versionLookup.get();
        Template template = templateLookup.get();
        VersionStatus priorVersionStatus = version.getStatus();

        build.setStatus(BuildTransitions.transition(build.getStatus(), BuildStatus.BUILDING));
        build.setAttempts(build.getAttempts() + 1);
        build.setStartedAt(now);
        build.setUpdatedAt(now);
        version.setStatus(VersionStatus.BUILDING);

        BuildRequest request = new BuildRequest(
            build.getId(),
            template.getId(),
            version.getId(),
            version.getVersion(),
            version.getManifest(),
            build.getAttempts(),
            version.getBundleBytes()
        );
        BuildOutcome outcome = runBuilder(request);
        objectStore.put(ObjectTarget.buildLog(build.getId()),
            outcome.log().getBytes(StandardCharsets.UTF_8), LOG_CONTENT_TYPE);

        if (outcome instanceof BuildSucceeded succeeded) {
            onSuccess(draft, template, version, build, succeeded, now, actorUserId);
        } else if (outcome instanceof BuildFailed failed) {
            onFailure(draft, template, version, build, failed, priorVersionStatus, now, actorUserId);
        }
        return true;
    }

    private BuildOutcome runBuilder(BuildRequest request) {
        try {
            return templateBuilder.build(request);
        } catch (RuntimeException e) {
            log.warn("Builder threw for build {}: {}", request.buildId(), e.getMessage(), e);
            return new BuildFailed(
                "Builder error: " + e.getMessage(),
                "build_id=" + request.buildId() + "\nerror=" + e.getMessage() + "\nbuild_status=failed\n"
            );
        }
    }

    private void onSuccess(
        StateDocument draft,
        Template template,
        TemplateVersion version,
        TemplateBuild build,
        BuildSucceeded outcome,
        Instant now,
        String actorUserId
    ) {
        build.setStatus(BuildTransitions.transition(build.getStatus(), BuildStatus.SUCCEEDED));
        build.setFailures(0);
        build.setLastError(null);
        build.setImageReference(outcome.imageReference());
        build.setImageDigest(outcome.imageDigest());
        build.setFinishedAt(now);
        build.setUpdatedAt(now);
        version.setStatus(VersionStatus.READY);
        version.setBuiltAt(now);

        objectStore.put(ObjectTarget.buildArtifact(build.getId()),
            Jsons.toBytes(artifactOf(template, version, build, now)), ARTIFACT_CONTENT_TYPE);

        Ledger.usage(draft, now, template.getWorkspaceId(), UsageKind.TEMPLATE_BUILD, 1,
            Map.of("templateId", template.getId(), "buildId", build.getId()));
        Ledger.audit(draft, now, template.getWorkspaceId(), actorUserId, "template.build_succeeded",
            "template_build", build.getId(), Map.of("imageReference", outcome.imageReference()));
        log.info("Build {} succeeded on attempt {} ({})", build.getId(), build.getAttempts(),
            outcome.imageReference());
    }

    private void onFailure(
        StateDocument draft,
        Template template,
        TemplateVersion version,
        TemplateBuild build,
        BuildFailed outcome,
        VersionStatus priorVersionStatus,
        Instant now,
        String actorUserId
    ) {
        build.setFailures(build.getFailures() + 1);
        build.setLastError(outcome.error());
        build.setFinishedAt(now);
        build.setUpdatedAt(now);

        if (build.getFailures() >= ControlPlaneConfig.DEAD_LETTER_AFTER_FAILURES) {
            build.setStatus(BuildTransitions.transition(build.getStatus(), BuildStatus.DEAD_LETTERED));
            version.setStatus(VersionStatus.FAILED);
            Ledger.audit(draft, now, template.getWorkspaceId(), actorUserId, "template.build_dead_lettered",
                "template_build", build.getId(), Map.of("error", outcome.error()));
            log.warn("Build {} dead-lettered after {} consecutive failures: {}",
                build.getId(), build.getFailures(), outcome.error());
            return;
        }

        build.setStatus(BuildTransitions.transition(build.getStatus(), BuildStatus.FAILED));
        version.setStatus(priorVersionStatus);
        Ledger.audit(draft, now, template.getWorkspaceId(), actorUserId, "template.build_failed",
            "template_build", build.getId(), Map.of("error", outcome.error()));
        log.info("Build {} failed on attempt {}: {}", build.getId(), build.getAttempts(), outcome.error());
    }

    private ObjectNode artifactOf(Template template, TemplateVersion version, TemplateBuild build, Instant now) {
        boolean bundled = version.getBundleBytes() != null;
        ObjectNode artifact = Jsons.mapper().createObjectNode();
        artifact.put("buildId", build.getId());
        artifact.put("templateId", template.getId());
        artifact.put("templateVersionId", version.getId());
        artifact.put("version", version.getVersion());
        artifact.put("source", bundled ? "bundle" : "manifest");
        artifact.put("baseImage", version.getManifest().getImage());
        artifact.put("imageReference", build.getImageReference());
        artifact.put("imageDigest", build.getImageDigest());
        artifact.put("layerCount", bundled ? 2 : 1);
        artifact.putPOJO("features", version.getManifest().getFeatures());
        artifact.put("builtAt", now.toString());
        return artifact;
    }

    /**
     * 조건에 맞는 처리 가능한 빌드를 생성 순서대로 모두 실행합니다.
     *
     * @param workspaceFilter 대상 워크스페이스 조건
     * @return 처리된 빌드
     */
    public List<TemplateBuild> drain(
        StateDocument draft,
        Instant now,
        Predicate<String> workspaceFilter,
        String actorUserId
    ) {
        List<TemplateBuild> candidates = draft.getTemplateBuilds().stream()
            .filter(b -> b.getStatus().isProcessable())
            .filter(b -> StateQueries.templateOfBuild(draft, b)
                .map(t -> workspaceFilter.test(t.getWorkspaceId()))
                .orElse(false))
            .toList();
        List<TemplateBuild> processed = new ArrayList<>();
        for (TemplateBuild build : candidates) {
            if (process(draft, build, now, actorUserId)) {
                processed.add(build);
            }
        }
        return processed;
    }

    /**
     * BUILDING 상태로 {@code stuckBuildThreshold} 이상 머물렀는지 여부.
     */
    public boolean isStuck(TemplateBuild build, Instant now) {
        if (build.getStatus() != BuildStatus.BUILDING) {
            return false;
        }
        Instant startedAt = build.getStartedAt() != null ? build.getStartedAt() : build.getUpdatedAt();
        return startedAt != null && !startedAt.isAfter(now.minus(config.stuckBuildThreshold()));
    }

    /**
     * 임계 시간 이상 BUILDING에 머문 빌드를 RETRYING으로 되돌립니다.
     *
     * @return 복구된 빌드
     */
    public List<TemplateBuild> recoverStuck(StateDocument draft, Instant now, Predicate<String> workspaceFilter) {
        List<TemplateBuild> recovered = new ArrayList<>();
        for (TemplateBuild build : draft.getTemplateBuilds()) {
            if (!isStuck(build, now)) {
                continue;
            }
            Optional<Template> template = StateQueries.templateOfBuild(draft, build);
            if (template.isEmpty() || !workspaceFilter.test(template.get().getWorkspaceId())) {
                continue;
            }
            build.setStatus(BuildTransitions.transition(build.getStatus(), BuildStatus.RETRYING));
            build.setLastError("Recovered stuck build");
            build.setUpdatedAt(now);
            StateQueries.findVersion(draft, build.getTemplateVersionId())
                .ifPresent(v -> v.setStatus(VersionStatus.QUEUED));
            Ledger.audit(draft, now, template.get().getWorkspaceId(), null, "template.build_recovered",
                "template_build", build.getId());
            recovered.add(build);
        }
        if (!recovered.isEmpty()) {
            log.warn("Recovered {} stuck builds", recovered.size());
        }
        return recovered;
    }
}
