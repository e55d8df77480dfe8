package com.ryuqq.controlplane.application.template;

import com.ryuqq.controlplane.application.ControlPlaneTestSupport;
import com.ryuqq.controlplane.core.error.ErrorKind;
import com.ryuqq.controlplane.core.model.BindingRelease;
import com.ryuqq.controlplane.core.model.Manifest;
import com.ryuqq.controlplane.core.model.Session;
import com.ryuqq.controlplane.core.model.Template;
import com.ryuqq.controlplane.core.model.TemplateBuild;
import com.ryuqq.controlplane.core.model.VersionStatus;
import com.ryuqq.controlplane.core.spi.ObjectTarget;
import com.ryuqq.controlplane.core.statemachine.BuildStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TemplateService 시나리오 테스트.
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
class TemplateServiceTest extends ControlPlaneTestSupport {

    private String token;
    private TemplateService templates;

    @BeforeEach
    void setUp() {
        token = register("owner@example.com").tokenValue();
        templates = controlPlane.templates();
    }

    // ============================================================
    // 템플릿
    // ============================================================

    @Test
    void 템플릿_이름은_대소문자_구분없이_유일() {
        // given
        templates.createTemplate(token, "Node Dev", "");

        // when & then
        assertKind(() -> templates.createTemplate(token, "node dev", ""), ErrorKind.CONFLICT);
        assertKind(() -> templates.createTemplate(token, "  ", ""), ErrorKind.BAD_REQUEST);
    }

    @Test
    void 보관된_템플릿은_버전_추가_불가_복원_후_가능() {
        // given
        Template template = templates.createTemplate(token, "node", "");
        templates.archiveTemplate(token, template.getId());

        // when & then
        assertKind(() -> templates.addTemplateVersion(token, template.getId(), "1.0.0", manifest("ssh"), ""),
            ErrorKind.CONFLICT);

        templates.restoreTemplate(token, template.getId());
        VersionCreated created = templates.addTemplateVersion(token, template.getId(), "1.0.0", manifest("ssh"), "");
        assertThat(created.version().getStatus()).isEqualTo(VersionStatus.QUEUED);
    }

    // ============================================================
    // 버전과 빌드
    // ============================================================

    @Test
    void 버전_추가시_빌드가_QUEUED로_디스패치됨() {
        // given
        Template template = templates.createTemplate(token, "node", "");

        // when
        VersionCreated created = templates.addTemplateVersion(token, template.getId(), "1.0.0", manifest("ssh"), "");

        // then
        assertThat(created.build().getStatus()).isEqualTo(BuildStatus.QUEUED);
        assertThat(created.build().getTemplateVersionId()).isEqualTo(created.version().getId());
        assertThat(dispatcher.drainBuilds(10)).containsExactly(created.build().getId());
        assertKind(() -> templates.addTemplateVersion(token, template.getId(), "1.0.0", manifest(), ""),
            ErrorKind.CONFLICT);
    }

    @Test
    void 지원하지_않는_기능이나_상대경로는_BAD_REQUEST() {
        // given
        Template template = templates.createTemplate(token, "node", "");
        Manifest relative = manifest("ssh");
        relative.setPersistedPaths(List.of("workspace"));

        // when & then
        assertKind(() -> templates.addTemplateVersion(token, template.getId(), "1.0.0", manifest("gpu"), ""),
            ErrorKind.BAD_REQUEST);
        assertKind(() -> templates.addTemplateVersion(token, template.getId(), "1.0.0", relative, ""),
            ErrorKind.BAD_REQUEST);
        assertKind(() -> templates.addTemplateVersion(token, template.getId(), " ", manifest(), ""),
            ErrorKind.BAD_REQUEST);
    }

    @Test
    void 빌드_성공시_버전은_READY_로그와_아티팩트_저장() {
        // given
        Template template = templates.createTemplate(token, "node", "");
        VersionCreated created = templates.addTemplateVersion(token, template.getId(), "1.0.0", manifest("ssh"), "");

        // when
        List<TemplateBuild> processed = templates.processTemplateBuilds(token);

        // then
        assertThat(processed).hasSize(1);
        assertThat(processed.get(0).getStatus()).isEqualTo(BuildStatus.SUCCEEDED);
        assertThat(processed.get(0).getAttempts()).isEqualTo(1);
        assertThat(processed.get(0).getImageReference())
            .startsWith("registry.example.com/devbox/node@sha256:");

        String buildId = created.build().getId();
        assertThat(templates.getBuildLog(token, buildId))
            .contains("bundle_uploaded=false")
            .contains("build_status=succeeded");
        assertThat(templates.getBuildArtifact(token, buildId))
            .contains("\"source\":\"manifest\"")
            .contains(created.version().getId());

        TemplateDetail detail = templates.getTemplate(token, template.getId());
        assertThat(detail.versions()).singleElement()
            .satisfies(v -> assertThat(v.version().getStatus()).isEqualTo(VersionStatus.READY));
    }

    @Test
    void 번들을_올린_버전은_번들_아티팩트로_빌드() {
        // given
        Template template = templates.createTemplate(token, "node", "");
        VersionCreated created = templates.addTemplateVersion(token, template.getId(), "1.0.0", manifest("ssh"), "");
        controlPlane.uploads().uploadTemplateVersionBundle(token, template.getId(), created.version().getId(),
            "tarball".getBytes(StandardCharsets.UTF_8), "application/gzip");

        // when
        templates.processTemplateBuilds(token);
        PromotionResult promoted = templates.promoteTemplateVersion(token, template.getId(), created.version().getId());

        // then
        assertThat(templates.getBuildLog(token, created.build().getId())).contains("bundle_uploaded=true");
        assertThat(promoted.release().getArtifactSource()).isEqualTo("bundle");
    }

    @Test
    void 번들_크기_한도를_넘으면_PAYLOAD_TOO_LARGE() {
        // given
        Template template = templates.createTemplate(token, "node", "");
        VersionCreated created = templates.addTemplateVersion(token, template.getId(), "1.0.0", manifest(), "");

        // when & then
        assertKind(() -> controlPlane.uploads().uploadTemplateVersionBundle(token, template.getId(),
            created.version().getId(), new byte[300_000], "application/gzip"), ErrorKind.PAYLOAD_TOO_LARGE);
    }

    // ============================================================
    // 재시도와 dead-letter
    // ============================================================

    @Test
    void 연속_실패하면_dead_letter_일괄_재시도로_복구() {
        // given
        Template template = templates.createTemplate(token, "broken", "");
        VersionCreated created = templates.addTemplateVersion(token, template.getId(), "1.0.0", failingManifest(), "");
        String buildId = created.build().getId();

        // when: 첫 실패
        TemplateBuild first = templates.processTemplateBuilds(token).get(0);

        // then
        assertThat(first.getStatus()).isEqualTo(BuildStatus.FAILED);
        assertThat(first.getFailures()).isEqualTo(1);
        assertThat(first.getLastError()).isEqualTo("Simulated build failure");
        assertThat(templates.processTemplateBuilds(token)).isEmpty();

        // when: 재시도 후 두 번째 실패
        assertThat(templates.retryTemplateBuild(token, buildId).getStatus()).isEqualTo(BuildStatus.RETRYING);
        TemplateBuild second = templates.processTemplateBuilds(token).get(0);

        // then
        assertThat(second.getStatus()).isEqualTo(BuildStatus.DEAD_LETTERED);
        assertThat(second.getFailures()).isEqualTo(2);
        assertKind(() -> templates.retryTemplateBuild(token, buildId), ErrorKind.CONFLICT);
        assertThat(templates.getTemplate(token, template.getId()).versions().get(0).version().getStatus())
            .isEqualTo(VersionStatus.FAILED);

        // when: 일괄 재시도
        BulkRetryResult result = templates.retryDeadLetteredBuilds(token);

        // then
        assertThat(result.recovered()).isEqualTo(1);
        assertThat(result.buildIds()).containsExactly(buildId);
        TemplateBuild retried = templates.listTemplateBuilds(token).get(0);
        assertThat(retried.getStatus()).isEqualTo(BuildStatus.RETRYING);
        assertThat(retried.getFailures()).isZero();
        assertThat(templates.retryDeadLetteredBuilds(token).recovered()).isZero();
    }

    @Test
    void 시스템_처리는_없는_빌드면_empty() {
        assertThat(templates.processTemplateBuildById("bld_missing")).isEmpty();
    }

    @Test
    void 시스템_처리로_대기_빌드_하나를_실행() {
        // given
        Template template = templates.createTemplate(token, "node", "");
        VersionCreated created = templates.addTemplateVersion(token, template.getId(), "1.0.0", manifest(), "");

        // when
        var processed = templates.processTemplateBuildById(created.build().getId());

        // then
        assertThat(processed).hasValueSatisfying(b -> assertThat(b.getStatus()).isEqualTo(BuildStatus.SUCCEEDED));
        assertThat(templates.processTemplateBuildById(created.build().getId())).isEmpty();
    }

    // ============================================================
    // 승격 / 롤백
    // ============================================================

    @Test
    void READY가_아닌_버전은_승격_불가() {
        // given
        Template template = templates.createTemplate(token, "node", "");
        VersionCreated created = templates.addTemplateVersion(token, template.getId(), "1.0.0", manifest(), "");

        // when & then
        assertKind(() -> templates.promoteTemplateVersion(token, template.getId(), created.version().getId()),
            ErrorKind.CONFLICT);
    }

    @Test
    void 승격하면_활성_버전과_릴리스_기록() {
        // when
        Template template = readyTemplate(token, "node");

        // then
        List<BindingRelease> releases = templates.listBindingReleases(token);
        assertThat(releases).singleElement().satisfies(release -> {
            assertThat(release.getTemplateId()).isEqualTo(template.getId());
            assertThat(release.getTemplateVersionId()).isEqualTo(template.getActiveVersionId());
            assertThat(release.getVersion()).isEqualTo("1.0.0");
            assertThat(release.getArtifactSource()).isEqualTo("manifest");
            assertThat(release.getImageReference()).startsWith("registry.example.com/devbox/node@sha256:");
        });
    }

    @Test
    void 롤백은_직전_릴리스_버전으로_되돌림() {
        // given
        Template template = readyTemplate(token, "node");
        String firstVersionId = template.getActiveVersionId();
        VersionCreated second = templates.addTemplateVersion(token, template.getId(), "2.0.0", manifest("ssh"), "");
        templates.processTemplateBuilds(token);
        templates.promoteTemplateVersion(token, template.getId(), second.version().getId());

        // when
        PromotionResult rolledBack = templates.rollbackTemplate(token, template.getId());

        // then
        assertThat(rolledBack.activeVersion().getId()).isEqualTo(firstVersionId);
        assertThat(rolledBack.template().getActiveVersionId()).isEqualTo(firstVersionId);
        assertThat(templates.listBindingReleases(token)).extracting(BindingRelease::getVersion)
            .containsExactly("1.0.0", "2.0.0", "1.0.0");
    }

    @Test
    void 되돌릴_릴리스가_없으면_롤백_CONFLICT() {
        // given
        Template template = readyTemplate(token, "node");

        // when & then
        assertKind(() -> templates.rollbackTemplate(token, template.getId()), ErrorKind.CONFLICT);
    }

    // ============================================================
    // 삭제
    // ============================================================

    @Test
    void 활성_버전은_삭제_불가() {
        // given
        Template template = readyTemplate(token, "node");

        // when & then
        assertKind(() -> templates.deleteTemplateVersion(token, template.getId(), template.getActiveVersionId()),
            ErrorKind.CONFLICT);
    }

    @Test
    void 세션이_사용_중인_템플릿은_삭제_불가_세션_삭제_후_가능() {
        // given
        Template template = readyTemplate(token, "node");
        Session session = controlPlane.sessions().createSession(token, "dev", template.getId());
        String buildId = templates.listTemplateBuilds(token).get(0).getId();

        // when & then
        assertKind(() -> templates.deleteTemplate(token, template.getId()), ErrorKind.CONFLICT);

        controlPlane.sessions().deleteSession(token, session.getId());
        templates.deleteTemplate(token, template.getId());

        assertThat(templates.listTemplates(token)).isEmpty();
        assertThat(templates.listBindingReleases(token)).isEmpty();
        assertThat(objectStore.contains(ObjectTarget.buildLog(buildId))).isFalse();
        assertThat(objectStore.contains(ObjectTarget.buildArtifact(buildId))).isFalse();
        assertKind(() -> templates.getTemplate(token, template.getId()), ErrorKind.NOT_FOUND);
    }
}
