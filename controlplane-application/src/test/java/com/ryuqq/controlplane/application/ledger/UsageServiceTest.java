package com.ryuqq.controlplane.application.ledger;

import com.ryuqq.controlplane.application.ControlPlaneTestSupport;
import com.ryuqq.controlplane.core.error.ControlPlaneException;
import com.ryuqq.controlplane.core.error.ErrorKind;
import com.ryuqq.controlplane.core.model.AuditLog;
import com.ryuqq.controlplane.core.model.Plan;
import com.ryuqq.controlplane.core.model.Session;
import com.ryuqq.controlplane.core.model.Template;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * UsageService 시나리오 테스트.
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
class UsageServiceTest extends ControlPlaneTestSupport {

    private String token;
    private UsageService usage;

    @BeforeEach
    void setUp() {
        token = register("owner@example.com").tokenValue();
        usage = controlPlane.usage();
    }

    @Test
    void 사용량은_플랜_한도와_함께_집계() {
        // given
        Template template = readyTemplate(token, "node");
        Session session = controlPlane.sessions().createSession(token, "dev", template.getId());
        controlPlane.sessions().startSession(token, session.getId());
        controlPlane.uploads().createSnapshot(token, session.getId(), "nightly");

        // when
        UsageReport report = usage.getUsage(token);

        // then
        assertThat(report.plan()).isEqualTo(Plan.FREE);
        assertThat(report.limits().maxTemplates()).isEqualTo(10);
        assertThat(report.limits().maxRunningSessions()).isEqualTo(3);
        assertThat(report.usage()).isEqualTo(new UsageSummary(1, 1, 1));
    }

    @Test
    void 감사_로그는_최신순으로_limit만큼() {
        // given
        controlPlane.templates().createTemplate(token, "first", "");
        controlPlane.templates().createTemplate(token, "second", "");

        // when
        List<AuditLog> latest = usage.getAudit(token, 2);

        // then
        assertThat(latest).hasSize(2);
        assertThat(latest).extracting(AuditLog::getAction).containsExactly("template.created", "template.created");
        assertThat(latest.get(0).getDetails()).containsEntry("name", "second");
        assertThat(latest.get(1).getDetails()).containsEntry("name", "first");
        assertThat(usage.getAudit(token).size()).isGreaterThan(2);
    }

    @Test
    void 감사_로그는_워크스페이스별로_분리() {
        // given
        String stranger = register("stranger@example.com").tokenValue();
        controlPlane.templates().createTemplate(stranger, "secret", "");

        // when
        List<AuditLog> mine = usage.getAudit(token);

        // then
        assertThat(mine).noneMatch(entry -> "template.created".equals(entry.getAction()));
    }

    @Test
    void limit이_0_이하면_BAD_REQUEST() {
        assertKind(() -> usage.getAudit(token, 0), ErrorKind.BAD_REQUEST);
        assertThatThrownBy(() -> usage.getAudit(token, -1))
            .isInstanceOf(ControlPlaneException.class)
            .hasMessageContaining("limit must be positive");
    }

    @Test
    void 관리자_보고서는_빌드와_세션_상태를_집계() {
        // given
        Template template = readyTemplate(token, "node");
        Template broken = controlPlane.templates().createTemplate(token, "broken", "");
        controlPlane.templates().addTemplateVersion(token, broken.getId(), "1.0.0", failingManifest(), "");
        controlPlane.templates().addTemplateVersion(token, template.getId(), "2.0.0", manifest("ssh"), "");

        Session running = controlPlane.sessions().createSession(token, "running", template.getId());
        controlPlane.sessions().startSession(token, running.getId());
        Session sleeping = controlPlane.sessions().createSession(token, "sleeping", template.getId());
        controlPlane.sessions().startSession(token, sleeping.getId());
        controlPlane.sessions().stopSession(token, sleeping.getId());
        controlPlane.sessions().createSession(token, "idle", template.getId());

        // when
        AdminReport report = usage.getAdminReport(token);

        // then
        assertThat(report.members()).isEqualTo(1);
        assertThat(report.templates()).isEqualTo(2);
        assertThat(report.buildsQueued()).isEqualTo(2);
        assertThat(report.buildsBuilding()).isZero();
        assertThat(report.buildsDeadLettered()).isZero();
        assertThat(report.sessionsRunning()).isEqualTo(1);
        assertThat(report.sessionsSleeping()).isEqualTo(1);
        assertThat(report.sessionsTotal()).isEqualTo(3);
        assertThat(report.releases()).isEqualTo(1);
    }
}
