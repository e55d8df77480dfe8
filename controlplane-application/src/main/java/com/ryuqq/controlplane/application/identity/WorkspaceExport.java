package com.ryuqq.controlplane.application.identity;

import com.ryuqq.controlplane.application.ledger.UsageSummary;
import com.ryuqq.controlplane.core.model.AuditLog;
import com.ryuqq.controlplane.core.model.BindingRelease;
import com.ryuqq.controlplane.core.model.Membership;
import com.ryuqq.controlplane.core.model.Session;
import com.ryuqq.controlplane.core.model.Snapshot;
import com.ryuqq.controlplane.core.model.Template;
import com.ryuqq.controlplane.core.model.TemplateBuild;
import com.ryuqq.controlplane.core.model.TemplateVersion;
import com.ryuqq.controlplane.core.model.Workspace;

import java.time.Instant;
import java.util.List;

/**
 * 워크스페이스 내보내기 결과.
 *
 * <p>토큰, 초대 코드, 업로드 그랜트, 시크릿 값은 포함하지 않습니다.
 * 삭제된 세션도 purge 전까지는 포함됩니다.</p>
 *
 * @param exportedAt 내보낸 시각
 * @param runtimeSecrets 시크릿 이름과 시각만
 * @param auditLogs 내보내기 직전까지의 감사 로그 (오래된 순)
 * @author Control Plane Team
 * @since 1.0.0
 */
public record WorkspaceExport(
    Instant exportedAt,
    Workspace workspace,
    List<Membership> members,
    List<Template> templates,
    List<TemplateVersion> templateVersions,
    List<TemplateBuild> templateBuilds,
    List<BindingRelease> releases,
    List<Session> sessions,
    List<Snapshot> snapshots,
    List<WorkspaceSecretView> runtimeSecrets,
    UsageSummary usage,
    List<AuditLog> auditLogs
) {
}
