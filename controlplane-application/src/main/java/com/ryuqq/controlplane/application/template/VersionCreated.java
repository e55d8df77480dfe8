package com.ryuqq.controlplane.application.template;

import com.ryuqq.controlplane.core.model.TemplateBuild;
import com.ryuqq.controlplane.core.model.TemplateVersion;

/**
 * 버전 추가 결과. 빌드는 항상 QUEUED 상태로 생성됩니다.
 */
public record VersionCreated(TemplateVersion version, TemplateBuild build) {
}
