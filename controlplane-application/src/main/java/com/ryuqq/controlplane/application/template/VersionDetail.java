package com.ryuqq.controlplane.application.template;

import com.ryuqq.controlplane.core.model.TemplateBuild;
import com.ryuqq.controlplane.core.model.TemplateVersion;

/**
 * 버전과 1:1 빌드.
 *
 * @param version 템플릿 버전
 * @param build 해당 버전의 빌드 (고아 버전이면 null)
 */
public record VersionDetail(TemplateVersion version, TemplateBuild build) {
}
