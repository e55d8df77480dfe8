package com.ryuqq.controlplane.application.template;

import com.ryuqq.controlplane.core.model.BindingRelease;
import com.ryuqq.controlplane.core.model.Template;
import com.ryuqq.controlplane.core.model.TemplateVersion;

/**
 * 승격 또는 롤백 결과.
 *
 * @param template activeVersionId가 갱신된 템플릿
 * @param activeVersion 새 활성 버전
 * @param release 새로 추가된 릴리스 기록
 */
public record PromotionResult(Template template, TemplateVersion activeVersion, BindingRelease release) {
}
