package com.ryuqq.controlplane.application.template;

import com.ryuqq.controlplane.core.model.BindingRelease;
import com.ryuqq.controlplane.core.model.Template;

import java.util.List;

/**
 * 템플릿 상세 (버전은 생성 순서, 릴리스는 승격 순서).
 */
public record TemplateDetail(Template template, List<VersionDetail> versions, List<BindingRelease> releases) {

    public TemplateDetail {
        versions = List.copyOf(versions);
        releases = List.copyOf(releases);
    }
}
