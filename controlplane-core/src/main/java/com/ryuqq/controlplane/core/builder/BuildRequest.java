package com.ryuqq.controlplane.core.builder;

import com.ryuqq.controlplane.core.model.Manifest;

/**
 * 빌더에 전달되는 빌드 입력.
 *
 * @param buildId 빌드 ID
 * @param templateId 템플릿 ID
 * @param templateVersionId 템플릿 버전 ID
 * @param version 버전 문자열
 * @param manifest 매니페스트
 * @param attempt 이번 시도 번호 (1부터)
 * @param bundleBytes 업로드된 번들 크기 (없으면 null)
 * @author Control Plane Team
 * @since 1.0.0
 */
public record BuildRequest(
    String buildId,
    String templateId,
    String templateVersionId,
    String version,
    Manifest manifest,
    int attempt,
    Long bundleBytes
) {

    public BuildRequest {
        if (buildId == null || buildId.isBlank()) {
            throw new IllegalArgumentException("buildId cannot be null or blank");
        }
        if (manifest == null) {
            throw new IllegalArgumentException("manifest cannot be null");
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
    }
}
