package com.ryuqq.controlplane.application.template;

import com.ryuqq.controlplane.core.error.ControlPlaneException;
import com.ryuqq.controlplane.core.model.Manifest;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 템플릿 버전 매니페스트 검증.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>image 필수</li>
 *   <li>features는 {@link #SUPPORTED_FEATURES}의 부분집합</li>
 *   <li>persistedPaths는 절대 경로</li>
 *   <li>sleepTtlSeconds는 설정 시 양수</li>
 * </ul>
 *
 * <p>위반 시 BAD_REQUEST를 던집니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class ManifestValidator {

    public static final Set<String> SUPPORTED_FEATURES = Set.of("ssh", "browser", "snapshots", "preview");

    private ManifestValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 검증 후 정규화된 사본을 반환합니다 (공백 제거, 중복 feature 제거).
     */
    public static Manifest validate(Manifest manifest) {
        if (manifest == null) {
            throw ControlPlaneException.badRequest("Manifest is required");
        }
        if (manifest.getImage() == null || manifest.getImage().isBlank()) {
            throw ControlPlaneException.badRequest("Manifest image is required");
        }

        Set<String> features = new LinkedHashSet<>();
        for (String feature : manifest.getFeatures()) {
            String normalized = feature == null ? "" : feature.trim();
            if (!SUPPORTED_FEATURES.contains(normalized)) {
                throw ControlPlaneException.badRequest("Unsupported manifest feature: " + feature);
            }
            features.add(normalized);
        }

        List<String> paths = new ArrayList<>();
        for (String path : manifest.getPersistedPaths()) {
            if (path == null || !path.startsWith("/")) {
                throw ControlPlaneException.badRequest("Persisted paths must be absolute: " + path);
            }
            paths.add(path);
        }

        if (manifest.getSleepTtlSeconds() != null && manifest.getSleepTtlSeconds() <= 0) {
            throw ControlPlaneException.badRequest("sleepTtlSeconds must be positive");
        }

        Manifest normalized = new Manifest();
        normalized.setImage(manifest.getImage().trim());
        normalized.setFeatures(new ArrayList<>(features));
        normalized.setPersistedPaths(paths);
        normalized.setSleepTtlSeconds(manifest.getSleepTtlSeconds());
        normalized.setSimulateFailure(manifest.isSimulateFailure());
        return normalized;
    }
}
