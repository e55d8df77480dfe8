package com.ryuqq.controlplane.core.spi;

/**
 * ObjectStore 키.
 *
 * @param kind 객체 종류
 * @param id 소유 엔티티 ID (버전, 스냅샷, 빌드)
 * @author Control Plane Team
 * @since 1.0.0
 */
public record ObjectTarget(ObjectKind kind, String id) {

    public ObjectTarget {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
    }

    public static ObjectTarget bundle(String templateVersionId) {
        return new ObjectTarget(ObjectKind.BUNDLE, templateVersionId);
    }

    public static ObjectTarget snapshot(String snapshotId) {
        return new ObjectTarget(ObjectKind.SNAPSHOT, snapshotId);
    }

    public static ObjectTarget buildLog(String buildId) {
        return new ObjectTarget(ObjectKind.BUILD_LOG, buildId);
    }

    public static ObjectTarget buildArtifact(String buildId) {
        return new ObjectTarget(ObjectKind.BUILD_ARTIFACT, buildId);
    }
}
