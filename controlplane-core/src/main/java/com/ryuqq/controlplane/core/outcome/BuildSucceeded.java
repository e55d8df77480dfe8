package com.ryuqq.controlplane.core.outcome;

/**
 * 빌드 성공.
 *
 * @param imageReference 생성된 이미지 참조
 * @param imageDigest 이미지 다이제스트
 * @param log 빌드 로그
 * @author Control Plane Team
 * @since 1.0.0
 */
public record BuildSucceeded(
    String imageReference,
    String imageDigest,
    String log
) implements BuildOutcome {

    public BuildSucceeded {
        if (imageReference == null || imageReference.isBlank()) {
            throw new IllegalArgumentException("imageReference cannot be null or blank");
        }
        if (log == null) {
            log = "";
        }
    }
}
