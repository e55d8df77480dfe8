package com.ryuqq.controlplane.core.outcome;

/**
 * 빌드 실패.
 *
 * @param error 실패 사유 (TemplateBuild.lastError에 기록)
 * @param log 빌드 로그
 * @author Control Plane Team
 * @since 1.0.0
 */
public record BuildFailed(
    String error,
    String log
) implements BuildOutcome {

    public BuildFailed {
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("error cannot be null or blank");
        }
        if (log == null) {
            log = "";
        }
    }
}
