package com.ryuqq.controlplane.adapter.runner;

/**
 * ReconcileScheduler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>sweepIntervalMs: 주기적 전체 sweep 간격 (기본 60000ms = 1분)</li>
 *   <li>requestPollIntervalMs: 요청된 reconcile 확인 간격 (기본 1000ms)</li>
 * </ul>
 *
 * @author Control Plane Team
 * @since 1.0.0
 * @param sweepIntervalMs 전체 sweep 간격 (밀리초, 양수여야 함)
 * @param requestPollIntervalMs 요청 확인 간격 (밀리초, 양수여야 함)
 */
public record ReconcileSchedulerConfig(
    long sweepIntervalMs,
    long requestPollIntervalMs
) {

    public ReconcileSchedulerConfig() {
        this(60000, 1000);
    }

    public ReconcileSchedulerConfig {
        if (sweepIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "sweepIntervalMs must be positive (current: " + sweepIntervalMs + ")"
            );
        }
        if (requestPollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "requestPollIntervalMs must be positive (current: " + requestPollIntervalMs + ")"
            );
        }
    }

    public ReconcileSchedulerConfig withSweepIntervalMs(long sweepIntervalMs) {
        return new ReconcileSchedulerConfig(sweepIntervalMs, requestPollIntervalMs);
    }

    public ReconcileSchedulerConfig withRequestPollIntervalMs(long requestPollIntervalMs) {
        return new ReconcileSchedulerConfig(sweepIntervalMs, requestPollIntervalMs);
    }
}
