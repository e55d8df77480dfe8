package com.ryuqq.controlplane.core.config;

import java.time.Duration;

/**
 * 컨트롤 플레인 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>tokenTtl: browser/api 토큰 유효 기간 (기본 7일)</li>
 *   <li>runtimeTokenTtl: runtime 토큰 유효 기간 (기본 15분)</li>
 *   <li>deviceCodeTtl: 디바이스 코드 유효 기간 (기본 10분)</li>
 *   <li>inviteTtl: 워크스페이스 초대 유효 기간 (기본 7일)</li>
 *   <li>uploadGrantTtl: 업로드 그랜트 유효 기간 (기본 15분)</li>
 *   <li>maxBundleBytes: 템플릿 번들 직접 업로드 상한 (기본 256 KiB)</li>
 *   <li>maxSnapshotBytes: 스냅샷 업로드 상한 (기본 1 MiB)</li>
 *   <li>stuckBuildThreshold: BUILDING 상태 stuck 판정 기준 (기본 5분)</li>
 *   <li>runningIdleThreshold: 리컨실 시 RUNNING 세션을 재우는 기준 (기본 30분)</li>
 *   <li>sleepingRetention: SLEEPING 세션 보존 기간 (기본 7일, 매니페스트 sleepTtlSeconds 우선)</li>
 *   <li>recoveryCodeCount: 한 번에 발급하는 복구 코드 수 (기본 8)</li>
 * </ul>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public record ControlPlaneConfig(
    Duration tokenTtl,
    Duration runtimeTokenTtl,
    Duration deviceCodeTtl,
    Duration inviteTtl,
    Duration uploadGrantTtl,
    long maxBundleBytes,
    long maxSnapshotBytes,
    Duration stuckBuildThreshold,
    Duration runningIdleThreshold,
    Duration sleepingRetention,
    int recoveryCodeCount
) {

    /**
     * 연속 실패가 이 횟수에 도달하면 빌드는 DEAD_LETTERED가 됩니다.
     */
    public static final int DEAD_LETTER_AFTER_FAILURES = 2;

    /**
     * 기본 설정 생성자.
     */
    public ControlPlaneConfig() {
        this(
            Duration.ofDays(7),
            Duration.ofMinutes(15),
            Duration.ofMinutes(10),
            Duration.ofDays(7),
            Duration.ofMinutes(15),
            256 * 1024,
            1024 * 1024,
            Duration.ofMinutes(5),
            Duration.ofMinutes(30),
            Duration.ofDays(7),
            8
        );
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ControlPlaneConfig {
        requirePositive("tokenTtl", tokenTtl);
        requirePositive("runtimeTokenTtl", runtimeTokenTtl);
        requirePositive("deviceCodeTtl", deviceCodeTtl);
        requirePositive("inviteTtl", inviteTtl);
        requirePositive("uploadGrantTtl", uploadGrantTtl);
        requirePositive("stuckBuildThreshold", stuckBuildThreshold);
        requirePositive("runningIdleThreshold", runningIdleThreshold);
        requirePositive("sleepingRetention", sleepingRetention);
        if (maxBundleBytes <= 0) {
            throw new IllegalArgumentException(
                "maxBundleBytes must be positive (current: " + maxBundleBytes + ")"
            );
        }
        if (maxSnapshotBytes <= 0) {
            throw new IllegalArgumentException(
                "maxSnapshotBytes must be positive (current: " + maxSnapshotBytes + ")"
            );
        }
        if (recoveryCodeCount <= 0) {
            throw new IllegalArgumentException(
                "recoveryCodeCount must be positive (current: " + recoveryCodeCount + ")"
            );
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }

    public ControlPlaneConfig withTokenTtl(Duration tokenTtl) {
        return new ControlPlaneConfig(tokenTtl, runtimeTokenTtl, deviceCodeTtl, inviteTtl, uploadGrantTtl,
            maxBundleBytes, maxSnapshotBytes, stuckBuildThreshold, runningIdleThreshold, sleepingRetention,
            recoveryCodeCount);
    }

    public ControlPlaneConfig withRuntimeTokenTtl(Duration runtimeTokenTtl) {
        return new ControlPlaneConfig(tokenTtl, runtimeTokenTtl, deviceCodeTtl, inviteTtl, uploadGrantTtl,
            maxBundleBytes, maxSnapshotBytes, stuckBuildThreshold, runningIdleThreshold, sleepingRetention,
            recoveryCodeCount);
    }

    public ControlPlaneConfig withDeviceCodeTtl(Duration deviceCodeTtl) {
        return new ControlPlaneConfig(tokenTtl, runtimeTokenTtl, deviceCodeTtl, inviteTtl, uploadGrantTtl,
            maxBundleBytes, maxSnapshotBytes, stuckBuildThreshold, runningIdleThreshold, sleepingRetention,
            recoveryCodeCount);
    }

    public ControlPlaneConfig withInviteTtl(Duration inviteTtl) {
        return new ControlPlaneConfig(tokenTtl, runtimeTokenTtl, deviceCodeTtl, inviteTtl, uploadGrantTtl,
            maxBundleBytes, maxSnapshotBytes, stuckBuildThreshold, runningIdleThreshold, sleepingRetention,
            recoveryCodeCount);
    }

    public ControlPlaneConfig withUploadGrantTtl(Duration uploadGrantTtl) {
        return new ControlPlaneConfig(tokenTtl, runtimeTokenTtl, deviceCodeTtl, inviteTtl, uploadGrantTtl,
            maxBundleBytes, maxSnapshotBytes, stuckBuildThreshold, runningIdleThreshold, sleepingRetention,
            recoveryCodeCount);
    }

    public ControlPlaneConfig withMaxBundleBytes(long maxBundleBytes) {
        return new ControlPlaneConfig(tokenTtl, runtimeTokenTtl, deviceCodeTtl, inviteTtl, uploadGrantTtl,
            maxBundleBytes, maxSnapshotBytes, stuckBuildThreshold, runningIdleThreshold, sleepingRetention,
            recoveryCodeCount);
    }

    public ControlPlaneConfig withMaxSnapshotBytes(long maxSnapshotBytes) {
        return new ControlPlaneConfig(tokenTtl, runtimeTokenTtl, deviceCodeTtl, inviteTtl, uploadGrantTtl,
            maxBundleBytes, maxSnapshotBytes, stuckBuildThreshold, runningIdleThreshold, sleepingRetention,
            recoveryCodeCount);
    }

    public ControlPlaneConfig withStuckBuildThreshold(Duration stuckBuildThreshold) {
        return new ControlPlaneConfig(tokenTtl, runtimeTokenTtl, deviceCodeTtl, inviteTtl, uploadGrantTtl,
            maxBundleBytes, maxSnapshotBytes, stuckBuildThreshold, runningIdleThreshold, sleepingRetention,
            recoveryCodeCount);
    }

    public ControlPlaneConfig withRunningIdleThreshold(Duration runningIdleThreshold) {
        return new ControlPlaneConfig(tokenTtl, runtimeTokenTtl, deviceCodeTtl, inviteTtl, uploadGrantTtl,
            maxBundleBytes, maxSnapshotBytes, stuckBuildThreshold, runningIdleThreshold, sleepingRetention,
            recoveryCodeCount);
    }

    public ControlPlaneConfig withSleepingRetention(Duration sleepingRetention) {
        return new ControlPlaneConfig(tokenTtl, runtimeTokenTtl, deviceCodeTtl, inviteTtl, uploadGrantTtl,
            maxBundleBytes, maxSnapshotBytes, stuckBuildThreshold, runningIdleThreshold, sleepingRetention,
            recoveryCodeCount);
    }

    public ControlPlaneConfig withRecoveryCodeCount(int recoveryCodeCount) {
        return new ControlPlaneConfig(tokenTtl, runtimeTokenTtl, deviceCodeTtl, inviteTtl, uploadGrantTtl,
            maxBundleBytes, maxSnapshotBytes, stuckBuildThreshold, runningIdleThreshold, sleepingRetention,
            recoveryCodeCount);
    }
}
