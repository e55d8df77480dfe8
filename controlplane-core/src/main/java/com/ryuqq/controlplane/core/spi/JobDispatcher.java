package com.ryuqq.controlplane.core.spi;

/**
 * 비동기 작업 알림 SPI.
 *
 * <p>트랜잭션 커밋 이후에만 호출됩니다. 알림이 유실되더라도 리컨실 스윕이
 * 대기 중인 빌드를 처리하므로 at-most-once 전달로 충분합니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public interface JobDispatcher {

    /**
     * 빌드 처리 요청.
     *
     * @param buildId 빌드 ID
     */
    void enqueueBuild(String buildId);

    /**
     * 리컨실 스윕 요청.
     */
    void enqueueReconcile();
}
