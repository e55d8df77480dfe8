package com.ryuqq.controlplane.adapter.runner;

/**
 * BuildQueueWorker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollingIntervalMs: 큐 폴링 간격 (기본 200ms)</li>
 *   <li>batchSize: 한 번에 꺼낼 빌드 수 (기본 10)</li>
 *   <li>concurrency: 빌드 처리 스레드 수 (기본 2)</li>
 * </ul>
 *
 * <p>상태 변경은 StateStore에서 직렬화되므로 concurrency를 높여도
 * 겹쳐 실행되는 것은 빌더 호출 구간뿐입니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 * @param pollingIntervalMs 큐 폴링 간격 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param concurrency 처리 스레드 수 (1 이상이어야 함)
 */
public record BuildWorkerConfig(
    long pollingIntervalMs,
    int batchSize,
    int concurrency
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollingIntervalMs=200ms, batchSize=10, concurrency=2</p>
     */
    public BuildWorkerConfig() {
        this(200, 10, 2);
    }

    public BuildWorkerConfig {
        if (pollingIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollingIntervalMs must be positive (current: " + pollingIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
    }

    public BuildWorkerConfig withPollingIntervalMs(long pollingIntervalMs) {
        return new BuildWorkerConfig(pollingIntervalMs, batchSize, concurrency);
    }

    public BuildWorkerConfig withBatchSize(int batchSize) {
        return new BuildWorkerConfig(pollingIntervalMs, batchSize, concurrency);
    }

    public BuildWorkerConfig withConcurrency(int concurrency) {
        return new BuildWorkerConfig(pollingIntervalMs, batchSize, concurrency);
    }
}
