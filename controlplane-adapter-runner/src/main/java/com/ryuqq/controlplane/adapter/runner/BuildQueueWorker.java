package com.ryuqq.controlplane.adapter.runner;

import com.ryuqq.controlplane.adapter.inmemory.dispatch.InMemoryJobDispatcher;
import com.ryuqq.controlplane.application.template.TemplateService;
import com.ryuqq.controlplane.core.model.TemplateBuild;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 빌드 큐 워커.
 *
 * <p>디스패처에 쌓인 빌드 ID를 꺼내 {@link TemplateService#processTemplateBuildById(String)}로
 * 처리합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * drainBuilds(batchSize) → [bld_1, bld_2, ...]
 *   ↓
 * For each buildId (worker pool):
 *   processTemplateBuildById(buildId)
 *     - 처리 가능 상태가 아니면 건너뜀 (중복 디스패치 허용)
 *     - 예외는 로그만 남김 (reconcile sweep이 이후에 복구)
 * </pre>
 *
 * <p>{@link #start()}는 pollingIntervalMs 간격으로 pump()를 반복 호출합니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class BuildQueueWorker {

    private static final Logger log = LoggerFactory.getLogger(BuildQueueWorker.class);

    private final InMemoryJobDispatcher dispatcher;
    private final TemplateService templateService;
    private final BuildWorkerConfig config;
    private final ExecutorService workerExecutor;
    private final ScheduledExecutorService pollingExecutor;
    private final AtomicInteger processed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();

    /**
     * 생성자.
     *
     * @param dispatcher 빌드 ID 큐
     * @param templateService 빌드 처리 서비스
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BuildQueueWorker(InMemoryJobDispatcher dispatcher, TemplateService templateService, BuildWorkerConfig config) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (templateService == null) {
            throw new IllegalArgumentException("templateService cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.dispatcher = dispatcher;
        this.templateService = templateService;
        this.config = config;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency());
        this.pollingExecutor = Executors.newSingleThreadScheduledExecutor();
    }

    /**
     * 큐에서 한 배치를 꺼내 워커 풀에 제출합니다.
     *
     * @return 제출한 빌드 수
     */
    public int pump() {
        List<String> buildIds = dispatcher.drainBuilds(config.batchSize());
        for (String buildId : buildIds) {
            workerExecutor.submit(() -> processBuild(buildId));
        }
        return buildIds.size();
    }

    /**
     * pollingIntervalMs 간격의 주기적 pump 시작.
     */
    public void start() {
        pollingExecutor.scheduleWithFixedDelay(
            this::pumpSafely, 0, config.pollingIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("Build queue worker started: pollingIntervalMs={}, batchSize={}, concurrency={}",
            config.pollingIntervalMs(), config.batchSize(), config.concurrency());
    }

    /**
     * 워커 종료.
     *
     * <p>폴링을 멈추고 진행 중인 빌드가 끝날 때까지 최대 60초 대기합니다.</p>
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        pollingExecutor.shutdown();
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            workerExecutor.shutdownNow();
        }
        log.info("Build queue worker stopped: processed={}, failed={}", processed.get(), failed.get());
    }

    public int processedCount() {
        return processed.get();
    }

    public int failedCount() {
        return failed.get();
    }

    private void pumpSafely() {
        try {
            pump();
        } catch (RuntimeException e) {
            log.error("Build queue pump failed", e);
        }
    }

    private void processBuild(String buildId) {
        try {
            Optional<TemplateBuild> result = templateService.processTemplateBuildById(buildId);
            if (result.isPresent()) {
                processed.incrementAndGet();
                log.debug("Processed build {}: status={}", buildId, result.get().getStatus().wireName());
            } else {
                log.debug("Skipped build {}: not processable", buildId);
            }
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            log.error("Failed to process build {}", buildId, e);
        }
    }
}
