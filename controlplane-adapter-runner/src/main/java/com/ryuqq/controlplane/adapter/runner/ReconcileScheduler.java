package com.ryuqq.controlplane.adapter.runner;

import com.ryuqq.controlplane.adapter.inmemory.dispatch.InMemoryJobDispatcher;
import com.ryuqq.controlplane.application.reconcile.ReconcileReport;
import com.ryuqq.controlplane.application.reconcile.ReconcileService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Reconcile sweep 스케줄러.
 *
 * <p>두 가지 경로로 {@link ReconcileService#reconcile()}을 실행합니다.</p>
 * <ul>
 *   <li>sweepIntervalMs마다 주기 실행</li>
 *   <li>API로 enqueue된 요청이 있으면 requestPollIntervalMs 안에 실행 (여러 요청은 한 번으로 합쳐짐)</li>
 * </ul>
 *
 * <p>sweep이 실패해도 스케줄은 유지되며, 다음 주기에 다시 시도합니다.
 * 두 경로는 같은 단일 스레드에서 실행되므로 sweep이 겹치지 않습니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class ReconcileScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReconcileScheduler.class);

    private final ReconcileService reconcileService;
    private final InMemoryJobDispatcher dispatcher;
    private final ReconcileSchedulerConfig config;
    private final ScheduledExecutorService scheduler;

    public ReconcileScheduler(ReconcileService reconcileService, InMemoryJobDispatcher dispatcher,
                              ReconcileSchedulerConfig config) {
        if (reconcileService == null) {
            throw new IllegalArgumentException("reconcileService cannot be null");
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.reconcileService = reconcileService;
        this.dispatcher = dispatcher;
        this.config = config;
        this.scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    /**
     * sweep 1회 실행.
     *
     * @return 리포트 (실패 시 empty)
     */
    public Optional<ReconcileReport> sweep() {
        log.info("Reconcile sweep started");
        try {
            ReconcileReport report = reconcileService.reconcile();
            log.info("Reconcile sweep completed: {} changes {}", report.total(), report);
            return Optional.of(report);
        } catch (RuntimeException e) {
            log.error("Reconcile sweep failed", e);
            return Optional.empty();
        }
    }

    /**
     * 대기 중인 reconcile 요청이 있으면 sweep을 실행합니다.
     *
     * @return sweep 실행 여부
     */
    public boolean pollRequests() {
        if (!dispatcher.takeReconcileRequest()) {
            return false;
        }
        sweep();
        return true;
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(
            this::sweep, config.sweepIntervalMs(), config.sweepIntervalMs(), TimeUnit.MILLISECONDS);
        scheduler.scheduleWithFixedDelay(
            this::pollRequests, config.requestPollIntervalMs(), config.requestPollIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("Reconcile scheduler started: sweepIntervalMs={}, requestPollIntervalMs={}",
            config.sweepIntervalMs(), config.requestPollIntervalMs());
    }

    /**
     * 스케줄러 종료 (진행 중인 sweep은 최대 30초 대기).
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        scheduler.shutdown();
        if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
            scheduler.shutdownNow();
        }
        log.info("Reconcile scheduler stopped");
    }
}
