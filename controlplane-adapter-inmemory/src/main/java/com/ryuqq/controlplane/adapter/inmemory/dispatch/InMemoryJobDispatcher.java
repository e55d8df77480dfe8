package com.ryuqq.controlplane.adapter.inmemory.dispatch;

import com.ryuqq.controlplane.core.spi.JobDispatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link JobDispatcher}.
 *
 * <p>Build ids are queued FIFO until a worker drains them. Reconcile requests are counted
 * and coalesced: any number of requests between two drains becomes one sweep.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryJobDispatcher dispatcher = new InMemoryJobDispatcher();
 * // ... services enqueue after commit ...
 * for (String buildId : dispatcher.drainBuilds(10)) {
 *     templateService.processTemplateBuildById(buildId);
 * }
 * </pre>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class InMemoryJobDispatcher implements JobDispatcher {

    private final ConcurrentLinkedQueue<String> builds = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pendingReconciles = new AtomicInteger();
    private final AtomicInteger totalBuildsEnqueued = new AtomicInteger();

    @Override
    public void enqueueBuild(String buildId) {
        if (buildId == null || buildId.isBlank()) {
            throw new IllegalArgumentException("buildId cannot be null or blank");
        }
        builds.add(buildId);
        totalBuildsEnqueued.incrementAndGet();
    }

    @Override
    public void enqueueReconcile() {
        pendingReconciles.incrementAndGet();
    }

    /**
     * Removes up to {@code batchSize} build ids in enqueue order.
     *
     * @param batchSize maximum number of ids to return (positive)
     * @return drained ids, possibly empty
     */
    public List<String> drainBuilds(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }
        List<String> result = new ArrayList<>();
        for (int i = 0; i < batchSize; i++) {
            String buildId = builds.poll();
            if (buildId == null) {
                break;
            }
            result.add(buildId);
        }
        return result;
    }

    /**
     * Consumes pending reconcile requests.
     *
     * @return true if at least one request was pending
     */
    public boolean takeReconcileRequest() {
        return pendingReconciles.getAndSet(0) > 0;
    }

    public int pendingBuilds() {
        return builds.size();
    }

    public int totalBuildsEnqueued() {
        return totalBuildsEnqueued.get();
    }

    public void clear() {
        builds.clear();
        pendingReconciles.set(0);
        totalBuildsEnqueued.set(0);
    }
}
