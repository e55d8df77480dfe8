package com.ryuqq.controlplane.application.support;

import com.ryuqq.controlplane.core.spi.JobDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 커밋 이후 {@link JobDispatcher} 알림.
 *
 * <p>알림 실패는 경고 로그만 남깁니다. 상태는 이미 커밋되었고, 처리되지 않은 빌드는
 * 다음 reconcile 주기에 drain 됩니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class DispatchSupport {

    private static final Logger log = LoggerFactory.getLogger(DispatchSupport.class);

    private DispatchSupport() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void enqueueBuilds(JobDispatcher dispatcher, List<String> buildIds) {
        for (String buildId : buildIds) {
            try {
                dispatcher.enqueueBuild(buildId);
            } catch (RuntimeException e) {
                log.warn("Failed to dispatch build {}, leaving it for reconcile: {}", buildId, e.getMessage());
            }
        }
    }

    public static void enqueueBuild(JobDispatcher dispatcher, String buildId) {
        enqueueBuilds(dispatcher, List.of(buildId));
    }

    public static boolean enqueueReconcile(JobDispatcher dispatcher) {
        try {
            dispatcher.enqueueReconcile();
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to dispatch reconcile: {}", e.getMessage());
            return false;
        }
    }
}
