package com.ryuqq.controlplane.application.session;

import com.ryuqq.controlplane.core.model.Session;
import com.ryuqq.controlplane.core.model.SessionEvent;
import com.ryuqq.controlplane.core.model.Snapshot;

import java.util.List;

/**
 * 세션 상세 (스냅샷, 이벤트는 생성 순서).
 */
public record SessionDetail(Session session, List<Snapshot> snapshots, List<SessionEvent> events) {

    public SessionDetail {
        snapshots = List.copyOf(snapshots);
        events = List.copyOf(events);
    }
}
