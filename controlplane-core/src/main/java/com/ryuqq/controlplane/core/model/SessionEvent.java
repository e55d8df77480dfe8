package com.ryuqq.controlplane.core.model;

import com.ryuqq.controlplane.core.statemachine.SessionState;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 세션 상태 전이 이벤트 (추가 전용).
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class SessionEvent {

    private String id;
    private String sessionId;
    private SessionState state;
    private Map<String, String> details = new LinkedHashMap<>();
    private Instant createdAt;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public SessionState getState() {
        return state;
    }

    public void setState(SessionState state) {
        this.state = state;
    }

    public Map<String, String> getDetails() {
        return details;
    }

    public void setDetails(Map<String, String> details) {
        this.details = details == null ? new LinkedHashMap<>() : new LinkedHashMap<>(details);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
