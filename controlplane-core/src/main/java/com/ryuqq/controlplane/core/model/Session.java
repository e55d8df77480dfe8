package com.ryuqq.controlplane.core.model;

import com.ryuqq.controlplane.core.statemachine.SessionState;

import java.time.Instant;

/**
 * 개발 세션.
 *
 * <p>이름은 삭제되지 않은 세션 사이에서 유일합니다. DELETED 세션은 즉시 목록에서
 * 숨겨지고 리컨실 스윕에서 물리적으로 제거됩니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class Session {

    private String id;
    private String workspaceId;
    private String templateId;
    private String name;
    private SessionState state;
    private String createdByUserId;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastStartedAt;
    private Instant lastStoppedAt;
    private String lastRestoredSnapshotId;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public void setWorkspaceId(String workspaceId) {
        this.workspaceId = workspaceId;
    }

    public String getTemplateId() {
        return templateId;
    }

    public void setTemplateId(String templateId) {
        this.templateId = templateId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public SessionState getState() {
        return state;
    }

    public void setState(SessionState state) {
        this.state = state;
    }

    public String getCreatedByUserId() {
        return createdByUserId;
    }

    public void setCreatedByUserId(String createdByUserId) {
        this.createdByUserId = createdByUserId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getLastStartedAt() {
        return lastStartedAt;
    }

    public void setLastStartedAt(Instant lastStartedAt) {
        this.lastStartedAt = lastStartedAt;
    }

    public Instant getLastStoppedAt() {
        return lastStoppedAt;
    }

    public void setLastStoppedAt(Instant lastStoppedAt) {
        this.lastStoppedAt = lastStoppedAt;
    }

    public String getLastRestoredSnapshotId() {
        return lastRestoredSnapshotId;
    }

    public void setLastRestoredSnapshotId(String lastRestoredSnapshotId) {
        this.lastRestoredSnapshotId = lastRestoredSnapshotId;
    }
}
