package com.ryuqq.controlplane.core.model;

import java.time.Instant;

/**
 * 일회용 업로드 그랜트.
 *
 * <p>한 번 소비되면 {@code usedAt}이 기록되어 재사용할 수 없습니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class UploadGrant {

    private String id;
    private String workspaceId;
    private UploadTarget target;
    private String targetId;
    private String contentType;
    private long bytes;
    private String createdByUserId;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant usedAt;

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

    public UploadTarget getTarget() {
        return target;
    }

    public void setTarget(UploadTarget target) {
        this.target = target;
    }

    public String getTargetId() {
        return targetId;
    }

    public void setTargetId(String targetId) {
        this.targetId = targetId;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    public long getBytes() {
        return bytes;
    }

    public void setBytes(long bytes) {
        this.bytes = bytes;
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

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public Instant getUsedAt() {
        return usedAt;
    }

    public void setUsedAt(Instant usedAt) {
        this.usedAt = usedAt;
    }
}
