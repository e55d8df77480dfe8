package com.ryuqq.controlplane.core.model;

import java.time.Instant;

/**
 * 디바이스 인증 코드 (CLI 로그인 흐름).
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class DeviceCode {

    private String id;
    private String code;
    private String userId;
    private String workspaceId;
    private DeviceCodeStatus status;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant approvedAt;
    private Instant exchangedAt;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public void setWorkspaceId(String workspaceId) {
        this.workspaceId = workspaceId;
    }

    public DeviceCodeStatus getStatus() {
        return status;
    }

    public void setStatus(DeviceCodeStatus status) {
        this.status = status;
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

    public Instant getApprovedAt() {
        return approvedAt;
    }

    public void setApprovedAt(Instant approvedAt) {
        this.approvedAt = approvedAt;
    }

    public Instant getExchangedAt() {
        return exchangedAt;
    }

    public void setExchangedAt(Instant exchangedAt) {
        this.exchangedAt = exchangedAt;
    }
}
