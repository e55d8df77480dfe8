package com.ryuqq.controlplane.core.model;

import java.time.Instant;

/**
 * 워크스페이스 멤버십.
 *
 * <p>행 키는 {@code workspaceId:userId}입니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class Membership {

    private String workspaceId;
    private String userId;
    private MemberRole role;
    private Instant createdAt;

    public String getWorkspaceId() {
        return workspaceId;
    }

    public void setWorkspaceId(String workspaceId) {
        this.workspaceId = workspaceId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public MemberRole getRole() {
        return role;
    }

    public void setRole(MemberRole role) {
        this.role = role;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public String key() {
        return keyOf(workspaceId, userId);
    }

    public static String keyOf(String workspaceId, String userId) {
        return workspaceId + ":" + userId;
    }
}
