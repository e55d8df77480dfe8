package com.ryuqq.controlplane.core.model;

import java.time.Instant;

/**
 * 워크스페이스 런타임 시크릿.
 *
 * <p>이름은 워크스페이스 안에서 유일한 대문자 식별자입니다. 값은 실행 중 세션의
 * 런타임 토큰으로만 읽을 수 있고, 목록/내보내기에는 이름만 노출됩니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class WorkspaceSecret {

    private String id;
    private String workspaceId;
    private String name;
    private String value;
    private String updatedByUserId;
    private Instant createdAt;
    private Instant updatedAt;

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

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public String getUpdatedByUserId() {
        return updatedByUserId;
    }

    public void setUpdatedByUserId(String updatedByUserId) {
        this.updatedByUserId = updatedByUserId;
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
}
