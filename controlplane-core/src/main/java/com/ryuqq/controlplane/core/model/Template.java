package com.ryuqq.controlplane.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * 환경 템플릿.
 *
 * <p>이름은 워크스페이스 내에서 대소문자 구분 없이 유일합니다.
 * 보관(archive)된 템플릿은 새 세션 생성만 차단합니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class Template {

    private String id;
    private String workspaceId;
    private String name;
    private String description;
    private String activeVersionId;
    private String createdByUserId;
    private Instant createdAt;
    private Instant archivedAt;

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

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getActiveVersionId() {
        return activeVersionId;
    }

    public void setActiveVersionId(String activeVersionId) {
        this.activeVersionId = activeVersionId;
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

    public Instant getArchivedAt() {
        return archivedAt;
    }

    public void setArchivedAt(Instant archivedAt) {
        this.archivedAt = archivedAt;
    }

    @JsonIgnore
    public boolean isArchived() {
        return archivedAt != null;
    }
}
