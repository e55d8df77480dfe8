package com.ryuqq.controlplane.core.model;

import java.time.Instant;

/**
 * 템플릿 버전 승격 기록 (추가 전용).
 *
 * <p>승격 시점의 이미지 참조와 다이제스트를 고정해 두므로 이후 버전이 삭제되어도
 * 어떤 이미지가 배포되었는지 추적할 수 있습니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class BindingRelease {

    private String id;
    private String workspaceId;
    private String templateId;
    private String templateVersionId;
    private String version;
    private String imageReference;
    private String imageDigest;
    private String artifactSource;
    private Instant createdAt;

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

    public String getTemplateVersionId() {
        return templateVersionId;
    }

    public void setTemplateVersionId(String templateVersionId) {
        this.templateVersionId = templateVersionId;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getImageReference() {
        return imageReference;
    }

    public void setImageReference(String imageReference) {
        this.imageReference = imageReference;
    }

    public String getImageDigest() {
        return imageDigest;
    }

    public void setImageDigest(String imageDigest) {
        this.imageDigest = imageDigest;
    }

    public String getArtifactSource() {
        return artifactSource;
    }

    public void setArtifactSource(String artifactSource) {
        this.artifactSource = artifactSource;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
