package com.ryuqq.controlplane.core.model;

import java.time.Instant;

/**
 * 템플릿 버전.
 *
 * <p>생성 시 QUEUED 빌드가 함께 만들어지며, 빌드 성공 시 READY가 됩니다.
 * 번들 본문은 ObjectStore에 저장되고 여기에는 크기와 콘텐츠 타입만 남습니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class TemplateVersion {

    private String id;
    private String templateId;
    private String version;
    private VersionStatus status;
    private String notes;
    private Manifest manifest;
    private String bundleContentType;
    private Long bundleBytes;
    private Instant bundleUploadedAt;
    private Instant createdAt;
    private Instant builtAt;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTemplateId() {
        return templateId;
    }

    public void setTemplateId(String templateId) {
        this.templateId = templateId;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public VersionStatus getStatus() {
        return status;
    }

    public void setStatus(VersionStatus status) {
        this.status = status;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public Manifest getManifest() {
        return manifest;
    }

    public void setManifest(Manifest manifest) {
        this.manifest = manifest;
    }

    public String getBundleContentType() {
        return bundleContentType;
    }

    public void setBundleContentType(String bundleContentType) {
        this.bundleContentType = bundleContentType;
    }

    public Long getBundleBytes() {
        return bundleBytes;
    }

    public void setBundleBytes(Long bundleBytes) {
        this.bundleBytes = bundleBytes;
    }

    public Instant getBundleUploadedAt() {
        return bundleUploadedAt;
    }

    public void setBundleUploadedAt(Instant bundleUploadedAt) {
        this.bundleUploadedAt = bundleUploadedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getBuiltAt() {
        return builtAt;
    }

    public void setBuiltAt(Instant builtAt) {
        this.builtAt = builtAt;
    }
}
