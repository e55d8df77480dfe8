package com.ryuqq.controlplane.core.model;

import java.time.Instant;

/**
 * 사용자에 등록된 패스키 자격 증명.
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class PasskeyCredential {

    private String credentialId;
    private String label;
    private Instant createdAt;
    private Instant lastUsedAt;

    public String getCredentialId() {
        return credentialId;
    }

    public void setCredentialId(String credentialId) {
        this.credentialId = credentialId;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getLastUsedAt() {
        return lastUsedAt;
    }

    public void setLastUsedAt(Instant lastUsedAt) {
        this.lastUsedAt = lastUsedAt;
    }
}
