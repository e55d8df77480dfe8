package com.ryuqq.controlplane.core.model;

import java.time.Instant;

/**
 * 일회용 복구 코드 (해시만 저장).
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class RecoveryCode {

    private String hash;
    private Instant createdAt;

    public String getHash() {
        return hash;
    }

    public void setHash(String hash) {
        this.hash = hash;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public static RecoveryCode of(String hash, Instant createdAt) {
        RecoveryCode code = new RecoveryCode();
        code.setHash(hash);
        code.setCreatedAt(createdAt);
        return code;
    }
}
