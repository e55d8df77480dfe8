package com.ryuqq.controlplane.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 사용자 계정.
 *
 * <p>email은 대소문자 구분 없이 유일합니다. 복구 코드는 SHA-256 해시로만 저장되며,
 * 패스키는 외부 검증기가 확인한 credentialId만 보관합니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class User {

    private String id;
    private String email;
    private String name;
    private Instant createdAt;
    private List<RecoveryCode> recoveryCodes = new ArrayList<>();
    private List<PasskeyCredential> passkeys = new ArrayList<>();

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public List<RecoveryCode> getRecoveryCodes() {
        return recoveryCodes;
    }

    public void setRecoveryCodes(List<RecoveryCode> recoveryCodes) {
        this.recoveryCodes = recoveryCodes == null ? new ArrayList<>() : new ArrayList<>(recoveryCodes);
    }

    public List<PasskeyCredential> getPasskeys() {
        return passkeys;
    }

    public void setPasskeys(List<PasskeyCredential> passkeys) {
        this.passkeys = passkeys == null ? new ArrayList<>() : new ArrayList<>(passkeys);
    }
}
