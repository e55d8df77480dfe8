package com.ryuqq.controlplane.core.spi;

/**
 * 패스키 검증 결과.
 *
 * @param verified 검증 성공 여부
 * @param credentialId 검증된 자격 증명 ID (실패 시 null)
 * @author Control Plane Team
 * @since 1.0.0
 */
public record CredentialVerification(boolean verified, String credentialId) {

    public static CredentialVerification success(String credentialId) {
        if (credentialId == null || credentialId.isBlank()) {
            throw new IllegalArgumentException("credentialId cannot be null or blank");
        }
        return new CredentialVerification(true, credentialId);
    }

    public static CredentialVerification failure() {
        return new CredentialVerification(false, null);
    }
}
