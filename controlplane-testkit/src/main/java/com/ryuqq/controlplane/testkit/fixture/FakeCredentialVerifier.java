package com.ryuqq.controlplane.testkit.fixture;

import com.ryuqq.controlplane.core.spi.CredentialVerification;
import com.ryuqq.controlplane.core.spi.CredentialVerifier;

import java.util.List;

/**
 * Deterministic {@link CredentialVerifier} for tests.
 *
 * <p><strong>Accepted inputs:</strong></p>
 * <ul>
 *   <li>registration attestation {@code "attest:<credentialId>"}</li>
 *   <li>login assertion {@code "assert:<credentialId>"} where the id is registered for the user</li>
 * </ul>
 *
 * <p>Anything else fails verification.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class FakeCredentialVerifier implements CredentialVerifier {

    public static final String ATTESTATION_PREFIX = "attest:";
    public static final String ASSERTION_PREFIX = "assert:";

    public static String attestationFor(String credentialId) {
        return ATTESTATION_PREFIX + credentialId;
    }

    public static String assertionFor(String credentialId) {
        return ASSERTION_PREFIX + credentialId;
    }

    @Override
    public CredentialVerification verifyRegistration(String userId, String attestation) {
        if (attestation == null || !attestation.startsWith(ATTESTATION_PREFIX)
            || attestation.length() == ATTESTATION_PREFIX.length()) {
            return CredentialVerification.failure();
        }
        return CredentialVerification.success(attestation.substring(ATTESTATION_PREFIX.length()));
    }

    @Override
    public CredentialVerification verifyAssertion(List<String> credentialIds, String assertion) {
        if (assertion == null || !assertion.startsWith(ASSERTION_PREFIX)) {
            return CredentialVerification.failure();
        }
        String credentialId = assertion.substring(ASSERTION_PREFIX.length());
        return credentialIds.contains(credentialId)
            ? CredentialVerification.success(credentialId)
            : CredentialVerification.failure();
    }
}
