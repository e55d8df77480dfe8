package com.ryuqq.controlplane.core.spi;

import java.util.List;

/**
 * 패스키(WebAuthn) 암호학적 검증 SPI.
 *
 * <p>컨트롤 플레인은 검증 결과만 소비하며 attestation/assertion 형식을 해석하지 않습니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public interface CredentialVerifier {

    /**
     * 등록 응답 검증.
     *
     * @param userId 등록하는 사용자 ID
     * @param attestation 클라이언트가 보낸 불투명 응답
     * @return 검증 결과
     */
    CredentialVerification verifyRegistration(String userId, String attestation);

    /**
     * 로그인 응답 검증.
     *
     * @param credentialIds 사용자에 등록된 자격 증명 ID 목록
     * @param assertion 클라이언트가 보낸 불투명 응답
     * @return 검증 결과 (credentialId는 목록 중 하나여야 함)
     */
    CredentialVerification verifyAssertion(List<String> credentialIds, String assertion);
}
