package com.ryuqq.controlplane.core.error;

/**
 * 도메인 오류 분류.
 *
 * <p>각 분류는 HTTP 계층에서 사용할 상태 코드 힌트를 가집니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /** 400: 입력 검증 실패, 만료된 코드/초대/그랜트. */
    BAD_REQUEST(400),

    /** 401: 토큰 없음, 만료, 폐기, 또는 자격 증명 불일치. */
    UNAUTHORIZED(401),

    /** 403: 멤버십 또는 역할 권한 부족. */
    FORBIDDEN(403),

    /** 404: 엔티티 없음. */
    NOT_FOUND(404),

    /** 409: 현재 상태에서 허용되지 않는 요청 (중복, 쿼터, 상태 전이). */
    CONFLICT(409),

    /** 413: 업로드 크기 상한 초과. */
    PAYLOAD_TOO_LARGE(413);

    private final int status;

    ErrorKind(int status) {
        this.status = status;
    }

    public int status() {
        return status;
    }
}
