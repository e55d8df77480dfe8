package com.ryuqq.controlplane.core.error;

/**
 * 컨트롤 플레인 도메인 예외.
 *
 * <p>트랜잭션 본문에서 발생하면 draft는 폐기되고 예외는 호출자에게
 * 그대로 전달됩니다. {@link ErrorKind}로 실패 분류를 구분합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * throw ControlPlaneException.notFound("Session not found");
 * </pre>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class ControlPlaneException extends RuntimeException {

    private final ErrorKind kind;

    public ControlPlaneException(ErrorKind kind, String message) {
        super(message);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public int status() {
        return kind.status();
    }

    public static ControlPlaneException badRequest(String message) {
        return new ControlPlaneException(ErrorKind.BAD_REQUEST, message);
    }

    public static ControlPlaneException unauthorized(String message) {
        return new ControlPlaneException(ErrorKind.UNAUTHORIZED, message);
    }

    public static ControlPlaneException forbidden(String message) {
        return new ControlPlaneException(ErrorKind.FORBIDDEN, message);
    }

    public static ControlPlaneException notFound(String message) {
        return new ControlPlaneException(ErrorKind.NOT_FOUND, message);
    }

    public static ControlPlaneException conflict(String message) {
        return new ControlPlaneException(ErrorKind.CONFLICT, message);
    }

    public static ControlPlaneException payloadTooLarge(String message) {
        return new ControlPlaneException(ErrorKind.PAYLOAD_TOO_LARGE, message);
    }
}
