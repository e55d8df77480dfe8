package com.ryuqq.controlplane.core.statemachine;

/**
 * 빌드 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>QUEUED → BUILDING</li>
 *   <li>RETRYING → BUILDING</li>
 *   <li>BUILDING → SUCCEEDED | FAILED | DEAD_LETTERED | RETRYING</li>
 *   <li>FAILED → RETRYING</li>
 *   <li>DEAD_LETTERED → RETRYING</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> SUCCEEDED에서는 어떤 상태로도 전이 불가.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class BuildTransitions {

    private BuildTransitions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(BuildStatus from, BuildStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid build transition: %s → %s", from, to)
            );
        }
    }

    public static boolean isAllowed(BuildStatus from, BuildStatus to) {
        return switch (from) {
            case QUEUED, RETRYING -> to == BuildStatus.BUILDING;
            case BUILDING -> to == BuildStatus.SUCCEEDED
                || to == BuildStatus.FAILED
                || to == BuildStatus.DEAD_LETTERED
                || to == BuildStatus.RETRYING;
            case FAILED, DEAD_LETTERED -> to == BuildStatus.RETRYING;
            case SUCCEEDED -> false;
        };
    }

    /**
     * 검증 후 다음 상태를 반환합니다.
     */
    public static BuildStatus transition(BuildStatus current, BuildStatus next) {
        validate(current, next);
        return next;
    }
}
