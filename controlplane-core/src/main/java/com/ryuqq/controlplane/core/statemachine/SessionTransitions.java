package com.ryuqq.controlplane.core.statemachine;

/**
 * 세션 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CREATED → STARTING</li>
 *   <li>STARTING → RUNNING | STOPPING</li>
 *   <li>RUNNING → STOPPING</li>
 *   <li>STOPPING → SLEEPING</li>
 *   <li>SLEEPING → STARTING</li>
 *   <li>DELETED 외 모든 상태 → DELETED</li>
 * </ul>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class SessionTransitions {

    private SessionTransitions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(SessionState from, SessionState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid session transition: %s → %s", from, to)
            );
        }
    }

    public static boolean isAllowed(SessionState from, SessionState to) {
        if (to == SessionState.DELETED) {
            return !from.isTerminal();
        }
        return switch (from) {
            case CREATED, SLEEPING -> to == SessionState.STARTING;
            case STARTING -> to == SessionState.RUNNING || to == SessionState.STOPPING;
            case RUNNING -> to == SessionState.STOPPING;
            case STOPPING -> to == SessionState.SLEEPING;
            case DELETED -> false;
        };
    }

    public static SessionState transition(SessionState current, SessionState next) {
        validate(current, next);
        return next;
    }
}
