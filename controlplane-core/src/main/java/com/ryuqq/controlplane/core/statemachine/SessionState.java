package com.ryuqq.controlplane.core.statemachine;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Session의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * CREATED ──► STARTING ──► RUNNING ──► STOPPING ──► SLEEPING
 *                ▲                                     │
 *                └─────────────────────────────────────┘
 *
 * 삭제되지 않은 모든 상태 ──► DELETED (종료)
 * </pre>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public enum SessionState {

    CREATED("created"),
    STARTING("starting"),
    RUNNING("running"),
    STOPPING("stopping"),
    SLEEPING("sleeping"),
    DELETED("deleted");

    private final String wireName;

    SessionState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * 시작 요청을 받을 수 있는 상태인지 확인.
     */
    public boolean isStartable() {
        return this == CREATED || this == SLEEPING;
    }

    /**
     * 중지 요청을 받을 수 있는 상태인지 확인.
     */
    public boolean isStoppable() {
        return this == STARTING || this == RUNNING;
    }

    public boolean isTerminal() {
        return this == DELETED;
    }
}
