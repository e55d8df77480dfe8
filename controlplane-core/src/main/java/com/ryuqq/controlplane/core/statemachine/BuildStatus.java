package com.ryuqq.controlplane.core.statemachine;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * TemplateBuild의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * QUEUED ──► BUILDING ──► SUCCEEDED
 *               │
 *               ├─► FAILED ──► RETRYING ──► BUILDING
 *               │
 *               ├─► DEAD_LETTERED ──► RETRYING (일괄 재시도만)
 *               │
 *               └─► RETRYING (stuck 복구)
 * </pre>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public enum BuildStatus {

    QUEUED("queued"),
    BUILDING("building"),
    RETRYING("retrying"),
    SUCCEEDED("succeeded"),
    FAILED("failed"),
    DEAD_LETTERED("dead_lettered");

    private final String wireName;

    BuildStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * 빌드 워커가 처리할 수 있는 상태인지 확인.
     *
     * @return QUEUED 또는 RETRYING인 경우 true
     */
    public boolean isProcessable() {
        return this == QUEUED || this == RETRYING;
    }

    /**
     * 종료 상태인지 확인.
     *
     * <p>FAILED와 DEAD_LETTERED는 재시도로 다시 열릴 수 있으므로 종료 상태가 아닙니다.</p>
     *
     * @return SUCCEEDED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED;
    }
}
