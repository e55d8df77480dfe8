package com.ryuqq.controlplane.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 사용량 이벤트 종류.
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public enum UsageKind {

    RUNTIME_MINUTES("runtime_minutes"),
    SNAPSHOT("snapshot"),
    TEMPLATE_BUILD("template_build");

    private final String wireName;

    UsageKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
