package com.ryuqq.controlplane.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 디바이스 코드 상태 (PENDING → APPROVED → EXCHANGED).
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public enum DeviceCodeStatus {

    PENDING("pending"),
    APPROVED("approved"),
    EXCHANGED("exchanged");

    private final String wireName;

    DeviceCodeStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
