package com.ryuqq.controlplane.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 워크스페이스 초대 상태.
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public enum InviteStatus {

    PENDING("pending"),
    ACCEPTED("accepted");

    private final String wireName;

    InviteStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
