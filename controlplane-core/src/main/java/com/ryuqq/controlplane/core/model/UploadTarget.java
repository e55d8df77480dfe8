package com.ryuqq.controlplane.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 업로드 그랜트 대상 종류.
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public enum UploadTarget {

    BUNDLE("bundle"),
    SNAPSHOT("snapshot");

    private final String wireName;

    UploadTarget(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
