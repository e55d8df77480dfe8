package com.ryuqq.controlplane.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * TemplateVersion 상태.
 *
 * <p>빌드가 성공하면 READY가 되며, READY 버전만 승격(promote)될 수 있습니다.
 * 실패 시 버전 상태는 그대로 두고 빌드에 실패를 기록합니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public enum VersionStatus {

    QUEUED("queued"),
    BUILDING("building"),
    READY("ready"),
    FAILED("failed");

    private final String wireName;

    VersionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
