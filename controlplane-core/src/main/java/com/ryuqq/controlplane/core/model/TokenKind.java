package com.ryuqq.controlplane.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 인증 토큰 종류.
 *
 * <p>browser/api 토큰은 로그인 흐름에서, runtime 토큰은 실행 중인 세션에 대해 발급됩니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public enum TokenKind {

    BROWSER("browser"),
    API("api"),
    RUNTIME("runtime");

    private final String wireName;

    TokenKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
