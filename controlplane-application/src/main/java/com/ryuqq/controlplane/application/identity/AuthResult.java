package com.ryuqq.controlplane.application.identity;

import com.ryuqq.controlplane.core.model.AuthToken;
import com.ryuqq.controlplane.core.model.User;
import com.ryuqq.controlplane.core.model.Workspace;

/**
 * 로그인 계열 연산 결과.
 *
 * @param user 사용자
 * @param workspace 토큰이 가리키는 워크스페이스
 * @param token 새로 발급된 토큰
 * @author Control Plane Team
 * @since 1.0.0
 */
public record AuthResult(User user, Workspace workspace, AuthToken token) {

    public String tokenValue() {
        return token.getToken();
    }
}
