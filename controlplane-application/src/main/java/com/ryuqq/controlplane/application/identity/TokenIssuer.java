package com.ryuqq.controlplane.application.identity;

import com.ryuqq.controlplane.core.model.AuthToken;
import com.ryuqq.controlplane.core.model.TokenKind;
import com.ryuqq.controlplane.core.state.StateDocument;
import com.ryuqq.controlplane.core.util.Ids;

import java.time.Duration;
import java.time.Instant;

/**
 * 인증 토큰 발급.
 *
 * <p>토큰 값은 종류를 접두사로 가진 임의 문자열입니다 (예: {@code browser_9c1f...}).
 * {@code authSessionId}가 null이면 새 로그인 그룹을 시작합니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class TokenIssuer {

    private TokenIssuer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static AuthToken issue(
        StateDocument draft,
        Instant now,
        String userId,
        String workspaceId,
        TokenKind kind,
        String authSessionId,
        String sessionId,
        Duration ttl
    ) {
        AuthToken token = new AuthToken();
        token.setId(Ids.next("tok"));
        token.setToken(Ids.secret(kind.wireName()));
        token.setUserId(userId);
        token.setWorkspaceId(workspaceId);
        token.setKind(kind);
        token.setSessionId(sessionId);
        token.setAuthSessionId(authSessionId != null ? authSessionId : Ids.next("auth"));
        token.setCreatedAt(now);
        token.setExpiresAt(now.plus(ttl));
        draft.getAuthTokens().add(token);
        return token;
    }
}
