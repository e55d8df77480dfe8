package com.ryuqq.controlplane.application.support;

import com.ryuqq.controlplane.core.error.ControlPlaneException;
import com.ryuqq.controlplane.core.model.AuthToken;
import com.ryuqq.controlplane.core.model.Membership;
import com.ryuqq.controlplane.core.model.TokenKind;
import com.ryuqq.controlplane.core.model.User;
import com.ryuqq.controlplane.core.model.Workspace;
import com.ryuqq.controlplane.core.state.StateDocument;

import java.time.Instant;

/**
 * 토큰 인증 및 역할 검사.
 *
 * <p>모든 검사는 트랜잭션 draft 위에서 수행되며 실패 시 즉시
 * {@link ControlPlaneException}을 던집니다.</p>
 *
 * <p><strong>인증 실패 (UNAUTHORIZED):</strong></p>
 * <ul>
 *   <li>토큰 없음, 알 수 없는 토큰, 폐기 또는 만료된 토큰</li>
 *   <li>토큰의 사용자/워크스페이스/멤버십이 더 이상 존재하지 않음</li>
 *   <li>runtime 토큰으로 일반 API 호출</li>
 * </ul>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class AccessGuard {

    private AccessGuard() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * browser/api 토큰으로 인증합니다.
     */
    public static AuthContext requireAuth(StateDocument state, String token, Instant now) {
        AuthToken authToken = requireActiveToken(state, token, now);
        if (authToken.getKind() == TokenKind.RUNTIME) {
            throw ControlPlaneException.unauthorized("Runtime tokens cannot be used for this operation");
        }
        User user = StateQueries.findUser(state, authToken.getUserId())
            .orElseThrow(() -> ControlPlaneException.unauthorized("Unauthorized"));
        Workspace workspace = StateQueries.findWorkspace(state, authToken.getWorkspaceId())
            .orElseThrow(() -> ControlPlaneException.unauthorized("Unauthorized"));
        Membership membership = StateQueries.findMembership(state, workspace.getId(), user.getId())
            .orElseThrow(() -> ControlPlaneException.unauthorized("Unauthorized"));
        return new AuthContext(user, workspace, membership, authToken);
    }

    /**
     * owner/admin/member 역할을 요구합니다.
     */
    public static AuthContext requireWrite(StateDocument state, String token, Instant now) {
        AuthContext auth = requireAuth(state, token, now);
        if (!auth.role().canWrite()) {
            throw ControlPlaneException.forbidden("Insufficient permissions");
        }
        return auth;
    }

    /**
     * owner/admin 역할을 요구합니다.
     */
    public static AuthContext requireManage(StateDocument state, String token, Instant now) {
        AuthContext auth = requireAuth(state, token, now);
        if (!auth.role().canManage()) {
            throw ControlPlaneException.forbidden("Insufficient permissions");
        }
        return auth;
    }

    /**
     * 유효한(폐기/만료되지 않은) 토큰을 조회합니다. 종류는 검사하지 않습니다.
     */
    public static AuthToken requireActiveToken(StateDocument state, String token, Instant now) {
        if (token == null || token.isBlank()) {
            throw ControlPlaneException.unauthorized("Unauthorized");
        }
        AuthToken authToken = StateQueries.findToken(state, token)
            .orElseThrow(() -> ControlPlaneException.unauthorized("Unauthorized"));
        if (!authToken.isActiveAt(now)) {
            throw ControlPlaneException.unauthorized("Token expired or revoked");
        }
        return authToken;
    }
}
