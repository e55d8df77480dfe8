package com.ryuqq.controlplane.core.model;

import java.time.Instant;

/**
 * 인증 토큰.
 *
 * <p>같은 로그인에서 파생된 토큰은 {@code authSessionId}를 공유하며,
 * logoutAll은 이 그룹 전체를 폐기합니다. runtime 토큰은 {@code sessionId}에 묶입니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class AuthToken {

    private String id;
    private String token;
    private String userId;
    private String workspaceId;
    private TokenKind kind;
    private String sessionId;
    private String authSessionId;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant revokedAt;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public void setWorkspaceId(String workspaceId) {
        this.workspaceId = workspaceId;
    }

    public TokenKind getKind() {
        return kind;
    }

    public void setKind(TokenKind kind) {
        this.kind = kind;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getAuthSessionId() {
        return authSessionId;
    }

    public void setAuthSessionId(String authSessionId) {
        this.authSessionId = authSessionId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public Instant getRevokedAt() {
        return revokedAt;
    }

    public void setRevokedAt(Instant revokedAt) {
        this.revokedAt = revokedAt;
    }

    /**
     * 주어진 시각에 유효한지 확인 (폐기되지 않았고 만료 전).
     */
    public boolean isActiveAt(Instant now) {
        return revokedAt == null && expiresAt != null && now.isBefore(expiresAt);
    }
}
