package com.ryuqq.controlplane.application.identity;

import com.ryuqq.controlplane.application.ledger.Ledger;
import com.ryuqq.controlplane.application.support.AccessGuard;
import com.ryuqq.controlplane.application.support.AuthContext;
import com.ryuqq.controlplane.application.support.StateQueries;
import com.ryuqq.controlplane.core.config.ControlPlaneConfig;
import com.ryuqq.controlplane.core.error.ControlPlaneException;
import com.ryuqq.controlplane.core.model.AuthToken;
import com.ryuqq.controlplane.core.model.DeviceCode;
import com.ryuqq.controlplane.core.model.DeviceCodeStatus;
import com.ryuqq.controlplane.core.model.MemberRole;
import com.ryuqq.controlplane.core.model.Membership;
import com.ryuqq.controlplane.core.model.PasskeyCredential;
import com.ryuqq.controlplane.core.model.Plan;
import com.ryuqq.controlplane.core.model.RecoveryCode;
import com.ryuqq.controlplane.core.model.TokenKind;
import com.ryuqq.controlplane.core.model.User;
import com.ryuqq.controlplane.core.model.Workspace;
import com.ryuqq.controlplane.core.spi.CredentialVerification;
import com.ryuqq.controlplane.core.spi.CredentialVerifier;
import com.ryuqq.controlplane.core.state.StateDocument;
import com.ryuqq.controlplane.core.store.StateStore;
import com.ryuqq.controlplane.core.util.Hashing;
import com.ryuqq.controlplane.core.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 사용자 인증 및 토큰 관리.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>가입(이메일 기준 멱등), 로그인, 워크스페이스 전환</li>
 *   <li>토큰 인증, 단일/그룹 로그아웃, 토큰 갱신</li>
 *   <li>디바이스 코드 흐름 (start → approve → exchange)</li>
 *   <li>복구 코드 발급 및 사용</li>
 *   <li>패스키 등록/로그인 ({@link CredentialVerifier}에 검증 위임)</li>
 * </ul>
 *
 * <p>모든 연산은 하나의 트랜잭션으로 실행되며, 실패 시 어떤 변경도 저장되지 않습니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class IdentityService {

    private static final Logger log = LoggerFactory.getLogger(IdentityService.class);

    private final StateStore stateStore;
    private final Clock clock;
    private final ControlPlaneConfig config;
    private final CredentialVerifier credentialVerifier;

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public IdentityService(
        StateStore stateStore,
        Clock clock,
        ControlPlaneConfig config,
        CredentialVerifier credentialVerifier
    ) {
        if (stateStore == null) {
            throw new IllegalArgumentException("stateStore cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (credentialVerifier == null) {
            throw new IllegalArgumentException("credentialVerifier cannot be null");
        }
        this.stateStore = stateStore;
        this.clock = clock;
        this.config = config;
        this.credentialVerifier = credentialVerifier;
    }

    // ============================================================
    // 가입 / 로그인
    // ============================================================

    /**
     * 사용자 가입.
     *
     * <p>처음 보는 이메일이면 사용자, 기본 워크스페이스, owner 멤버십을 함께 만듭니다.
     * 이미 가입된 이메일이면 아무것도 만들지 않고 새 browser 토큰만 발급합니다.</p>
     *
     * @param email 이메일 (필수)
     * @param name 표시 이름 (없으면 이메일 로컬 파트)
     * @return 사용자, 기본 워크스페이스, 새 토큰
     */
    public AuthResult registerUser(String email, String name) {
        String normalized = requireEmail(email);
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            User user = StateQueries.findUserByEmail(state, normalized).orElse(null);
            if (user == null) {
                user = createUser(state, now, normalized, name);
                log.info("Registered user {} ({})", user.getId(), normalized);
            }
            Workspace workspace = defaultWorkspace(state, user);
            AuthToken token = TokenIssuer.issue(state, now, user.getId(), workspace.getId(),
                TokenKind.BROWSER, null, null, config.tokenTtl());
            return new AuthResult(user, workspace, token);
        });
    }

    private User createUser(StateDocument state, Instant now, String email, String name) {
        User user = new User();
        user.setId(Ids.next("usr"));
        user.setEmail(email);
        user.setName(name == null || name.isBlank() ? defaultNameFromEmail(email) : name.trim());
        user.setCreatedAt(now);
        state.getUsers().add(user);

        Workspace workspace = new Workspace();
        workspace.setId(Ids.next("ws"));
        workspace.setName(user.getName() + "'s Workspace");
        workspace.setOwnerUserId(user.getId());
        workspace.setPlan(Plan.FREE);
        workspace.setCreatedAt(now);
        state.getWorkspaces().add(workspace);

        Membership membership = new Membership();
        membership.setWorkspaceId(workspace.getId());
        membership.setUserId(user.getId());
        membership.setRole(MemberRole.OWNER);
        membership.setCreatedAt(now);
        state.getMemberships().add(membership);

        Ledger.audit(state, now, workspace.getId(), user.getId(), "user.registered", "user", user.getId(),
            Map.of("email", email));
        return user;
    }

    /**
     * 로그인 (새 토큰 발급, 기존 토큰은 유지).
     *
     * @param kind browser 또는 api
     * @param workspaceId 대상 워크스페이스 (null이면 기본 워크스페이스)
     */
    public AuthResult login(String email, TokenKind kind, String workspaceId) {
        String normalized = requireEmail(email);
        TokenKind tokenKind = kind == null ? TokenKind.BROWSER : kind;
        if (tokenKind == TokenKind.RUNTIME) {
            throw ControlPlaneException.badRequest("Runtime tokens cannot be issued by login");
        }
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            User user = StateQueries.findUserByEmail(state, normalized)
                .orElseThrow(() -> ControlPlaneException.notFound("User not found"));
            Workspace workspace = resolveWorkspace(state, user, workspaceId);
            AuthToken token = TokenIssuer.issue(state, now, user.getId(), workspace.getId(),
                tokenKind, null, null, config.tokenTtl());
            Ledger.audit(state, now, workspace.getId(), user.getId(), "user.logged_in", "workspace",
                workspace.getId(), Map.of("kind", tokenKind.wireName()));
            return new AuthResult(user, workspace, token);
        });
    }

    /**
     * 토큰 인증 및 호출자 요약.
     */
    public AuthView authenticate(String token) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireAuth(state, token, now);
            long pendingDevices = state.getDeviceCodes().stream()
                .filter(d -> d.getWorkspaceId().equals(auth.workspaceId()))
                .filter(d -> d.getStatus() == DeviceCodeStatus.PENDING && d.getExpiresAt().isAfter(now))
                .count();
            return new AuthView(
                auth.user(),
                new WorkspaceView(auth.workspace(), auth.role(), StateQueries.memberCount(state, auth.workspaceId())),
                auth.role(),
                Ledger.summarize(state, auth.workspaceId()),
                auth.workspace().getLimits(),
                pendingDevices
            );
        });
    }

    /**
     * 다른 워크스페이스용 토큰 발급 (같은 로그인 그룹).
     *
     * <p>browser 토큰은 browser로, 그 외에는 api 토큰으로 발급합니다.</p>
     */
    public AuthResult switchWorkspace(String token, String workspaceId) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireAuth(state, token, now);
            Workspace workspace = StateQueries.findWorkspace(state, workspaceId)
                .orElseThrow(() -> ControlPlaneException.notFound("Workspace not found"));
            StateQueries.findMembership(state, workspace.getId(), auth.userId())
                .orElseThrow(() -> ControlPlaneException.forbidden("Unauthorized workspace"));
            TokenKind kind = auth.token().getKind() == TokenKind.BROWSER ? TokenKind.BROWSER : TokenKind.API;
            AuthToken next = TokenIssuer.issue(state, now, auth.userId(), workspace.getId(), kind,
                auth.token().getAuthSessionId(), null, config.tokenTtl());
            Ledger.audit(state, now, workspace.getId(), auth.userId(), "workspace.switched", "workspace",
                workspace.getId());
            return new AuthResult(auth.user(), workspace, next);
        });
    }

    /**
     * 토큰 갱신: 같은 그룹에서 새 토큰을 발급하고 기존 토큰을 폐기합니다.
     */
    public AuthResult refreshSession(String token) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireAuth(state, token, now);
            AuthToken next = TokenIssuer.issue(state, now, auth.userId(), auth.workspaceId(),
                auth.token().getKind(), auth.token().getAuthSessionId(), null, config.tokenTtl());
            auth.token().setRevokedAt(now);
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "user.session_refreshed", "auth_session",
                next.getAuthSessionId());
            return new AuthResult(auth.user(), auth.workspace(), next);
        });
    }

    // ============================================================
    // 로그아웃
    // ============================================================

    /**
     * 토큰 하나를 폐기합니다.
     */
    public void logout(String token) {
        stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthToken authToken = AccessGuard.requireActiveToken(state, token, now);
            authToken.setRevokedAt(now);
            Ledger.audit(state, now, authToken.getWorkspaceId(), authToken.getUserId(), "user.logged_out",
                "auth_session", authToken.getAuthSessionId());
            return null;
        });
    }

    /**
     * 호출자 로그인 그룹의 모든 토큰을 폐기합니다.
     *
     * @return 폐기된 토큰 수
     */
    public int logoutAll(String token) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireAuth(state, token, now);
            int revoked = revokeGroup(state, auth.userId(), auth.token().getAuthSessionId(), now);
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "user.logged_out_all", "user",
                auth.userId(), Map.of("revoked", String.valueOf(revoked)));
            return revoked;
        });
    }

    /**
     * 호출자의 활성 로그인 그룹 목록.
     */
    public List<AuthSessionView> listAuthSessions(String token) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireAuth(state, token, now);
            Map<String, List<AuthToken>> groups = new LinkedHashMap<>();
            for (AuthToken entry : state.getAuthTokens()) {
                if (entry.getUserId().equals(auth.userId())
                    && entry.getKind() != TokenKind.RUNTIME
                    && entry.isActiveAt(now)) {
                    groups.computeIfAbsent(entry.getAuthSessionId(), key -> new ArrayList<>()).add(entry);
                }
            }
            List<AuthSessionView> views = new ArrayList<>();
            for (Map.Entry<String, List<AuthToken>> group : groups.entrySet()) {
                List<AuthToken> tokens = group.getValue();
                views.add(new AuthSessionView(
                    group.getKey(),
                    tokens.size(),
                    tokens.stream().map(AuthToken::getCreatedAt).min(Comparator.naturalOrder()).orElse(null),
                    tokens.stream().map(AuthToken::getExpiresAt).max(Comparator.naturalOrder()).orElse(null),
                    group.getKey().equals(auth.token().getAuthSessionId())
                ));
            }
            return views;
        });
    }

    /**
     * 호출자의 특정 로그인 그룹을 폐기합니다.
     *
     * @return 폐기된 토큰 수
     */
    public int revokeAuthSession(String token, String authSessionId) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireAuth(state, token, now);
            int revoked = revokeGroup(state, auth.userId(), authSessionId, now);
            if (revoked == 0) {
                throw ControlPlaneException.notFound("Auth session not found");
            }
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "user.auth_session_revoked",
                "auth_session", authSessionId, Map.of("revoked", String.valueOf(revoked)));
            return revoked;
        });
    }

    private static int revokeGroup(StateDocument state, String userId, String authSessionId, Instant now) {
        int revoked = 0;
        for (AuthToken entry : state.getAuthTokens()) {
            if (entry.getUserId().equals(userId)
                && authSessionId.equals(entry.getAuthSessionId())
                && entry.getRevokedAt() == null) {
                entry.setRevokedAt(now);
                revoked++;
            }
        }
        return revoked;
    }

    // ============================================================
    // 디바이스 코드 흐름
    // ============================================================

    public DeviceAuthorization deviceStart(String email, String workspaceId) {
        String normalized = requireEmail(email);
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            User user = StateQueries.findUserByEmail(state, normalized)
                .orElseThrow(() -> ControlPlaneException.notFound("User not found"));
            Workspace workspace = resolveWorkspace(state, user, workspaceId);
            DeviceCode deviceCode = new DeviceCode();
            deviceCode.setId(Ids.next("dev"));
            deviceCode.setCode(Ids.secret("device"));
            deviceCode.setUserId(user.getId());
            deviceCode.setWorkspaceId(workspace.getId());
            deviceCode.setStatus(DeviceCodeStatus.PENDING);
            deviceCode.setCreatedAt(now);
            deviceCode.setExpiresAt(now.plus(config.deviceCodeTtl()));
            state.getDeviceCodes().add(deviceCode);
            Ledger.audit(state, now, workspace.getId(), user.getId(), "device.started", "device_code",
                deviceCode.getId());
            return new DeviceAuthorization(deviceCode.getCode(), deviceCode.getExpiresAt());
        });
    }

    public DeviceCode deviceApprove(String token, String code) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireAuth(state, token, now);
            DeviceCode deviceCode = findDeviceCode(state, code);
            if (!deviceCode.getWorkspaceId().equals(auth.workspaceId())) {
                throw ControlPlaneException.forbidden("Workspace mismatch");
            }
            if (!deviceCode.getExpiresAt().isAfter(now)) {
                throw ControlPlaneException.badRequest("Device code expired");
            }
            if (deviceCode.getStatus() != DeviceCodeStatus.PENDING) {
                throw ControlPlaneException.conflict("Device code already " + deviceCode.getStatus().wireName());
            }
            deviceCode.setStatus(DeviceCodeStatus.APPROVED);
            deviceCode.setApprovedAt(now);
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "device.approved", "device_code",
                deviceCode.getId());
            return deviceCode;
        });
    }

    public AuthResult deviceExchange(String code) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            DeviceCode deviceCode = findDeviceCode(state, code);
            if (!deviceCode.getExpiresAt().isAfter(now)) {
                throw ControlPlaneException.badRequest("Device code expired");
            }
            if (deviceCode.getStatus() != DeviceCodeStatus.APPROVED) {
                throw ControlPlaneException.conflict("Device code not approved");
            }
            User user = StateQueries.findUser(state, deviceCode.getUserId())
                .orElseThrow(() -> ControlPlaneException.notFound("User not found"));
            Workspace workspace = StateQueries.findWorkspace(state, deviceCode.getWorkspaceId())
                .orElseThrow(() -> ControlPlaneException.notFound("Workspace not found"));
            StateQueries.findMembership(state, workspace.getId(), user.getId())
                .orElseThrow(() -> ControlPlaneException.forbidden("Unauthorized workspace"));
            deviceCode.setStatus(DeviceCodeStatus.EXCHANGED);
            deviceCode.setExchangedAt(now);
            AuthToken token = TokenIssuer.issue(state, now, user.getId(), workspace.getId(), TokenKind.API,
                null, null, config.tokenTtl());
            Ledger.audit(state, now, workspace.getId(), user.getId(), "device.exchanged", "device_code",
                deviceCode.getId());
            return new AuthResult(user, workspace, token);
        });
    }

    private static DeviceCode findDeviceCode(StateDocument state, String code) {
        return state.getDeviceCodes().stream()
            .filter(d -> d.getCode().equals(code))
            .findFirst()
            .orElseThrow(() -> ControlPlaneException.notFound("Device code not found"));
    }

    // ============================================================
    // 복구 코드
    // ============================================================

    /**
     * 복구 코드를 새로 발급합니다 (기존 코드는 모두 무효화).
     *
     * @return 평문 복구 코드 (이 응답에서만 확인 가능)
     */
    public List<String> generateRecoveryCodes(String token) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireAuth(state, token, now);
            List<String> plaintext = new ArrayList<>();
            List<RecoveryCode> hashed = new ArrayList<>();
            for (int i = 0; i < config.recoveryCodeCount(); i++) {
                String code = Ids.userCode() + "-" + Ids.userCode();
                plaintext.add(code);
                hashed.add(RecoveryCode.of(Hashing.sha256(code), now));
            }
            auth.user().setRecoveryCodes(hashed);
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "user.recovery_codes_generated", "user",
                auth.userId(), Map.of("count", String.valueOf(plaintext.size())));
            return plaintext;
        });
    }

    /**
     * 복구 코드로 로그인 (사용한 코드만 제거).
     */
    public AuthResult recoverWithCode(String email, String code) {
        String normalized = requireEmail(email);
        if (code == null || code.isBlank()) {
            throw ControlPlaneException.badRequest("Recovery code is required");
        }
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            User user = StateQueries.findUserByEmail(state, normalized)
                .orElseThrow(() -> ControlPlaneException.unauthorized("Invalid recovery code"));
            String hash = Hashing.sha256(code.trim());
            boolean removed = user.getRecoveryCodes().removeIf(entry -> entry.getHash().equals(hash));
            if (!removed) {
                throw ControlPlaneException.unauthorized("Invalid recovery code");
            }
            Workspace workspace = defaultWorkspace(state, user);
            AuthToken token = TokenIssuer.issue(state, now, user.getId(), workspace.getId(), TokenKind.BROWSER,
                null, null, config.tokenTtl());
            Ledger.audit(state, now, workspace.getId(), user.getId(), "user.recovered", "user", user.getId(),
                Map.of("remaining", String.valueOf(user.getRecoveryCodes().size())));
            return new AuthResult(user, workspace, token);
        });
    }

    // ============================================================
    // 패스키
    // ============================================================

    public PasskeyCredential registerPasskey(String token, String attestation, String label) {
        if (attestation == null || attestation.isBlank()) {
            throw ControlPlaneException.badRequest("Attestation is required");
        }
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireAuth(state, token, now);
            CredentialVerification verification = credentialVerifier.verifyRegistration(auth.userId(), attestation);
            if (verification == null || !verification.verified()) {
                throw ControlPlaneException.unauthorized("Passkey registration could not be verified");
            }
            boolean duplicate = auth.user().getPasskeys().stream()
                .anyMatch(p -> p.getCredentialId().equals(verification.credentialId()));
            if (duplicate) {
                throw ControlPlaneException.conflict("Passkey already registered");
            }
            PasskeyCredential passkey = new PasskeyCredential();
            passkey.setCredentialId(verification.credentialId());
            passkey.setLabel(label == null || label.isBlank() ? "Passkey" : label.trim());
            passkey.setCreatedAt(now);
            auth.user().getPasskeys().add(passkey);
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "user.passkey_registered", "user",
                auth.userId(), Map.of("credentialId", passkey.getCredentialId()));
            return passkey;
        });
    }

    public List<PasskeyCredential> listPasskeys(String token) {
        return stateStore.transact(state -> {
            AuthContext auth = AccessGuard.requireAuth(state, token, clock.instant());
            return new ArrayList<>(auth.user().getPasskeys());
        });
    }

    public void deletePasskey(String token, String credentialId) {
        stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireAuth(state, token, now);
            boolean removed = auth.user().getPasskeys().removeIf(p -> p.getCredentialId().equals(credentialId));
            if (!removed) {
                throw ControlPlaneException.notFound("Passkey not found");
            }
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "user.passkey_deleted", "user",
                auth.userId(), Map.of("credentialId", credentialId));
            return null;
        });
    }

    public AuthResult loginWithPasskey(String email, String assertion) {
        String normalized = requireEmail(email);
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            User user = StateQueries.findUserByEmail(state, normalized)
                .orElseThrow(() -> ControlPlaneException.unauthorized("Passkey login failed"));
            List<String> credentialIds = user.getPasskeys().stream().map(PasskeyCredential::getCredentialId).toList();
            if (credentialIds.isEmpty()) {
                throw ControlPlaneException.unauthorized("No passkeys registered");
            }
            CredentialVerification verification = credentialVerifier.verifyAssertion(credentialIds, assertion);
            if (verification == null || !verification.verified()
                || !credentialIds.contains(verification.credentialId())) {
                throw ControlPlaneException.unauthorized("Passkey login failed");
            }
            user.getPasskeys().stream()
                .filter(p -> p.getCredentialId().equals(verification.credentialId()))
                .forEach(p -> p.setLastUsedAt(now));
            Workspace workspace = defaultWorkspace(state, user);
            AuthToken token = TokenIssuer.issue(state, now, user.getId(), workspace.getId(), TokenKind.BROWSER,
                null, null, config.tokenTtl());
            Ledger.audit(state, now, workspace.getId(), user.getId(), "user.logged_in", "workspace",
                workspace.getId(), Map.of("kind", "passkey"));
            return new AuthResult(user, workspace, token);
        });
    }

    // ============================================================
    // 내부 헬퍼
    // ============================================================

    private static String requireEmail(String email) {
        String normalized = StateQueries.normalizeEmail(email);
        if (normalized == null || normalized.isEmpty()) {
            throw ControlPlaneException.badRequest("Email is required");
        }
        return normalized;
    }

    static String defaultNameFromEmail(String email) {
        int at = email.indexOf('@');
        String local = at > 0 ? email.substring(0, at) : email;
        return local.isBlank() ? "user" : local;
    }

    /**
     * 사용자가 소유한 워크스페이스, 없으면 처음 가입한 워크스페이스.
     */
    private static Workspace defaultWorkspace(StateDocument state, User user) {
        return state.getWorkspaces().stream()
            .filter(w -> w.getOwnerUserId().equals(user.getId()))
            .findFirst()
            .or(() -> state.getMemberships().stream()
                .filter(m -> m.getUserId().equals(user.getId()))
                .findFirst()
                .flatMap(m -> StateQueries.findWorkspace(state, m.getWorkspaceId())))
            .orElseThrow(() -> ControlPlaneException.notFound("Workspace not found"));
    }

    private static Workspace resolveWorkspace(StateDocument state, User user, String workspaceId) {
        if (workspaceId == null) {
            return defaultWorkspace(state, user);
        }
        Workspace workspace = StateQueries.findWorkspace(state, workspaceId)
            .orElseThrow(() -> ControlPlaneException.notFound("Workspace not found"));
        StateQueries.findMembership(state, workspace.getId(), user.getId())
            .orElseThrow(() -> ControlPlaneException.forbidden("Unauthorized workspace"));
        return workspace;
    }
}
