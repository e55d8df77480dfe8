package com.ryuqq.controlplane.application.identity;

import com.ryuqq.controlplane.application.ControlPlaneTestSupport;
import com.ryuqq.controlplane.core.error.ErrorKind;
import com.ryuqq.controlplane.core.model.AuditLog;
import com.ryuqq.controlplane.core.model.DeviceCodeStatus;
import com.ryuqq.controlplane.core.model.PasskeyCredential;
import com.ryuqq.controlplane.core.model.Plan;
import com.ryuqq.controlplane.core.model.TokenKind;
import com.ryuqq.controlplane.testkit.fixture.FakeCredentialVerifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * IdentityService 시나리오 테스트.
 *
 * <p>가입, 로그인, 토큰 그룹, 디바이스 코드, 복구 코드, 패스키 흐름을 검증합니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
class IdentityServiceTest extends ControlPlaneTestSupport {

    private IdentityService identity() {
        return controlPlane.identity();
    }

    // ============================================================
    // 1. 가입 / 로그인
    // ============================================================

    @Test
    void registerUser_처음_보는_이메일이면_사용자와_기본_워크스페이스를_만듦() {
        // when
        AuthResult result = register("Dev@Example.com");

        // then
        assertThat(result.user().getEmail()).isEqualTo("dev@example.com");
        assertThat(result.user().getName()).isEqualTo("dev");
        assertThat(result.workspace().getName()).isEqualTo("dev's Workspace");
        assertThat(result.workspace().getPlan()).isEqualTo(Plan.FREE);
        assertThat(result.token().getKind()).isEqualTo(TokenKind.BROWSER);
    }

    @Test
    void registerUser_같은_이메일로_다시_가입하면_새_토큰만_발급() {
        // given
        AuthResult first = register("dev@example.com");

        // when
        AuthResult second = register("DEV@example.com");

        // then
        assertThat(second.user().getId()).isEqualTo(first.user().getId());
        assertThat(second.workspace().getId()).isEqualTo(first.workspace().getId());
        assertThat(second.tokenValue()).isNotEqualTo(first.tokenValue());
        assertThat(controlPlane.workspaces().listWorkspaces(second.tokenValue())).hasSize(1);
    }

    @Test
    void registerUser_이메일이_없으면_BAD_REQUEST() {
        assertKind(() -> identity().registerUser("  ", null), ErrorKind.BAD_REQUEST);
    }

    @Test
    void login_가입하지_않은_이메일이면_NOT_FOUND() {
        assertKind(() -> identity().login("ghost@example.com", TokenKind.BROWSER, null), ErrorKind.NOT_FOUND);
    }

    @Test
    void login_runtime_토큰은_발급할_수_없음() {
        register("dev@example.com");

        assertKind(() -> identity().login("dev@example.com", TokenKind.RUNTIME, null), ErrorKind.BAD_REQUEST);
    }

    @Test
    void login_api_토큰_발급() {
        // given
        register("dev@example.com");

        // when
        AuthResult result = identity().login("dev@example.com", TokenKind.API, null);

        // then
        assertThat(result.token().getKind()).isEqualTo(TokenKind.API);
        assertThat(identity().authenticate(result.tokenValue()).user().getEmail()).isEqualTo("dev@example.com");
    }

    // ============================================================
    // 2. 토큰 수명 / 그룹
    // ============================================================

    @Test
    void authenticate_만료된_토큰은_UNAUTHORIZED() {
        // given
        String token = register("dev@example.com").tokenValue();

        // when
        clock.advance(Duration.ofDays(7).plusSeconds(1));

        // then
        assertKind(() -> identity().authenticate(token), ErrorKind.UNAUTHORIZED);
    }

    @Test
    void authenticate_토큰이_없으면_UNAUTHORIZED() {
        assertKind(() -> identity().authenticate(null), ErrorKind.UNAUTHORIZED);
        assertKind(() -> identity().authenticate("browser_unknown"), ErrorKind.UNAUTHORIZED);
    }

    @Test
    void refreshSession_기존_토큰을_폐기하고_같은_그룹으로_새_토큰_발급() {
        // given
        AuthResult original = register("dev@example.com");

        // when
        AuthResult refreshed = identity().refreshSession(original.tokenValue());

        // then
        assertThat(refreshed.token().getAuthSessionId()).isEqualTo(original.token().getAuthSessionId());
        assertKind(() -> identity().authenticate(original.tokenValue()), ErrorKind.UNAUTHORIZED);
        assertThat(identity().authenticate(refreshed.tokenValue()).user().getId())
            .isEqualTo(original.user().getId());
    }

    @Test
    void logoutAll_호출자_그룹만_폐기함() {
        // given
        AuthResult laptop = register("dev@example.com");
        AuthResult desktop = register("dev@example.com");
        AuthResult laptopSwitched = identity().refreshSession(laptop.tokenValue());

        // when
        int revoked = identity().logoutAll(laptopSwitched.tokenValue());

        // then
        assertThat(revoked).isEqualTo(1);
        assertKind(() -> identity().authenticate(laptopSwitched.tokenValue()), ErrorKind.UNAUTHORIZED);
        assertThat(identity().authenticate(desktop.tokenValue()).user().getId()).isEqualTo(laptop.user().getId());
    }

    @Test
    void listAuthSessions_활성_그룹과_현재_그룹_표시() {
        // given
        AuthResult first = register("dev@example.com");
        register("dev@example.com");

        // when
        List<AuthSessionView> sessions = identity().listAuthSessions(first.tokenValue());

        // then
        assertThat(sessions).hasSize(2);
        assertThat(sessions).filteredOn(AuthSessionView::current)
            .extracting(AuthSessionView::authSessionId)
            .containsExactly(first.token().getAuthSessionId());
    }

    @Test
    void revokeAuthSession_다른_그룹을_폐기하고_없는_그룹은_NOT_FOUND() {
        // given
        AuthResult first = register("dev@example.com");
        AuthResult second = register("dev@example.com");

        // when
        int revoked = identity().revokeAuthSession(first.tokenValue(), second.token().getAuthSessionId());

        // then
        assertThat(revoked).isEqualTo(1);
        assertKind(() -> identity().authenticate(second.tokenValue()), ErrorKind.UNAUTHORIZED);
        assertKind(() -> identity().revokeAuthSession(first.tokenValue(), "auth_missing"), ErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("logout, refreshSession, revokeAuthSession은 같은 트랜잭션에서 감사 로그를 남긴다")
    void 토큰_폐기와_갱신은_감사_로그에_기록됨() {
        // given
        AuthResult first = register("dev@example.com");
        AuthResult second = register("dev@example.com");
        AuthResult third = register("dev@example.com");

        // when & then
        identity().logout(second.tokenValue());
        AuditLog loggedOut = latestAudit(first);
        assertThat(loggedOut.getAction()).isEqualTo("user.logged_out");
        assertThat(loggedOut.getTargetId()).isEqualTo(second.token().getAuthSessionId());

        AuthResult refreshed = identity().refreshSession(first.tokenValue());
        assertThat(latestAudit(refreshed).getAction()).isEqualTo("user.session_refreshed");

        identity().revokeAuthSession(refreshed.tokenValue(), third.token().getAuthSessionId());
        AuditLog revoked = latestAudit(refreshed);
        assertThat(revoked.getAction()).isEqualTo("user.auth_session_revoked");
        assertThat(revoked.getDetails()).containsEntry("revoked", "1");
    }

    @Test
    void 실패한_토큰_폐기는_감사_로그를_남기지_않음() {
        // given
        AuthResult dev = register("dev@example.com");
        int before = controlPlane.usage().getAudit(dev.tokenValue(), 1000).size();

        // when
        assertKind(() -> identity().revokeAuthSession(dev.tokenValue(), "auth_missing"), ErrorKind.NOT_FOUND);

        // then
        assertThat(controlPlane.usage().getAudit(dev.tokenValue(), 1000)).hasSize(before);
    }

    private AuditLog latestAudit(AuthResult caller) {
        return controlPlane.usage().getAudit(caller.tokenValue(), 1).get(0);
    }

    @Test
    void switchWorkspace_멤버가_아닌_워크스페이스는_FORBIDDEN() {
        // given
        AuthResult dev = register("dev@example.com");
        AuthResult other = register("other@example.com");

        // then
        assertKind(() -> identity().switchWorkspace(dev.tokenValue(), other.workspace().getId()),
            ErrorKind.FORBIDDEN);
        assertKind(() -> identity().switchWorkspace(dev.tokenValue(), "ws_missing"), ErrorKind.NOT_FOUND);
    }

    // ============================================================
    // 3. 디바이스 코드
    // ============================================================

    @Test
    void device_흐름_start_approve_exchange() {
        // given
        AuthResult browser = register("dev@example.com");
        DeviceAuthorization authorization = identity().deviceStart("dev@example.com", null);

        // when
        identity().deviceApprove(browser.tokenValue(), authorization.deviceCode());
        AuthResult cli = identity().deviceExchange(authorization.deviceCode());

        // then
        assertThat(cli.token().getKind()).isEqualTo(TokenKind.API);
        assertThat(cli.workspace().getId()).isEqualTo(browser.workspace().getId());
        assertKind(() -> identity().deviceExchange(authorization.deviceCode()), ErrorKind.CONFLICT);
    }

    @Test
    void deviceExchange_승인_전이면_CONFLICT() {
        register("dev@example.com");
        DeviceAuthorization authorization = identity().deviceStart("dev@example.com", null);

        assertKind(() -> identity().deviceExchange(authorization.deviceCode()), ErrorKind.CONFLICT);
    }

    @Test
    void deviceApprove_두_번째_승인은_CONFLICT() {
        // given
        AuthResult browser = register("dev@example.com");
        DeviceAuthorization authorization = identity().deviceStart("dev@example.com", null);

        // when
        assertThat(identity().deviceApprove(browser.tokenValue(), authorization.deviceCode()).getStatus())
            .isEqualTo(DeviceCodeStatus.APPROVED);

        // then
        assertKind(() -> identity().deviceApprove(browser.tokenValue(), authorization.deviceCode()),
            ErrorKind.CONFLICT);
    }

    @Test
    void deviceExchange_만료된_코드는_BAD_REQUEST() {
        // given
        AuthResult browser = register("dev@example.com");
        DeviceAuthorization authorization = identity().deviceStart("dev@example.com", null);
        identity().deviceApprove(browser.tokenValue(), authorization.deviceCode());

        // when
        clock.advance(Duration.ofMinutes(11));

        // then
        assertKind(() -> identity().deviceExchange(authorization.deviceCode()), ErrorKind.BAD_REQUEST);
    }

    // ============================================================
    // 4. 복구 코드
    // ============================================================

    @Test
    void recoverWithCode_코드는_한_번만_사용_가능() {
        // given
        AuthResult dev = register("dev@example.com");
        List<String> codes = identity().generateRecoveryCodes(dev.tokenValue());

        // when
        AuthResult recovered = identity().recoverWithCode("dev@example.com", codes.get(0));

        // then
        assertThat(codes).hasSize(8).doesNotHaveDuplicates();
        assertThat(recovered.user().getRecoveryCodes()).hasSize(7);
        assertKind(() -> identity().recoverWithCode("dev@example.com", codes.get(0)), ErrorKind.UNAUTHORIZED);
    }

    @Test
    void generateRecoveryCodes_재발급하면_이전_코드는_무효() {
        // given
        AuthResult dev = register("dev@example.com");
        List<String> old = identity().generateRecoveryCodes(dev.tokenValue());

        // when
        identity().generateRecoveryCodes(dev.tokenValue());

        // then
        assertKind(() -> identity().recoverWithCode("dev@example.com", old.get(1)), ErrorKind.UNAUTHORIZED);
    }

    // ============================================================
    // 5. 패스키
    // ============================================================

    @Test
    void passkey_등록_후_로그인() {
        // given
        AuthResult dev = register("dev@example.com");
        PasskeyCredential passkey = identity().registerPasskey(dev.tokenValue(),
            FakeCredentialVerifier.attestationFor("cred-1"), "Laptop");

        // when
        AuthResult result = identity().loginWithPasskey("dev@example.com",
            FakeCredentialVerifier.assertionFor("cred-1"));

        // then
        assertThat(passkey.getLabel()).isEqualTo("Laptop");
        assertThat(result.user().getId()).isEqualTo(dev.user().getId());
        assertThat(identity().listPasskeys(dev.tokenValue()))
            .extracting(PasskeyCredential::getLastUsedAt)
            .containsExactly(clock.instant());
    }

    @Test
    void passkey_중복_등록은_CONFLICT_검증_실패는_UNAUTHORIZED() {
        AuthResult dev = register("dev@example.com");
        identity().registerPasskey(dev.tokenValue(), FakeCredentialVerifier.attestationFor("cred-1"), null);

        assertKind(() -> identity().registerPasskey(dev.tokenValue(),
            FakeCredentialVerifier.attestationFor("cred-1"), null), ErrorKind.CONFLICT);
        assertKind(() -> identity().registerPasskey(dev.tokenValue(), "garbage", null), ErrorKind.UNAUTHORIZED);
        assertKind(() -> identity().loginWithPasskey("dev@example.com",
            FakeCredentialVerifier.assertionFor("cred-2")), ErrorKind.UNAUTHORIZED);
    }

    @Test
    void passkey_삭제하면_로그인_불가() {
        // given
        AuthResult dev = register("dev@example.com");
        identity().registerPasskey(dev.tokenValue(), FakeCredentialVerifier.attestationFor("cred-1"), null);

        // when
        identity().deletePasskey(dev.tokenValue(), "cred-1");

        // then
        assertKind(() -> identity().loginWithPasskey("dev@example.com",
            FakeCredentialVerifier.assertionFor("cred-1")), ErrorKind.UNAUTHORIZED);
        assertKind(() -> identity().deletePasskey(dev.tokenValue(), "cred-1"), ErrorKind.NOT_FOUND);
    }
}
