package com.ryuqq.controlplane.application.session;

import com.ryuqq.controlplane.application.ControlPlaneTestSupport;
import com.ryuqq.controlplane.core.error.ErrorKind;
import com.ryuqq.controlplane.core.model.AuditLog;
import com.ryuqq.controlplane.core.model.AuthToken;
import com.ryuqq.controlplane.core.model.Session;
import com.ryuqq.controlplane.core.model.SessionEvent;
import com.ryuqq.controlplane.core.model.Snapshot;
import com.ryuqq.controlplane.core.model.Template;
import com.ryuqq.controlplane.core.model.TokenKind;
import com.ryuqq.controlplane.core.statemachine.SessionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SessionService 시나리오 테스트.
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
class SessionServiceTest extends ControlPlaneTestSupport {

    private String token;
    private Template template;
    private SessionService sessions;

    @BeforeEach
    void setUp() {
        token = register("owner@example.com").tokenValue();
        template = readyTemplate(token, "node");
        sessions = controlPlane.sessions();
    }

    // ============================================================
    // 생성 / 상태 전이
    // ============================================================

    @Test
    void 활성_버전이_없는_템플릿으로는_세션_생성_불가() {
        // given
        Template empty = controlPlane.templates().createTemplate(token, "empty", "");

        // when & then
        assertKind(() -> sessions.createSession(token, "dev", empty.getId()), ErrorKind.CONFLICT);
        assertKind(() -> sessions.createSession(token, " ", template.getId()), ErrorKind.BAD_REQUEST);
    }

    @Test
    void 세션_이름은_삭제되지_않은_세션_사이에서_유일() {
        // given
        Session first = sessions.createSession(token, "dev", template.getId());

        // when & then
        assertKind(() -> sessions.createSession(token, "dev", template.getId()), ErrorKind.CONFLICT);

        sessions.deleteSession(token, first.getId());
        Session reused = sessions.createSession(token, "dev", template.getId());
        assertThat(reused.getState()).isEqualTo(SessionState.CREATED);
        assertThat(sessions.listSessions(token)).extracting(Session::getId).containsExactly(reused.getId());
    }

    @Test
    @DisplayName("세션 이름은 대소문자를 구분하지 않고 비교한다")
    void 세션_이름은_대소문자를_구분하지_않음() {
        // given
        sessions.createSession(token, "dev", template.getId());

        // when & then
        assertKind(() -> sessions.createSession(token, "DEV", template.getId()), ErrorKind.CONFLICT);
        assertKind(() -> sessions.createSession(token, " Dev ", template.getId()), ErrorKind.CONFLICT);
        assertThat(sessions.listSessions(token)).extracting(Session::getName).containsExactly("dev");
    }

    @Test
    void 시작_정지_재시작시_이벤트가_순서대로_기록됨() {
        // given
        Session session = sessions.createSession(token, "dev", template.getId());

        // when
        Session started = sessions.startSession(token, session.getId());
        Session stopped = sessions.stopSession(token, session.getId());
        Session restarted = sessions.restartSession(token, session.getId());

        // then
        assertThat(started.getState()).isEqualTo(SessionState.RUNNING);
        assertThat(started.getLastStartedAt()).isEqualTo(clock.instant());
        assertThat(stopped.getState()).isEqualTo(SessionState.SLEEPING);
        assertThat(restarted.getState()).isEqualTo(SessionState.RUNNING);

        List<SessionEvent> events = sessions.listSessionEvents(token, session.getId());
        assertThat(events).extracting(SessionEvent::getState).containsExactly(
            SessionState.CREATED,
            SessionState.STARTING, SessionState.RUNNING,
            SessionState.STOPPING, SessionState.SLEEPING,
            SessionState.STARTING, SessionState.RUNNING);
        assertThat(events.subList(5, 7))
            .allSatisfy(e -> assertThat(e.getDetails()).containsEntry("reason", "restart"));
    }

    @Test
    void 실행_중_재시작은_재운_뒤_다시_시작() {
        // given
        Session session = sessions.createSession(token, "dev", template.getId());
        sessions.startSession(token, session.getId());

        // when
        sessions.restartSession(token, session.getId());

        // then
        List<SessionEvent> restartEvents = sessions.listSessionEvents(token, session.getId()).stream()
            .filter(e -> "restart".equals(e.getDetails().get("reason")))
            .toList();
        assertThat(restartEvents).extracting(SessionEvent::getState).containsExactly(
            SessionState.STOPPING, SessionState.SLEEPING, SessionState.STARTING, SessionState.RUNNING);
    }

    @Test
    void 허용되지_않는_전이는_CONFLICT() {
        // given
        Session session = sessions.createSession(token, "dev", template.getId());

        // when & then
        assertKind(() -> sessions.stopSession(token, session.getId()), ErrorKind.CONFLICT);
        sessions.startSession(token, session.getId());
        assertKind(() -> sessions.startSession(token, session.getId()), ErrorKind.CONFLICT);
    }

    @Test
    void FREE_플랜은_실행_세션_3개까지() {
        // given
        for (int i = 0; i < 3; i++) {
            Session session = sessions.createSession(token, "dev-" + i, template.getId());
            sessions.startSession(token, session.getId());
        }
        Session fourth = sessions.createSession(token, "dev-3", template.getId());

        // when & then
        assertKind(() -> sessions.startSession(token, fourth.getId()), ErrorKind.CONFLICT);
        assertThat(sessions.getSession(token, fourth.getId()).session().getState()).isEqualTo(SessionState.CREATED);
    }

    @Test
    void 시작하면_런타임_사용량_기록() {
        // given
        Session session = sessions.createSession(token, "dev", template.getId());

        // when
        sessions.startSession(token, session.getId());

        // then
        assertThat(controlPlane.usage().getUsage(token).usage().runtimeMinutes()).isEqualTo(1);
    }

    @Test
    void 삭제된_세션은_조회되지_않음() {
        // given
        Session session = sessions.createSession(token, "dev", template.getId());

        // when
        Session deleted = sessions.deleteSession(token, session.getId());

        // then
        assertThat(deleted.getState()).isEqualTo(SessionState.DELETED);
        assertThat(sessions.listSessions(token)).isEmpty();
        assertKind(() -> sessions.deleteSession(token, session.getId()), ErrorKind.NOT_FOUND);
    }

    // ============================================================
    // 스냅샷 복원
    // ============================================================

    @Test
    void 내용이_없는_스냅샷은_복원_불가() {
        // given
        Session session = sessions.createSession(token, "dev", template.getId());
        Snapshot snapshot = controlPlane.uploads().createSnapshot(token, session.getId(), "before");

        // when & then
        assertKind(() -> sessions.restoreSnapshot(token, session.getId(), snapshot.getId()), ErrorKind.CONFLICT);
    }

    @Test
    void 다른_세션의_스냅샷은_복원_불가() {
        // given
        Session owner = sessions.createSession(token, "dev", template.getId());
        Session other = sessions.createSession(token, "other", template.getId());
        Snapshot snapshot = uploadedSnapshot(owner);

        // when & then
        assertKind(() -> sessions.restoreSnapshot(token, other.getId(), snapshot.getId()), ErrorKind.CONFLICT);
        assertKind(() -> sessions.restoreSnapshot(token, other.getId(), "snap_missing"), ErrorKind.NOT_FOUND);
    }

    @Test
    void 스냅샷_복원은_세션에_기록됨() {
        // given
        Session session = sessions.createSession(token, "dev", template.getId());
        Snapshot snapshot = uploadedSnapshot(session);

        // when
        Session restored = sessions.restoreSnapshot(token, session.getId(), snapshot.getId());

        // then
        assertThat(restored.getLastRestoredSnapshotId()).isEqualTo(snapshot.getId());
        SessionDetail detail = sessions.getSession(token, session.getId());
        assertThat(detail.snapshots()).extracting(Snapshot::getId).containsExactly(snapshot.getId());
        assertThat(detail.events()).last()
            .satisfies(e -> assertThat(e.getDetails()).containsEntry("snapshotId", snapshot.getId()));
    }

    private Snapshot uploadedSnapshot(Session session) {
        Snapshot snapshot = controlPlane.uploads().createSnapshot(token, session.getId(), "before");
        return controlPlane.uploads().uploadSnapshotContent(token, snapshot.getId(),
            "files".getBytes(StandardCharsets.UTF_8), "application/octet-stream");
    }

    // ============================================================
    // 런타임 토큰
    // ============================================================

    @Test
    void 런타임_토큰은_실행_중_세션에만_발급() {
        // given
        Session session = sessions.createSession(token, "dev", template.getId());

        // when & then
        assertKind(() -> sessions.issueRuntimeToken(token, session.getId()), ErrorKind.CONFLICT);

        sessions.startSession(token, session.getId());
        AuthToken runtime = sessions.issueRuntimeToken(token, session.getId());
        assertThat(runtime.getKind()).isEqualTo(TokenKind.RUNTIME);
        assertThat(runtime.getSessionId()).isEqualTo(session.getId());
        assertThat(sessions.requireRuntimeToken(runtime.getToken(), session.getId()).getId())
            .isEqualTo(session.getId());
    }

    @Test
    void 런타임_토큰_발급은_감사_로그에_기록됨() {
        // given
        Session session = sessions.createSession(token, "dev", template.getId());
        sessions.startSession(token, session.getId());

        // when
        AuthToken runtime = sessions.issueRuntimeToken(token, session.getId());

        // then
        AuditLog latest = controlPlane.usage().getAudit(token, 1).get(0);
        assertThat(latest.getAction()).isEqualTo("session.runtime_token_issued");
        assertThat(latest.getTargetId()).isEqualTo(session.getId());
        assertThat(latest.getDetails()).containsEntry("expiresAt", runtime.getExpiresAt().toString());
        assertThat(latest.getDetails().values()).doesNotContain(runtime.getToken());
    }

    @Test
    void 런타임_토큰_검증_실패_유형() {
        // given
        Session session = sessions.createSession(token, "dev", template.getId());
        Session other = sessions.createSession(token, "other", template.getId());
        sessions.startSession(token, session.getId());
        String runtime = sessions.issueRuntimeToken(token, session.getId()).getToken();

        // when & then
        assertKind(() -> sessions.requireRuntimeToken(token, session.getId()), ErrorKind.UNAUTHORIZED);
        assertKind(() -> sessions.requireRuntimeToken(runtime, other.getId()), ErrorKind.FORBIDDEN);

        sessions.stopSession(token, session.getId());
        assertKind(() -> sessions.requireRuntimeToken(runtime, session.getId()), ErrorKind.CONFLICT);
    }

    @Test
    void 런타임_토큰은_일반_API에_사용할_수_없음() {
        // given
        Session session = sessions.createSession(token, "dev", template.getId());
        sessions.startSession(token, session.getId());
        String runtime = sessions.issueRuntimeToken(token, session.getId()).getToken();

        // when & then
        assertKind(() -> sessions.listSessions(runtime), ErrorKind.UNAUTHORIZED);
    }

    @Test
    void 세션_삭제시_런타임_토큰_폐기() {
        // given
        Session session = sessions.createSession(token, "dev", template.getId());
        sessions.startSession(token, session.getId());
        String runtime = sessions.issueRuntimeToken(token, session.getId()).getToken();

        // when
        sessions.deleteSession(token, session.getId());

        // then
        assertKind(() -> sessions.requireRuntimeToken(runtime, session.getId()), ErrorKind.UNAUTHORIZED);
    }

    @Test
    void 런타임_토큰은_15분_후_만료() {
        // given
        Session session = sessions.createSession(token, "dev", template.getId());
        sessions.startSession(token, session.getId());
        String runtime = sessions.issueRuntimeToken(token, session.getId()).getToken();

        // when
        clock.advance(Duration.ofMinutes(16));

        // then
        assertKind(() -> sessions.requireRuntimeToken(runtime, session.getId()), ErrorKind.UNAUTHORIZED);
    }

    @Test
    @DisplayName("런타임 토큰으로 워크스페이스 시크릿 값을 읽을 수 있다")
    void 런타임_토큰으로_시크릿_조회() {
        // given
        controlPlane.workspaces().setWorkspaceSecret(token, "npm_token", "s3cr3t");
        controlPlane.workspaces().setWorkspaceSecret(token, "API_KEY", "key");
        Session session = sessions.createSession(token, "dev", template.getId());
        sessions.startSession(token, session.getId());
        String runtime = sessions.issueRuntimeToken(token, session.getId()).getToken();

        // when
        Map<String, String> secrets = sessions.getRuntimeSecrets(runtime, session.getId());

        // then
        assertThat(secrets).containsExactly(Map.entry("API_KEY", "key"), Map.entry("NPM_TOKEN", "s3cr3t"));
        assertKind(() -> sessions.getRuntimeSecrets(token, session.getId()), ErrorKind.UNAUTHORIZED);

        sessions.stopSession(token, session.getId());
        assertKind(() -> sessions.getRuntimeSecrets(runtime, session.getId()), ErrorKind.CONFLICT);
    }

    @Test
    void 다른_워크스페이스의_시크릿은_주입되지_않음() {
        // given
        String stranger = register("stranger@example.com").tokenValue();
        controlPlane.workspaces().setWorkspaceSecret(stranger, "OTHER", "value");
        Session session = sessions.createSession(token, "dev", template.getId());
        sessions.startSession(token, session.getId());
        String runtime = sessions.issueRuntimeToken(token, session.getId()).getToken();

        // when & then
        assertThat(sessions.getRuntimeSecrets(runtime, session.getId())).isEmpty();
    }
}
