package com.ryuqq.controlplane.application;

import com.ryuqq.controlplane.adapter.inmemory.dispatch.InMemoryJobDispatcher;
import com.ryuqq.controlplane.adapter.inmemory.store.InMemoryBackingStore;
import com.ryuqq.controlplane.adapter.inmemory.store.InMemoryObjectStore;
import com.ryuqq.controlplane.application.identity.AuthResult;
import com.ryuqq.controlplane.application.template.VersionCreated;
import com.ryuqq.controlplane.core.config.ControlPlaneConfig;
import com.ryuqq.controlplane.core.error.ControlPlaneException;
import com.ryuqq.controlplane.core.error.ErrorKind;
import com.ryuqq.controlplane.core.model.Manifest;
import com.ryuqq.controlplane.core.model.Template;
import com.ryuqq.controlplane.testkit.fixture.FakeCredentialVerifier;
import com.ryuqq.controlplane.testkit.fixture.MutableClock;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * in-memory 어댑터로 조립한 {@link ControlPlane} 위에서 동작하는 시나리오 테스트 기반 클래스.
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public abstract class ControlPlaneTestSupport {

    protected MutableClock clock;
    protected InMemoryBackingStore backingStore;
    protected InMemoryObjectStore objectStore;
    protected InMemoryJobDispatcher dispatcher;
    protected ControlPlane controlPlane;

    @BeforeEach
    void setUpControlPlane() {
        clock = MutableClock.startingAtEpochOf2024();
        backingStore = new InMemoryBackingStore();
        objectStore = new InMemoryObjectStore();
        dispatcher = new InMemoryJobDispatcher();
        controlPlane = ControlPlane.builder()
            .backingStore(backingStore)
            .objectStore(objectStore)
            .jobDispatcher(dispatcher)
            .credentialVerifier(new FakeCredentialVerifier())
            .clock(clock)
            .config(config())
            .build();
    }

    @AfterEach
    void tearDownControlPlane() {
        controlPlane.close();
    }

    /**
     * 테스트별 설정 재정의 지점.
     */
    protected ControlPlaneConfig config() {
        return new ControlPlaneConfig();
    }

    // ============================================================
    // 시나리오 헬퍼
    // ============================================================

    protected AuthResult register(String email) {
        return controlPlane.identity().registerUser(email, null);
    }

    protected static Manifest manifest(String... features) {
        Manifest manifest = new Manifest();
        manifest.setImage("registry.example.com/devbox/node:20");
        manifest.setFeatures(List.of(features));
        manifest.setPersistedPaths(List.of("/workspace"));
        return manifest;
    }

    protected static Manifest failingManifest() {
        Manifest manifest = manifest("ssh");
        manifest.setSimulateFailure(true);
        return manifest;
    }

    /**
     * 템플릿 생성 → 버전 추가 → 빌드 → 승격까지 진행한 템플릿.
     */
    protected Template readyTemplate(String token, String name) {
        Template template = controlPlane.templates().createTemplate(token, name, "");
        VersionCreated created = controlPlane.templates()
            .addTemplateVersion(token, template.getId(), "1.0.0", manifest("ssh"), "");
        controlPlane.templates().processTemplateBuilds(token);
        return controlPlane.templates()
            .promoteTemplateVersion(token, template.getId(), created.version().getId())
            .template();
    }

    protected static void assertKind(ThrowingCallable call, ErrorKind kind) {
        assertThatThrownBy(call)
            .isInstanceOfSatisfying(ControlPlaneException.class, e -> {
                if (e.kind() != kind) {
                    throw new AssertionError("Expected " + kind + " but was " + e.kind() + ": " + e.getMessage());
                }
            });
    }
}
