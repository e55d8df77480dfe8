package com.ryuqq.controlplane.application;

import com.ryuqq.controlplane.application.identity.IdentityService;
import com.ryuqq.controlplane.application.identity.WorkspaceService;
import com.ryuqq.controlplane.application.ledger.UsageService;
import com.ryuqq.controlplane.application.reconcile.ReconcileService;
import com.ryuqq.controlplane.application.session.SessionService;
import com.ryuqq.controlplane.application.template.BuildPipeline;
import com.ryuqq.controlplane.application.template.ManifestTemplateBuilder;
import com.ryuqq.controlplane.application.template.TemplateService;
import com.ryuqq.controlplane.application.upload.UploadService;
import com.ryuqq.controlplane.core.builder.TemplateBuilder;
import com.ryuqq.controlplane.core.config.ControlPlaneConfig;
import com.ryuqq.controlplane.core.spi.BackingStore;
import com.ryuqq.controlplane.core.spi.CredentialVerifier;
import com.ryuqq.controlplane.core.spi.JobDispatcher;
import com.ryuqq.controlplane.core.spi.ObjectStore;
import com.ryuqq.controlplane.core.store.StateStore;

import java.time.Clock;

/**
 * 컨트롤 플레인 진입점.
 *
 * <p>하나의 {@link StateStore}(단일 writer)를 모든 서비스가 공유합니다.
 * 어댑터(백킹 스토어, 오브젝트 스토어, 디스패처, 자격 증명 검증기)는 {@link Builder}로 주입합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (ControlPlane controlPlane = ControlPlane.builder()
 *         .backingStore(new InMemoryBackingStore())
 *         .objectStore(new InMemoryObjectStore())
 *         .jobDispatcher(new InMemoryJobDispatcher())
 *         .credentialVerifier(verifier)
 *         .build()) {
 *     AuthResult auth = controlPlane.identity().registerUser("dev@example.com", null);
 * }
 * </pre>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class ControlPlane implements AutoCloseable {

    private final StateStore stateStore;
    private final IdentityService identity;
    private final WorkspaceService workspaces;
    private final TemplateService templates;
    private final SessionService sessions;
    private final UploadService uploads;
    private final ReconcileService reconcile;
    private final UsageService usage;

    private ControlPlane(Builder builder) {
        this.stateStore = new StateStore(builder.backingStore);
        BuildPipeline pipeline = new BuildPipeline(builder.templateBuilder, builder.objectStore, builder.config);
        this.identity = new IdentityService(stateStore, builder.clock, builder.config, builder.credentialVerifier);
        this.workspaces = new WorkspaceService(stateStore, builder.clock, builder.config);
        this.templates = new TemplateService(stateStore, builder.clock, pipeline, builder.objectStore,
            builder.jobDispatcher);
        this.sessions = new SessionService(stateStore, builder.clock, builder.config);
        this.uploads = new UploadService(stateStore, builder.clock, builder.config, builder.objectStore);
        this.reconcile = new ReconcileService(stateStore, builder.clock, builder.config, pipeline,
            builder.objectStore, builder.jobDispatcher);
        this.usage = new UsageService(stateStore, builder.clock, builder.config);
    }

    public static Builder builder() {
        return new Builder();
    }

    public IdentityService identity() {
        return identity;
    }

    public WorkspaceService workspaces() {
        return workspaces;
    }

    public TemplateService templates() {
        return templates;
    }

    public SessionService sessions() {
        return sessions;
    }

    public UploadService uploads() {
        return uploads;
    }

    public ReconcileService reconcile() {
        return reconcile;
    }

    public UsageService usage() {
        return usage;
    }

    public StateStore stateStore() {
        return stateStore;
    }

    @Override
    public void close() {
        stateStore.close();
    }

    /**
     * {@link ControlPlane} 빌더.
     *
     * <p>clock, config, templateBuilder는 기본값이 있고 나머지는 필수입니다.</p>
     */
    public static final class Builder {

        private BackingStore backingStore;
        private ObjectStore objectStore;
        private JobDispatcher jobDispatcher;
        private CredentialVerifier credentialVerifier;
        private TemplateBuilder templateBuilder = new ManifestTemplateBuilder();
        private Clock clock = Clock.systemUTC();
        private ControlPlaneConfig config = new ControlPlaneConfig();

        private Builder() {
        }

        public Builder backingStore(BackingStore backingStore) {
            this.backingStore = backingStore;
            return this;
        }

        public Builder objectStore(ObjectStore objectStore) {
            this.objectStore = objectStore;
            return this;
        }

        public Builder jobDispatcher(JobDispatcher jobDispatcher) {
            this.jobDispatcher = jobDispatcher;
            return this;
        }

        public Builder credentialVerifier(CredentialVerifier credentialVerifier) {
            this.credentialVerifier = credentialVerifier;
            return this;
        }

        public Builder templateBuilder(TemplateBuilder templateBuilder) {
            this.templateBuilder = templateBuilder;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder config(ControlPlaneConfig config) {
            this.config = config;
            return this;
        }

        /**
         * @throws IllegalArgumentException 필수 의존성이 없는 경우
         */
        public ControlPlane build() {
            if (backingStore == null) {
                throw new IllegalArgumentException("backingStore cannot be null");
            }
            if (objectStore == null) {
                throw new IllegalArgumentException("objectStore cannot be null");
            }
            if (jobDispatcher == null) {
                throw new IllegalArgumentException("jobDispatcher cannot be null");
            }
            if (credentialVerifier == null) {
                throw new IllegalArgumentException("credentialVerifier cannot be null");
            }
            return new ControlPlane(this);
        }
    }
}
