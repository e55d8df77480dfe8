package com.ryuqq.controlplane.application.identity;

import com.ryuqq.controlplane.core.model.WorkspaceSecret;

import java.time.Instant;

/**
 * 값이 제거된 시크릿 요약.
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public record WorkspaceSecretView(String name, Instant createdAt, Instant updatedAt) {

    static WorkspaceSecretView of(WorkspaceSecret secret) {
        return new WorkspaceSecretView(secret.getName(), secret.getCreatedAt(), secret.getUpdatedAt());
    }
}
