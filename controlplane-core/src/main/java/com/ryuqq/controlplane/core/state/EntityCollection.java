package com.ryuqq.controlplane.core.state;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 상태 문서의 엔티티 컬렉션 목록.
 *
 * <p>{@link #fieldName()}은 {@link StateDocument}의 JSON 필드명이며,
 * 정규화 저장소에서는 컬렉션 식별자로 사용됩니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public enum EntityCollection {

    USERS("users"),
    WORKSPACES("workspaces"),
    MEMBERSHIPS("memberships"),
    WORKSPACE_INVITES("workspaceInvites"),
    WORKSPACE_SECRETS("workspaceSecrets"),
    AUTH_TOKENS("authTokens"),
    DEVICE_CODES("deviceCodes"),
    TEMPLATES("templates"),
    TEMPLATE_VERSIONS("templateVersions"),
    TEMPLATE_BUILDS("templateBuilds"),
    BINDING_RELEASES("bindingReleases"),
    SESSIONS("sessions"),
    SESSION_EVENTS("sessionEvents"),
    SNAPSHOTS("snapshots"),
    UPLOAD_GRANTS("uploadGrants"),
    USAGE_EVENTS("usageEvents"),
    AUDIT_LOGS("auditLogs");

    private static final Set<EntityCollection> ALL = Collections.unmodifiableSet(EnumSet.allOf(EntityCollection.class));

    private final String fieldName;

    EntityCollection(String fieldName) {
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }

    public static Set<EntityCollection> all() {
        return ALL;
    }

    /**
     * 주어진 컬렉션들로 불변 scope 생성.
     *
     * @throws IllegalArgumentException 컬렉션이 비어 있는 경우
     */
    public static Set<EntityCollection> scope(EntityCollection first, EntityCollection... rest) {
        if (first == null) {
            throw new IllegalArgumentException("first cannot be null");
        }
        return Collections.unmodifiableSet(EnumSet.of(first, rest));
    }
}
