package com.ryuqq.controlplane.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 워크스페이스 멤버 역할.
 *
 * <p><strong>권한:</strong></p>
 * <ul>
 *   <li>관리(manage): OWNER, ADMIN</li>
 *   <li>쓰기(write): OWNER, ADMIN, MEMBER</li>
 *   <li>VIEWER는 읽기만 가능</li>
 * </ul>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public enum MemberRole {

    OWNER("owner"),
    ADMIN("admin"),
    MEMBER("member"),
    VIEWER("viewer");

    private final String wireName;

    MemberRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean canManage() {
        return this == OWNER || this == ADMIN;
    }

    public boolean canWrite() {
        return this != VIEWER;
    }

    /**
     * 이름으로 역할 조회 (대소문자 무시).
     *
     * @param value 역할 이름
     * @return 일치하는 역할, 없으면 null
     */
    public static MemberRole fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (MemberRole role : values()) {
            if (role.wireName.equalsIgnoreCase(value.trim())) {
                return role;
            }
        }
        return null;
    }
}
