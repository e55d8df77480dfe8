package com.ryuqq.controlplane.application.identity;

import com.ryuqq.controlplane.core.model.MemberRole;
import com.ryuqq.controlplane.core.model.Workspace;

/**
 * 호출자 관점의 워크스페이스 요약.
 *
 * @param workspace 워크스페이스
 * @param role 호출자 역할
 * @param memberCount 멤버 수
 * @author Control Plane Team
 * @since 1.0.0
 */
public record WorkspaceView(Workspace workspace, MemberRole role, long memberCount) {
}
