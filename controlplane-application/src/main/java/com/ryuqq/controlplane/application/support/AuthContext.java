package com.ryuqq.controlplane.application.support;

import com.ryuqq.controlplane.core.model.AuthToken;
import com.ryuqq.controlplane.core.model.MemberRole;
import com.ryuqq.controlplane.core.model.Membership;
import com.ryuqq.controlplane.core.model.User;
import com.ryuqq.controlplane.core.model.Workspace;

/**
 * 인증된 호출자 컨텍스트 (트랜잭션 draft 안의 엔티티 참조).
 *
 * @param user 사용자
 * @param workspace 토큰이 가리키는 워크스페이스
 * @param membership 워크스페이스 멤버십
 * @param token 사용된 토큰
 * @author Control Plane Team
 * @since 1.0.0
 */
public record AuthContext(
    User user,
    Workspace workspace,
    Membership membership,
    AuthToken token
) {

    public MemberRole role() {
        return membership.getRole();
    }

    public String userId() {
        return user.getId();
    }

    public String workspaceId() {
        return workspace.getId();
    }
}
