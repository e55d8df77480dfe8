package com.ryuqq.controlplane.application.identity;

import com.ryuqq.controlplane.core.model.Membership;
import com.ryuqq.controlplane.core.model.WorkspaceInvite;

import java.util.List;

/**
 * 워크스페이스 멤버와 대기 중인 초대.
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public record WorkspaceMembers(List<Membership> members, List<WorkspaceInvite> pendingInvites) {
}
