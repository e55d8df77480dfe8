package com.ryuqq.controlplane.application.identity;

import com.ryuqq.controlplane.application.ledger.UsageSummary;
import com.ryuqq.controlplane.core.model.Limits;
import com.ryuqq.controlplane.core.model.MemberRole;
import com.ryuqq.controlplane.core.model.User;

/**
 * {@code authenticate} 결과.
 *
 * @param user 사용자
 * @param workspace 워크스페이스 요약
 * @param role 호출자 역할
 * @param usage 사용량 합계
 * @param limits 실효 한도
 * @param pendingDeviceCodes 승인 대기 중인 디바이스 코드 수
 * @author Control Plane Team
 * @since 1.0.0
 */
public record AuthView(
    User user,
    WorkspaceView workspace,
    MemberRole role,
    UsageSummary usage,
    Limits limits,
    long pendingDeviceCodes
) {
}
