package com.ryuqq.controlplane.application.ledger;

import com.ryuqq.controlplane.core.model.Limits;
import com.ryuqq.controlplane.core.model.Plan;

/**
 * 사용량 조회 결과.
 *
 * @param plan 워크스페이스 플랜
 * @param limits 실효 한도
 * @param usage 사용량 합계
 * @author Control Plane Team
 * @since 1.0.0
 */
public record UsageReport(Plan plan, Limits limits, UsageSummary usage) {
}
