package com.ryuqq.controlplane.application.template;

import java.util.List;

/**
 * dead-letter 일괄 재시도 결과.
 *
 * @param recovered RETRYING으로 되돌린 빌드 수
 * @param buildIds 되돌린 빌드 ID (처리 순서)
 */
public record BulkRetryResult(int recovered, List<String> buildIds) {

    public BulkRetryResult {
        buildIds = List.copyOf(buildIds);
    }
}
