package com.ryuqq.controlplane.core.builder;

import com.ryuqq.controlplane.core.outcome.BuildOutcome;

/**
 * 템플릿 이미지 빌더 SPI.
 *
 * <p>빌드 파이프라인이 트랜잭션 안에서 호출하므로 구현체는 순수하고 빠르게
 * 끝나야 합니다. 실제 이미지 빌드가 필요한 경우 결과를 기록만 하고
 * 외부 시스템에 위임합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>빌드 실패는 {@link com.ryuqq.controlplane.core.outcome.BuildFailed}로 반환 (예외 금지)</li>
 *   <li>예외가 발생하면 파이프라인이 BuildFailed로 변환</li>
 * </ul>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TemplateBuilder {

    /**
     * 빌드 실행.
     *
     * @param request 빌드 입력
     * @return 빌드 결과
     */
    BuildOutcome build(BuildRequest request);
}
