package com.ryuqq.controlplane.core.outcome;

/**
 * 템플릿 빌드 실행 결과.
 *
 * <ul>
 *   <li>{@link BuildSucceeded}: 이미지 생성 완료</li>
 *   <li>{@link BuildFailed}: 빌드 실패 (재시도 여부는 파이프라인이 결정)</li>
 * </ul>
 *
 * <p>빌드 실패는 예외가 아니라 값으로 표현되며, 파이프라인이 이를 상태 전이로 변환합니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public sealed interface BuildOutcome permits BuildSucceeded, BuildFailed {

    /**
     * 빌드 로그 (ObjectStore에 BUILD_LOG로 저장됨).
     *
     * @return 로그 텍스트
     */
    String log();

    default boolean isSucceeded() {
        return this instanceof BuildSucceeded;
    }
}
