package com.ryuqq.controlplane.core.store;

import com.ryuqq.controlplane.core.state.StateDocument;

/**
 * 트랜잭션 본문.
 *
 * <p>draft는 이 트랜잭션만 소유하며 자유롭게 수정할 수 있습니다. 예외를 던지면
 * draft는 저장되지 않습니다. 본문 안에서 다른 트랜잭션을 열면 안 됩니다.</p>
 *
 * @param <T> 결과 타입
 * @author Control Plane Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TransactionWork<T> {

    T apply(StateDocument draft);
}
