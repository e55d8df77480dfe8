package com.ryuqq.controlplane.core.spi;

import com.ryuqq.controlplane.core.state.EntityCollection;
import com.ryuqq.controlplane.core.state.StateDocument;

import java.util.Set;

/**
 * 상태 문서 영속화 SPI.
 *
 * <p>{@link com.ryuqq.controlplane.core.store.StateStore}가 트랜잭션마다
 * load → (draft 수정) → save 순서로 호출합니다. 모든 호출은 단일 writer 스레드에서
 * 직렬화되므로 구현체가 별도의 동시성 제어를 할 필요는 없습니다.</p>
 *
 * <p><strong>구현 형태:</strong></p>
 * <ul>
 *   <li>전체 문서 저장소: 매 save마다 문서 전체를 기록</li>
 *   <li>정규화 행 저장소: 컬렉션별 테이블, 변경된 행만 기록 (scope 로드 지원)</li>
 * </ul>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>컬렉션 내 순서 보존: save(load())는 멱등이어야 함</li>
 *   <li>save는 원자적이어야 함 (부분 기록 금지)</li>
 *   <li>인프라 오류는 {@link BackingStoreException}으로 감싸서 던짐</li>
 * </ul>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public interface BackingStore {

    /**
     * 전체 상태 문서를 로드합니다.
     *
     * @return 현재 상태 (저장된 적 없으면 빈 문서)
     * @throws BackingStoreException 로드 실패 시
     */
    StateDocument load();

    /**
     * 일부 컬렉션만 로드할 수 있는지 여부.
     *
     * <p>StateStore 생성 시 한 번만 조회됩니다.</p>
     *
     * @return scope 로드 지원 시 true
     */
    default boolean supportsScopedLoad() {
        return false;
    }

    /**
     * 지정한 컬렉션만 채운 상태 문서를 로드합니다.
     *
     * @param collections 로드할 컬렉션
     * @return 나머지 컬렉션이 비어 있는 상태 문서
     * @throws UnsupportedOperationException scope 로드를 지원하지 않는 경우
     */
    default StateDocument loadCollections(Set<EntityCollection> collections) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not support scoped load");
    }

    /**
     * 변경된 상태를 저장합니다.
     *
     * @param next 새 상태
     * @param previous 트랜잭션 시작 시 로드한 상태 (diff 기준)
     * @param collections next가 권위를 가지는 컬렉션 (scope 밖의 컬렉션은 건드리지 않음)
     * @throws BackingStoreException 저장 실패 시
     */
    void save(StateDocument next, StateDocument previous, Set<EntityCollection> collections);
}
