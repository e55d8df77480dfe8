package com.ryuqq.controlplane.core.spi;

import java.util.Optional;

/**
 * 바이너리 객체 저장소 SPI (번들, 스냅샷, 빌드 로그/산출물).
 *
 * <p>트랜잭션 본문 안에서 호출될 수 있으므로 짧고 경계가 있는 I/O만 수행해야 합니다.
 * 구현체는 스레드 안전해야 합니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public interface ObjectStore {

    /**
     * 객체 저장 (같은 키는 덮어씀).
     *
     * @param target 키
     * @param body 본문
     * @param contentType 콘텐츠 타입
     */
    void put(ObjectTarget target, byte[] body, String contentType);

    /**
     * 객체 조회.
     *
     * @param target 키
     * @return 저장된 객체, 없으면 empty
     */
    Optional<StoredObject> get(ObjectTarget target);

    /**
     * 객체 삭제 (없으면 무시).
     *
     * @param target 키
     */
    void delete(ObjectTarget target);
}
