package com.ryuqq.controlplane.core.spi;

/**
 * 백엔드 저장소 인프라 오류 (I/O, SQL).
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class BackingStoreException extends RuntimeException {

    public BackingStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
