package com.ryuqq.controlplane.core.spi;

/**
 * ObjectStore에 저장되는 객체 종류.
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public enum ObjectKind {
    BUNDLE,
    SNAPSHOT,
    BUILD_LOG,
    BUILD_ARTIFACT
}
