package com.ryuqq.controlplane.core.spi;

import java.util.Arrays;
import java.util.Objects;

/**
 * ObjectStore에서 읽은 객체.
 *
 * @param body 본문
 * @param contentType 콘텐츠 타입
 * @author Control Plane Team
 * @since 1.0.0
 */
public record StoredObject(byte[] body, String contentType) {

    public StoredObject {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        body = body.clone();
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    public int size() {
        return body.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StoredObject other)) {
            return false;
        }
        return Arrays.equals(body, other.body) && Objects.equals(contentType, other.contentType);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(body) + Objects.hashCode(contentType);
    }

    @Override
    public String toString() {
        return "StoredObject[bytes=" + body.length + ", contentType=" + contentType + "]";
    }
}
