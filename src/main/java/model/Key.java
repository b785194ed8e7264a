package model;

import lombok.EqualsAndHashCode;

import java.nio.charset.StandardCharsets;

/**
 * 바이트 내용으로 비교되는 저장소 키
 */
@EqualsAndHashCode
public final class Key {
    private final byte[] bytes;

    public Key(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Key of(String key) {
        return new Key(key.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
