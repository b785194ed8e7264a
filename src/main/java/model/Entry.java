package model;

/**
 * 저장소에 보관되는 값과 만료 시각(epoch 밀리초, 없으면 null)
 */
public record Entry(byte[] value, Long expiresAtMs) {

    public static Entry persistent(byte[] value) {
        return new Entry(value, null);
    }

    public boolean isExpired(long nowMs) {
        return expiresAtMs != null && expiresAtMs <= nowMs;
    }
}
