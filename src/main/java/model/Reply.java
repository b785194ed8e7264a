package model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 명령어 실행 결과. RespProtocol이 와이어 형식으로 인코딩합니다.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Reply {

    public enum Type {
        SIMPLE_STRING, ERROR, INTEGER, BULK_STRING, NULL_BULK_STRING, ARRAY
    }

    public static final Reply OK = simpleString("OK");
    public static final Reply PONG = simpleString("PONG");
    public static final Reply NULL_BULK = new Reply(Type.NULL_BULK_STRING, null, 0, null);

    private final Type type;
    private final byte[] data;
    private final long integer;
    private final List<Reply> elements;

    public static Reply simpleString(String value) {
        return new Reply(Type.SIMPLE_STRING, lineSafe(value), 0, null);
    }

    public static Reply error(String message) {
        return new Reply(Type.ERROR, lineSafe(message), 0, null);
    }

    /**
     * 한 줄짜리 응답에 들어갈 수 없는 제어 문자(CR, LF 포함)는 공백으로 바꿉니다.
     */
    private static byte[] lineSafe(String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < bytes.length; i++) {
            if ((bytes[i] >= 0 && bytes[i] < 0x20) || bytes[i] == 0x7f) {
                bytes[i] = ' ';
            }
        }
        return bytes;
    }

    public static Reply integer(long value) {
        return new Reply(Type.INTEGER, null, value, null);
    }

    public static Reply bulkString(byte[] value) {
        if (value == null) {
            return NULL_BULK;
        }
        return new Reply(Type.BULK_STRING, value, 0, null);
    }

    public static Reply array(List<Reply> elements) {
        return new Reply(Type.ARRAY, null, 0, List.copyOf(elements));
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    @Override
    public String toString() {
        switch (type) {
            case INTEGER:
                return ":" + integer;
            case NULL_BULK_STRING:
                return "(nil)";
            case ARRAY:
                return elements.toString();
            default:
                return type.name() + "(" + new String(data, StandardCharsets.UTF_8) + ")";
        }
    }
}
