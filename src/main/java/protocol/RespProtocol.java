package protocol;

import model.CommandRequest;
import model.Reply;
import org.apache.commons.io.output.ByteArrayOutputStream;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Redis RESP 프로토콜 파싱 및 응답 생성을 담당하는 클래스
 */
public class RespProtocol {

    public static final byte[] CRLF = {'\r', '\n'};
    public static final byte[] NULL_BULK_STRING = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    static final int MAX_LINE_LENGTH = 64;
    static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    static final int MAX_ARRAY_LENGTH = 1024 * 1024;

    /**
     * 버퍼에서 완성된 프레임 하나를 디코딩한 결과
     *
     * @param request  디코딩된 명령어
     * @param consumed 프레임이 차지한 바이트 수
     */
    public record Frame(CommandRequest request, int consumed) {
    }

    private RespProtocol() {
    }

    /**
     * buf[offset, limit) 구간에서 명령어 프레임 하나를 파싱합니다.
     *
     * @return 완성된 프레임, 데이터가 부족하면 null
     * @throws ProtocolException 프레임 형식이 잘못된 경우
     */
    public static Frame parseCommand(byte[] buf, int offset, int limit) throws ProtocolException {
        if (offset >= limit) {
            return null;
        }
        if (buf[offset] != '*') {
            throw new ProtocolException("expected '*', got '" + printable(buf[offset]) + "'");
        }

        int[] cursor = {offset + 1};
        Long arrayLength = readLength(buf, cursor, limit);
        if (arrayLength == null) {
            return null;
        }
        if (arrayLength == -1) {
            throw new ProtocolException("null array is not a command");
        }
        if (arrayLength == 0) {
            throw new ProtocolException("empty array is not a command");
        }
        if (arrayLength < 0 || arrayLength > MAX_ARRAY_LENGTH) {
            throw new ProtocolException("invalid multibulk length");
        }

        List<byte[]> parts = new ArrayList<>((int) Math.min(arrayLength, 16));
        for (int i = 0; i < arrayLength; i++) {
            if (cursor[0] >= limit) {
                return null;
            }
            if (buf[cursor[0]] != '$') {
                throw new ProtocolException("expected '$', got '" + printable(buf[cursor[0]]) + "'");
            }
            cursor[0]++;
            Long bulkLength = readLength(buf, cursor, limit);
            if (bulkLength == null) {
                return null;
            }
            if (bulkLength < 0 || bulkLength > MAX_BULK_LENGTH) {
                throw new ProtocolException("invalid bulk length");
            }

            int start = cursor[0];
            int length = (int) (long) bulkLength;
            if ((long) start + length + CRLF.length > limit) {
                return null;
            }
            if (buf[start + length] != '\r' || buf[start + length + 1] != '\n') {
                throw new ProtocolException("bulk string length does not match its content");
            }
            parts.add(Arrays.copyOfRange(buf, start, start + length));
            cursor[0] = start + length + CRLF.length;
        }

        String name = new String(parts.get(0), StandardCharsets.UTF_8);
        CommandRequest request = new CommandRequest(name, parts.subList(1, parts.size()));
        return new Frame(request, cursor[0] - offset);
    }

    /**
     * CRLF로 끝나는 정수 줄을 읽습니다. 완성되지 않았으면 null을 반환합니다.
     */
    private static Long readLength(byte[] buf, int[] cursor, int limit) throws ProtocolException {
        int start = cursor[0];
        int end = Math.min(limit, start + MAX_LINE_LENGTH);
        int cr = -1;
        for (int i = start; i < end; i++) {
            if (buf[i] == '\r') {
                cr = i;
                break;
            }
            if (buf[i] == '\n') {
                throw new ProtocolException("unexpected LF in length prefix");
            }
        }
        if (cr == -1) {
            if (end - start >= MAX_LINE_LENGTH) {
                throw new ProtocolException("length prefix too long");
            }
            return null;
        }
        if (cr + 1 >= limit) {
            return null;
        }
        if (buf[cr + 1] != '\n') {
            throw new ProtocolException("missing LF after CR");
        }

        long value = parseDecimal(buf, start, cr);
        cursor[0] = cr + CRLF.length;
        return value;
    }

    private static long parseDecimal(byte[] buf, int from, int to) throws ProtocolException {
        Long value = parseInteger(buf, from, to);
        if (value == null) {
            throw new ProtocolException("invalid length '" + new String(buf, from, to - from, StandardCharsets.US_ASCII) + "'");
        }
        return value;
    }

    /**
     * ASCII 십진수(선택적으로 앞에 '-')를 long으로 파싱합니다.
     *
     * @return 파싱한 값, 형식이 잘못됐거나 long 범위를 벗어나면 null
     */
    public static Long parseInteger(byte[] buf, int from, int to) {
        boolean negative = from < to && buf[from] == '-';
        int i = negative ? from + 1 : from;
        if (i == to || to - i > 19) {
            return null;
        }
        // 음수 쪽으로 누적해야 Long.MIN_VALUE까지 표현 가능
        long value = 0;
        for (; i < to; i++) {
            byte b = buf[i];
            if (b < '0' || b > '9') {
                return null;
            }
            if (value < Long.MIN_VALUE / 10) {
                return null;
            }
            long next = value * 10 - (b - '0');
            if (next > value) {
                return null;
            }
            value = next;
        }
        if (!negative) {
            if (value == Long.MIN_VALUE) {
                return null;
            }
            return -value;
        }
        return value;
    }

    public static Long parseInteger(byte[] value) {
        return parseInteger(value, 0, value.length);
    }

    private static String printable(byte b) {
        if (b >= 0x20 && b < 0x7f) {
            return String.valueOf((char) b);
        }
        return String.format("\\x%02x", b & 0xff);
    }

    /**
     * 응답을 RESP 형식의 바이트 배열로 인코딩합니다.
     */
    public static byte[] encode(Reply reply) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            writeReply(reply, out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * 응답을 RESP 형식으로 스트림에 기록합니다.
     */
    public static void writeReply(Reply reply, OutputStream out) throws IOException {
        switch (reply.getType()) {
            case SIMPLE_STRING:
                writeLine(out, '+', reply.getData());
                break;
            case ERROR:
                writeLine(out, '-', reply.getData());
                break;
            case INTEGER:
                writeLine(out, ':', Long.toString(reply.getInteger()).getBytes(StandardCharsets.US_ASCII));
                break;
            case BULK_STRING:
                writeBulkString(out, reply.getData());
                break;
            case NULL_BULK_STRING:
                out.write(NULL_BULK_STRING);
                break;
            case ARRAY:
                writeLine(out, '*', Integer.toString(reply.getElements().size()).getBytes(StandardCharsets.US_ASCII));
                for (Reply element : reply.getElements()) {
                    writeReply(element, out);
                }
                break;
            default:
                throw new IllegalStateException("Unsupported reply type: " + reply.getType());
        }
    }

    /**
     * bulk string 배열로 이루어진 명령어 프레임을 생성합니다.
     */
    public static byte[] createRespArray(byte[]... elements) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            writeLine(out, '*', Integer.toString(elements.length).getBytes(StandardCharsets.US_ASCII));
            for (byte[] element : elements) {
                writeBulkString(out, element);
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * 문자열 인자로 명령어 프레임을 생성합니다.
     */
    public static byte[] createRespArray(String... elements) {
        byte[][] parts = new byte[elements.length][];
        for (int i = 0; i < elements.length; i++) {
            parts[i] = elements[i].getBytes(StandardCharsets.UTF_8);
        }
        return createRespArray(parts);
    }

    private static void writeBulkString(OutputStream out, byte[] value) throws IOException {
        writeLine(out, '$', Integer.toString(value.length).getBytes(StandardCharsets.US_ASCII));
        out.write(value);
        out.write(CRLF);
    }

    private static void writeLine(OutputStream out, char prefix, byte[] content) throws IOException {
        out.write(prefix);
        out.write(content);
        out.write(CRLF);
    }
}
