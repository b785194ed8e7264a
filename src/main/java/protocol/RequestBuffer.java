package protocol;

import model.CommandRequest;

import java.util.Arrays;

/**
 * 연결별 수신 버퍼. 아직 디코딩되지 않은 바이트를 보관합니다.
 *
 * <p>읽은 바이트를 {@link #append}로 추가하고, {@link #nextCommand()}가 null을 반환할 때까지
 * 반복 호출합니다. 소비되지 않은 바이트는 다음 읽기까지 그대로 유지됩니다.
 */
public class RequestBuffer {

    private static final int INITIAL_CAPACITY = 4096;

    private byte[] buffer;
    private int readIndex;
    private int writeIndex;

    public RequestBuffer() {
        this(INITIAL_CAPACITY);
    }

    public RequestBuffer(int initialCapacity) {
        this.buffer = new byte[initialCapacity];
    }

    public void append(byte[] src, int offset, int length) {
        ensureWritable(length);
        System.arraycopy(src, offset, buffer, writeIndex, length);
        writeIndex += length;
    }

    public void append(byte[] src) {
        append(src, 0, src.length);
    }

    /**
     * 완성된 다음 명령어를 디코딩합니다.
     *
     * @return 명령어, 프레임이 아직 완성되지 않았으면 null
     */
    public CommandRequest nextCommand() throws ProtocolException {
        RespProtocol.Frame frame = RespProtocol.parseCommand(buffer, readIndex, writeIndex);
        if (frame == null) {
            return null;
        }
        readIndex += frame.consumed();
        if (readIndex == writeIndex) {
            readIndex = 0;
            writeIndex = 0;
        }
        return frame.request();
    }

    public int readableBytes() {
        return writeIndex - readIndex;
    }

    private void ensureWritable(int length) {
        if (buffer.length - writeIndex >= length) {
            return;
        }
        int readable = readableBytes();
        if (readIndex > 0) {
            // compact
            System.arraycopy(buffer, readIndex, buffer, 0, readable);
            readIndex = 0;
            writeIndex = readable;
        }
        if (buffer.length - writeIndex < length) {
            int required = readable + length;
            int newCapacity = Math.max(buffer.length * 2, required);
            buffer = Arrays.copyOf(buffer, newCapacity);
        }
    }
}
