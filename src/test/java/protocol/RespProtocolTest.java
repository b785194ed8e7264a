package protocol;

import model.CommandRequest;
import model.Reply;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RespProtocolTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static RespProtocol.Frame parse(String input) throws ProtocolException {
        byte[] buf = bytes(input);
        return RespProtocol.parseCommand(buf, 0, buf.length);
    }

    @Test
    void parsesCompleteCommand() throws ProtocolException {
        RespProtocol.Frame frame = parse("*2\r\n$4\r\nECHO\r\n$3\r\nhey\r\n");

        assertNotNull(frame);
        assertEquals(23, frame.consumed());
        assertEquals("ECHO", frame.request().name());
        assertEquals(1, frame.request().args().size());
        assertArrayEquals(bytes("hey"), frame.request().args().get(0));
    }

    @Test
    void returnsNullForEveryIncompletePrefix() throws ProtocolException {
        byte[] full = bytes("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$5\r\nvalue\r\n");
        for (int cut = 0; cut < full.length; cut++) {
            assertNull(RespProtocol.parseCommand(full, 0, cut), "prefix of length " + cut);
        }
        assertEquals(full.length, RespProtocol.parseCommand(full, 0, full.length).consumed());
    }

    @Test
    void decodesOneFrameAtATime() throws ProtocolException {
        byte[] buf = bytes("*1\r\n$4\r\nPING\r\n*1\r\n$4\r\nping\r\n");

        RespProtocol.Frame first = RespProtocol.parseCommand(buf, 0, buf.length);
        RespProtocol.Frame second = RespProtocol.parseCommand(buf, first.consumed(), buf.length);

        assertEquals("PING", first.request().name());
        assertEquals("ping", second.request().name());
        assertEquals(buf.length, first.consumed() + second.consumed());
    }

    @Test
    void bulkStringsAreBinarySafe() throws ProtocolException {
        byte[] payload = {'a', '\r', '\n', 0, (byte) 0xff};
        byte[] frame = RespProtocol.createRespArray(bytes("ECHO"), payload);

        CommandRequest request = RespProtocol.parseCommand(frame, 0, frame.length).request();

        assertArrayEquals(payload, request.args().get(0));
    }

    @Test
    void emptyBulkStringIsAllowed() throws ProtocolException {
        RespProtocol.Frame frame = parse("*2\r\n$4\r\nPING\r\n$0\r\n\r\n");

        assertArrayEquals(new byte[0], frame.request().args().get(0));
    }

    @Test
    void rejectsLengthMismatch() {
        assertThrows(ProtocolException.class, () -> parse("*1\r\n$3\r\nPING\r\n"));
    }

    @Test
    void rejectsNonNumericAndNegativeCounts() {
        assertThrows(ProtocolException.class, () -> parse("*x\r\n"));
        assertThrows(ProtocolException.class, () -> parse("*-2\r\n"));
        assertThrows(ProtocolException.class, () -> parse("*-1\r\n"));
        assertThrows(ProtocolException.class, () -> parse("*0\r\n"));
        assertThrows(ProtocolException.class, () -> parse("*1\r\n$-1\r\n"));
        assertThrows(ProtocolException.class, () -> parse("*1\r\n$\r\n"));
    }

    @Test
    void rejectsUnterminatedOrMalformedLines() {
        assertThrows(ProtocolException.class, () -> parse("*1\rX"));
        assertThrows(ProtocolException.class, () -> parse("*1\n"));
        assertThrows(ProtocolException.class, () -> parse("*1" + "1".repeat(100)));
    }

    @Test
    void rejectsNonArrayRequests() {
        assertThrows(ProtocolException.class, () -> parse("PING\r\n"));
        assertThrows(ProtocolException.class, () -> parse("*1\r\n+PING\r\n"));
    }

    @Test
    void encodesReplies() {
        assertEquals("+PONG\r\n", new String(RespProtocol.encode(Reply.PONG), StandardCharsets.UTF_8));
        assertEquals("+OK\r\n", new String(RespProtocol.encode(Reply.OK), StandardCharsets.UTF_8));
        assertEquals("$5\r\nhello\r\n", new String(RespProtocol.encode(Reply.bulkString(bytes("hello"))), StandardCharsets.UTF_8));
        assertEquals("$0\r\n\r\n", new String(RespProtocol.encode(Reply.bulkString(new byte[0])), StandardCharsets.UTF_8));
        assertEquals("$-1\r\n", new String(RespProtocol.encode(Reply.NULL_BULK), StandardCharsets.UTF_8));
        assertEquals("-ERR boom\r\n", new String(RespProtocol.encode(Reply.error("ERR boom")), StandardCharsets.UTF_8));
        assertEquals(":42\r\n", new String(RespProtocol.encode(Reply.integer(42)), StandardCharsets.UTF_8));
        assertEquals("*2\r\n:1\r\n$-1\r\n",
                new String(RespProtocol.encode(Reply.array(List.of(Reply.integer(1), Reply.NULL_BULK))), StandardCharsets.UTF_8));
    }

    @Test
    void bulkLengthCountsBytesNotChars() {
        byte[] encoded = RespProtocol.encode(Reply.bulkString(bytes("héllo")));

        assertEquals("$6\r\nhéllo\r\n", new String(encoded, StandardCharsets.UTF_8));
    }

    @Test
    void lineRepliesNeverContainLineBreaks() {
        assertEquals("-ERR bad  input\r\n", new String(RespProtocol.encode(Reply.error("ERR bad\r\ninput")), StandardCharsets.UTF_8));
        assertEquals("+a b\r\n", new String(RespProtocol.encode(Reply.simpleString("a\nb")), StandardCharsets.UTF_8));
    }

    @Test
    void parsesAsciiIntegersOnly() {
        assertEquals(100L, RespProtocol.parseInteger(bytes("100")));
        assertEquals(-5L, RespProtocol.parseInteger(bytes("-5")));
        assertEquals(Long.MAX_VALUE, RespProtocol.parseInteger(bytes("9223372036854775807")));
        assertEquals(Long.MIN_VALUE, RespProtocol.parseInteger(bytes("-9223372036854775808")));
        assertNull(RespProtocol.parseInteger(bytes("9223372036854775808")));
        assertNull(RespProtocol.parseInteger(bytes("\u0661\u0660\u0660")));
        assertNull(RespProtocol.parseInteger(bytes("+1")));
        assertNull(RespProtocol.parseInteger(bytes("")));
        assertNull(RespProtocol.parseInteger(bytes("-")));
        assertNull(RespProtocol.parseInteger(bytes("1.5")));
    }
}
