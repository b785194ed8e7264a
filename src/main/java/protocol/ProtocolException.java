package protocol;

import java.io.IOException;

/**
 * RESP 프레이밍 오류. 해당 연결은 종료됩니다.
 */
public class ProtocolException extends IOException {

    public ProtocolException(String message) {
        super(message);
    }
}
