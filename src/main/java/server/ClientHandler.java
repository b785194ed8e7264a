package server;

import command.CommandHandler;
import lombok.extern.slf4j.Slf4j;
import model.CommandRequest;
import model.Reply;
import org.apache.commons.io.IOUtils;
import protocol.ProtocolException;
import protocol.RequestBuffer;
import protocol.RespProtocol;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;

/**
 * 클라이언트 연결 하나를 연결부터 종료까지 처리합니다.
 *
 * <p>읽은 바이트를 {@link RequestBuffer}에 쌓고, 완성된 명령어를 도착 순서대로 실행해
 * 응답을 같은 순서로 기록합니다. 한 번의 읽기에 여러 명령어가 들어와도(파이프라이닝)
 * 응답 순서는 바뀌지 않습니다.
 */
@Slf4j
public class ClientHandler implements Runnable {

    private static final int READ_BUFFER_SIZE = 16 * 1024;

    private final Socket clientSocket;
    private final CommandHandler commandHandler;
    private final RequestBuffer requestBuffer = new RequestBuffer();
    private final String clientAddress;

    public ClientHandler(Socket clientSocket, CommandHandler commandHandler) {
        this.clientSocket = clientSocket;
        this.commandHandler = commandHandler;
        this.clientAddress = String.valueOf(clientSocket.getRemoteSocketAddress());
    }

    @Override
    public void run() {
        log.debug("Client connected: {}", clientAddress);

        try (InputStream inputStream = clientSocket.getInputStream();
             OutputStream outputStream = new BufferedOutputStream(clientSocket.getOutputStream())) {

            handleClientLoop(inputStream, outputStream);

        } catch (SocketException e) {
            log.debug("Client disconnected: {} ({})", clientAddress, e.getMessage());
        } catch (IOException e) {
            log.debug("I/O error on client {}: {}", clientAddress, e.getMessage());
        } finally {
            close();
        }

        log.debug("Client connection closed: {}", clientAddress);
    }

    private void handleClientLoop(InputStream inputStream, OutputStream outputStream) throws IOException {
        byte[] readBuffer = new byte[READ_BUFFER_SIZE];
        int n;
        while ((n = inputStream.read(readBuffer)) != -1) {
            requestBuffer.append(readBuffer, 0, n);
            try {
                processBufferedCommands(outputStream);
            } catch (ProtocolException e) {
                log.warn("Protocol error from client {}: {}", clientAddress, e.getMessage());
                // 앞서 처리된 명령어의 응답 뒤에 오류를 붙이고 연결 종료
                RespProtocol.writeReply(Reply.error("ERR Protocol error: " + e.getMessage()), outputStream);
                outputStream.flush();
                return;
            }
            outputStream.flush();
        }
    }

    /**
     * 버퍼에 완성된 명령어가 남지 않을 때까지 decode-dispatch-encode를 반복합니다.
     */
    private void processBufferedCommands(OutputStream outputStream) throws IOException {
        CommandRequest request;
        while ((request = requestBuffer.nextCommand()) != null) {
            Reply reply = commandHandler.handleCommand(request);
            if (log.isTraceEnabled()) {
                log.trace("{} {} -> {}", clientAddress, request.name(), reply);
            }
            RespProtocol.writeReply(reply, outputStream);
        }
    }

    /**
     * 소켓을 닫습니다. 블로킹 중인 읽기는 예외로 깨어납니다.
     */
    public void close() {
        IOUtils.closeQuietly(clientSocket, e -> log.debug("Error closing client socket {}: {}", clientAddress, e.getMessage()));
    }
}
