package server;

import command.CommandHandler;
import config.ServerConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import service.ExpiryEvictor;
import service.StorageService;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 서버의 메인 클래스
 * 서버 시작, 클라이언트 연결 수락을 담당
 */
@Slf4j
public class RedisServer {

    private static final long SHUTDOWN_GRACE_MS = 2_000;

    private final ServerConfig config;
    private final StorageService storageService;
    private final CommandHandler commandHandler;
    private final ExpiryEvictor expiryEvictor;
    private final Semaphore connectionPermits;
    private final ExecutorService workers;
    private final Set<ClientHandler> activeClients = ConcurrentHashMap.newKeySet();

    private volatile ServerSocket serverSocket;
    private volatile boolean running;
    private Thread acceptThread;

    public RedisServer(ServerConfig config) {
        this(config, new StorageService());
    }

    public RedisServer(ServerConfig config, StorageService storageService) {
        this.config = config;
        this.storageService = storageService;
        this.commandHandler = new CommandHandler(storageService);
        this.expiryEvictor = new ExpiryEvictor(storageService, config.getEvictionIntervalMs());
        this.connectionPermits = new Semaphore(config.getMaxConnections());
        AtomicInteger workerIds = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> new Thread(r, "client-" + workerIds.incrementAndGet()));
    }

    /**
     * 서버 소켓을 바인딩하고 별도 스레드에서 연결 수락을 시작합니다.
     */
    public synchronized void start() throws IOException {
        if (running) {
            throw new IllegalStateException("Server already started");
        }
        serverSocket = createServerSocket();
        log.info("Listening on {}", serverSocket.getLocalSocketAddress());

        if (config.getEvictionIntervalMs() > 0) {
            expiryEvictor.start();
        }

        running = true;
        acceptThread = new Thread(this::acceptLoop, "redis-acceptor");
        acceptThread.start();
    }

    /**
     * 서버 소켓을 생성하고 설정합니다.
     */
    private ServerSocket createServerSocket() throws IOException {
        ServerSocket socket = new ServerSocket();
        // 서버 재시작 시 'Address already in use' 에러 방지
        socket.setReuseAddress(true);
        socket.bind(new InetSocketAddress(InetAddress.getByName(config.getBindAddress()), config.getPort()));
        return socket;
    }

    private void acceptLoop() {
        log.info("Waiting for connections...");
        while (running) {
            try {
                if (!connectionPermits.tryAcquire(config.getConnectionPermitTimeoutMs(), TimeUnit.MILLISECONDS)) {
                    log.warn("No connection permit available within {} ms ({} connections open)",
                            config.getConnectionPermitTimeoutMs(), activeClients.size());
                    continue;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            Socket clientSocket;
            try {
                clientSocket = serverSocket.accept();
            } catch (IOException e) {
                connectionPermits.release();
                if (!running) {
                    break;
                }
                log.warn("Error accepting client connection: {}", e.getMessage());
                continue;
            }

            dispatch(clientSocket);
        }
        log.debug("Accept loop stopped");
    }

    /**
     * 클라이언트 연결을 별도의 워커 스레드로 처리합니다.
     */
    private void dispatch(Socket clientSocket) {
        ClientHandler clientHandler = new ClientHandler(clientSocket, commandHandler);
        activeClients.add(clientHandler);
        try {
            workers.execute(() -> {
                try {
                    clientHandler.run();
                } finally {
                    activeClients.remove(clientHandler);
                    connectionPermits.release();
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Rejected client connection {}: server is shutting down", clientSocket.getRemoteSocketAddress());
            activeClients.remove(clientHandler);
            connectionPermits.release();
            clientHandler.close();
        }
    }

    /**
     * 새 연결 수락을 멈추고 열린 연결을 정리합니다.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info("Shutting down server on port {}", getLocalPort());

        IOUtils.closeQuietly(serverSocket, e -> log.warn("Error closing server socket: {}", e.getMessage()));
        expiryEvictor.close();

        workers.shutdown();
        activeClients.forEach(ClientHandler::close);
        try {
            if (!workers.awaitTermination(SHUTDOWN_GRACE_MS, TimeUnit.MILLISECONDS)) {
                log.warn("Client handlers did not finish within {} ms", SHUTDOWN_GRACE_MS);
                workers.shutdownNow();
            }
            acceptThread.join(SHUTDOWN_GRACE_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? -1 : socket.getLocalPort();
    }

    public StorageService getStorageService() {
        return storageService;
    }

    public int getActiveConnectionCount() {
        return activeClients.size();
    }
}
