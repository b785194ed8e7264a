import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import config.ServerConfig;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import server.RedisServer;

import java.io.IOException;

/**
 * 서버 애플리케이션의 진입점
 */
@Slf4j
public class Main {

    public static void main(String[] args) {
        // 서버 설정 생성
        ServerConfig config = new ServerConfig();

        // 명령행 인수로 설정 오버라이드
        try {
            config.parseCommandLineArgs(args);
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            System.exit(1);
            return;
        }
        applyLogLevel(config);

        RedisServer server = new RedisServer(config);
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "shutdown-hook"));
        try {
            server.start();
        } catch (IOException e) {
            log.error("Failed to start server on {}:{}", config.getBindAddress(), config.getPort(), e);
            System.exit(1);
        }
    }

    private static void applyLogLevel(ServerConfig config) {
        Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.toLevel(config.getLogLevel().name()));
    }
}
