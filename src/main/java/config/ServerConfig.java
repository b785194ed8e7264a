package config;

import lombok.Getter;
import lombok.Setter;

/**
 * 서버 설정을 관리하는 클래스
 */
@Getter
@Setter
public class ServerConfig {
    private int port = 6379;
    private String bindAddress = "127.0.0.1";
    private int maxConnections = 10_000;
    private long connectionPermitTimeoutMs = 1_000;
    private long evictionIntervalMs = 100;     // 0이면 백그라운드 만료 정리 비활성화
    private LogLevel logLevel = LogLevel.INFO;

    /**
     * 명령행 인수를 파싱하여 설정을 업데이트합니다.
     *
     * @throws IllegalArgumentException 알 수 없는 옵션이거나 값이 잘못된 경우
     */
    public void parseCommandLineArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            switch (flag) {
                case "-p":
                case "--port":
                    this.port = parseInt(flag, requireValue(args, ++i, flag));
                    if (port < 0 || port > 65535) {
                        throw new IllegalArgumentException("Invalid port number: " + port);
                    }
                    break;
                case "--bind":
                    this.bindAddress = requireValue(args, ++i, flag);
                    break;
                case "--max-conn":
                    this.maxConnections = parseInt(flag, requireValue(args, ++i, flag));
                    if (maxConnections <= 0) {
                        throw new IllegalArgumentException("--max-conn must be positive: " + maxConnections);
                    }
                    break;
                case "--eviction-interval":
                    this.evictionIntervalMs = parseInt(flag, requireValue(args, ++i, flag));
                    if (evictionIntervalMs < 0) {
                        throw new IllegalArgumentException("--eviction-interval must not be negative: " + evictionIntervalMs);
                    }
                    break;
                case "--log-level":
                    this.logLevel = LogLevel.fromString(requireValue(args, ++i, flag));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + flag);
            }
        }
    }

    private static String requireValue(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[index];
    }

    private static int parseInt(String flag, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + flag + ": " + value, e);
        }
    }
}
