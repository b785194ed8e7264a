package config;

import java.util.Locale;

/**
 * 지원하는 로그 레벨
 */
public enum LogLevel {
    OFF, ERROR, WARN, INFO, DEBUG, TRACE;

    public static LogLevel fromString(String value) {
        try {
            return valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid log level: " + value, e);
        }
    }
}
