package com.pageharvest.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 루트 설정 (SLF4J는 slf4j-jdk14로 여기에 합류).
 * 진입점에서 한 번만 호출한다. 두 번째 호출은 무시.
 */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    private static volatile boolean initialized = false;

    public static synchronized void init(Path logDir, Level rootLevel, int maxBytes, int fileCount) {
        if (initialized) return;
        initialized = true;

        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler h : root.getHandlers()) root.removeHandler(h);

        Formatter fmt = new LineFormatter();
        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(rootLevel);
        console.setFormatter(fmt);
        root.addHandler(console);

        if (logDir != null) {
            try {
                Files.createDirectories(logDir);
                String pattern = logDir.resolve("harvest-%g.log").toString();
                FileHandler file = new FileHandler(pattern, Math.max(1024, maxBytes), Math.max(1, fileCount), true);
                file.setLevel(rootLevel);
                file.setFormatter(fmt);
                root.addHandler(file);
            } catch (IOException e) {
                root.log(Level.WARNING, "Failed to init file handler: " + e.getMessage());
            }
        }

        root.setLevel(rootLevel);
        Logger.getLogger(LoggingConfigurator.class.getName()).log(Level.CONFIG,
                () -> "Log initialized. dir=" + logDir + ", level=" + rootLevel.getName());
    }

    /** "debug" / "FINE" / "warn" 등 → JUL Level. 모르면 def. */
    public static Level parseLevel(String s, Level def) {
        if (s == null || s.isBlank()) return def;
        String v = s.trim().toUpperCase(Locale.ROOT);
        return switch (v) {
            case "TRACE", "FINEST" -> Level.FINEST;
            case "DEBUG", "FINE" -> Level.FINE;
            case "INFO" -> Level.INFO;
            case "WARN", "WARNING" -> Level.WARNING;
            case "ERROR", "SEVERE" -> Level.SEVERE;
            case "OFF" -> Level.OFF;
            default -> def;
        };
    }

    /** 메시지만 한 줄로 (StructuredLog 라인은 이미 JSON) */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            StringBuilder sb = new StringBuilder(formatMessage(r)).append(System.lineSeparator());
            if (r.getThrown() != null) {
                sb.append("  ").append(r.getThrown()).append(System.lineSeparator());
            }
            return sb.toString();
        }
    }
}
