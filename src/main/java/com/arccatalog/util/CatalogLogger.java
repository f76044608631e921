package com.arccatalog.util;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Appends catalog events to {@code catalog.log} in a log directory.
 * <p>
 * Writes are serialized across threads. When the file grows past {@link #ROTATE_AT_BYTES} it is
 * renamed to {@code catalog.log.1} and a new file is started. Repeated failures of one scan can be
 * reported through {@link #logRecurringError} and summarized with {@link #flush(Path)}.
 */
public class CatalogLogger {

    static final String LOG_FILE = "catalog.log";
    static final String ROTATED_LOG_FILE = "catalog.log.1";
    static final long ROTATE_AT_BYTES = 5L * 1024 * 1024;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_LOCAL_DATE_TIME;
    private static final Object WRITE_LOCK = new Object();

    // log directory -> repeated failure key -> occurrences
    private static final Map<Path, Map<String, AtomicInteger>> REPEATS = new ConcurrentHashMap<>();

    private CatalogLogger() {
    }

    /**
     * @param logDir  See {@link CatalogConfig#getLogDirectory()}; nothing is written when null
     * @param context Component writing the entry, e.g. {@code "BackupService"}
     * @param error   Optional; its stack trace follows the message
     */
    public static void logError(Path logDir, String context, String message, Throwable error) {
        append(logDir, "ERROR", context, message, error);
    }

    public static void logWarning(Path logDir, String context, String message) {
        append(logDir, "WARN", context, message, null);
    }

    public static void logInfo(Path logDir, String context, String message) {
        append(logDir, "INFO", context, message, null);
    }

    /**
     * Writes the first occurrence of a failure; later ones with the same context, message and
     * exception class are only counted until the next {@link #flush(Path)}.
     */
    public static void logRecurringError(Path logDir, String context, String message, Throwable error) {
        if (logDir == null) {
            return;
        }
        String key = context + " | " + message + (error == null ? "" : " | " + error.getClass().getSimpleName());
        AtomicInteger seen = REPEATS.computeIfAbsent(logDir, dir -> new ConcurrentHashMap<>())
                .computeIfAbsent(key, k -> new AtomicInteger());
        if (seen.getAndIncrement() == 0) {
            append(logDir, "ERROR", context, message, error);
        }
    }

    /**
     * Writes one line per recurring failure that occurred more than once, then forgets the counts.
     */
    public static void flush(Path logDir) {
        if (logDir == null) {
            return;
        }
        Map<String, AtomicInteger> repeats = REPEATS.remove(logDir);
        if (repeats == null) {
            return;
        }
        repeats.forEach((key, seen) -> {
            if (seen.get() > 1) {
                append(logDir, "ERROR", "CatalogLogger", "Repeated " + (seen.get() - 1) + " more time(s): " + key, null);
            }
        });
    }

    private static void append(Path logDir, String level, String context, String message, Throwable error) {
        if (logDir == null) {
            return;
        }
        StringBuilder entry = new StringBuilder()
                .append(LocalDateTime.now().format(TIMESTAMP))
                .append(' ').append(String.format("%-5s", level))
                .append(' ').append(context)
                .append(": ").append(message)
                .append(System.lineSeparator());
        if (error != null) {
            StringWriter trace = new StringWriter();
            error.printStackTrace(new PrintWriter(trace));
            entry.append(trace);
        }

        synchronized (WRITE_LOCK) {
            Path logFile = logDir.resolve(LOG_FILE);
            try {
                Files.createDirectories(logDir);
                if (Files.exists(logFile) && Files.size(logFile) > ROTATE_AT_BYTES) {
                    Files.move(logFile, logDir.resolve(ROTATED_LOG_FILE), StandardCopyOption.REPLACE_EXISTING);
                }
                Files.writeString(logFile, entry, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                System.err.println("Cannot write " + logFile + ": " + e.getMessage());
                System.err.print(entry);
            }
        }
    }
}
