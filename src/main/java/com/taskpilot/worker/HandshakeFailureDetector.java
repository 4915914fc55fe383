package com.taskpilot.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Recognises agent runs that died while connecting to their tool servers. Such runs can
 * exit 0 without having done any work, so the signature overrides a clean exit code.
 */
public final class HandshakeFailureDetector {

    private static final Logger log = LoggerFactory.getLogger(HandshakeFailureDetector.class);

    /** Bytes read from the end of the log. */
    public static final int TAIL_BYTES = 64 * 1024;

    static final List<String> SIGNATURES = List.of(
            "mcp startup failed",
            "handshaking with mcp server failed",
            "initialize response",
            "send message error transport"
    );

    private HandshakeFailureDetector() {}

    /** Returns the first signature found in {@code text}, matched case-insensitively. */
    public static Optional<String> detect(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return SIGNATURES.stream().filter(lower::contains).findFirst();
    }

    /** Scans the tail of a worker log; an unreadable or missing log yields empty. */
    public static Optional<String> scanLog(Path logFile) {
        if (logFile == null || !Files.isRegularFile(logFile)) {
            return Optional.empty();
        }
        try {
            return detect(readTail(logFile, TAIL_BYTES));
        } catch (IOException e) {
            log.warn("Could not read worker log {}: {}", logFile, e.getMessage());
            return Optional.empty();
        }
    }

    static String readTail(Path file, int maxBytes) throws IOException {
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "r")) {
            long length = raf.length();
            long start = Math.max(0, length - maxBytes);
            byte[] buffer = new byte[(int) (length - start)];
            raf.seek(start);
            raf.readFully(buffer);
            return new String(buffer, StandardCharsets.UTF_8);
        }
    }
}
