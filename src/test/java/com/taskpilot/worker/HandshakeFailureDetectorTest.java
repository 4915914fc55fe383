package com.taskpilot.worker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HandshakeFailureDetectorTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("matches signatures case-insensitively")
    void detects() {
        assertEquals(Optional.of("mcp startup failed"),
                HandshakeFailureDetector.detect("ERROR: MCP Startup Failed: connection refused"));
        assertEquals(Optional.of("handshaking with mcp server failed"),
                HandshakeFailureDetector.detect("warn: handshaking with MCP server failed after 3 tries"));
    }

    @Test
    @DisplayName("clean output has no signature")
    void clean() {
        assertTrue(HandshakeFailureDetector.detect("All tests passed").isEmpty());
        assertTrue(HandshakeFailureDetector.detect("").isEmpty());
        assertTrue(HandshakeFailureDetector.detect(null).isEmpty());
    }

    @Test
    @DisplayName("scans only the tail of large logs")
    void tailOnly() throws Exception {
        StringBuilder content = new StringBuilder("mcp startup failed\n");
        content.append("x".repeat(HandshakeFailureDetector.TAIL_BYTES + 10));
        Path log = Files.writeString(tempDir.resolve("big.log"), content.toString());
        assertTrue(HandshakeFailureDetector.scanLog(log).isEmpty());

        Files.writeString(log, content + "\nsend message error transport closed\n");
        assertEquals(Optional.of("send message error transport"), HandshakeFailureDetector.scanLog(log));
    }

    @Test
    @DisplayName("missing log yields empty")
    void missingLog() {
        assertTrue(HandshakeFailureDetector.scanLog(tempDir.resolve("absent.log")).isEmpty());
        assertTrue(HandshakeFailureDetector.scanLog(null).isEmpty());
    }
}
