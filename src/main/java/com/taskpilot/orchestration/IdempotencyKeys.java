package com.taskpilot.orchestration;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Derives changeset idempotency keys: a readable, cleaned prefix plus a hash of the raw
 * parts, so distinct parts that clean to the same prefix still get distinct keys.
 */
public final class IdempotencyKeys {

    static final int MAX_PREFIX = 84;
    static final int MAX_KEY = 120;
    static final int HASH_CHARS = 20;

    private IdempotencyKeys() {}

    public static String of(List<String> parts) {
        String raw = parts.stream()
                .filter(Objects::nonNull)
                .filter(p -> !p.isEmpty())
                .collect(Collectors.joining(":"));
        String cleaned = raw.replaceAll("[^a-zA-Z0-9:_-]", "-");
        if (cleaned.length() > MAX_PREFIX) {
            cleaned = cleaned.substring(0, MAX_PREFIX);
        }
        String key = cleaned + ":" + sha256Hex(raw).substring(0, HASH_CHARS);
        return key.length() > MAX_KEY ? key.substring(0, MAX_KEY) : key;
    }

    public static String of(String... parts) {
        return of(Arrays.asList(parts));
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
