package io.tenantq.utils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Deterministic idempotency keys.
 */
public final class IdempotencyKeys {
    private IdempotencyKeys() {
    }

    /**
     * SHA-256 over tenant, task type and payload, hex encoded. Fields are length-prefixed so that
     * ("ab", "c") and ("a", "bc") never collide.
     */
    public static String derive(String tenantId, String taskType, byte[] payload) {
        Objects.requireNonNull(taskType, "taskType must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        MessageDigest digest = sha256();
        update(digest, (tenantId != null ? tenantId : "").getBytes(StandardCharsets.UTF_8));
        update(digest, taskType.getBytes(StandardCharsets.UTF_8));
        update(digest, payload);
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Key of the envelope fired for one schedule entry at one fire time. Identical on every refire.
     */
    public static String forScheduleFire(String entryId, Instant fireTime) {
        Objects.requireNonNull(entryId, "entryId must not be null");
        Objects.requireNonNull(fireTime, "fireTime must not be null");
        return "schedule:" + entryId + ":" + fireTime;
    }

    private static void update(MessageDigest digest, byte[] bytes) {
        int n = bytes.length;
        digest.update(new byte[]{(byte) (n >>> 24), (byte) (n >>> 16), (byte) (n >>> 8), (byte) n});
        digest.update(bytes);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
