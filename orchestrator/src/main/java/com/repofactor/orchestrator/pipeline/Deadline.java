package com.repofactor.orchestrator.pipeline;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Caller-supplied limit on how long a run may take. The Driver stops waiting
 * for an in-flight agent call once it passes.
 *
 * A null expiry means no limit.
 */
public record Deadline(Instant expiresAt) {

    private static final Deadline NONE = new Deadline(null);

    public static Deadline none() {
        return NONE;
    }

    public static Deadline after(Duration timeout) {
        return new Deadline(Instant.now().plus(timeout));
    }

    public boolean isExpired() {
        return expiresAt != null && !Instant.now().isBefore(expiresAt);
    }

    /** Time left, or empty when there is no limit. Never negative. */
    public Optional<Duration> remaining() {
        if (expiresAt == null) return Optional.empty();
        Duration left = Duration.between(Instant.now(), expiresAt);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }
}
