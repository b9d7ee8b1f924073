package com.hedgetrader.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Interval after a close, failure or risk halt during which a pair may not open a new hedge.
 * The window covers {@code [startedAt, expiresAt)}: admission is allowed again at exactly
 * {@code expiresAt}.
 */
public record CooldownWindow(String pairId, Instant startedAt, Instant expiresAt, String reason) {

    public boolean isActive(Instant now) {
        return now.isBefore(expiresAt);
    }

    public Duration remaining(Instant now) {
        return isActive(now) ? Duration.between(now, expiresAt) : Duration.ZERO;
    }
}
