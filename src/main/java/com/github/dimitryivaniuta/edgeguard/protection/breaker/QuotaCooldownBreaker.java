package com.github.dimitryivaniuta.edgeguard.protection.breaker;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide cooldown guarding the shared upstream quota.
 *
 * <ul>
 *   <li>Closed: {@code cooldownUntilMs <= now}, calls proceed.</li>
 *   <li>Open: {@code cooldownUntilMs > now}, calls are short-circuited with a retry hint.</li>
 * </ul>
 * Open to Closed happens lazily once the cooldown elapses; there is no half-open probe. Any successful
 * upstream call resets the cooldown to 0.
 */
@Slf4j
public final class QuotaCooldownBreaker {

    private final Clock clock;
    private final Duration cooldown;
    private final AtomicLong cooldownUntilMs = new AtomicLong(0);

    public QuotaCooldownBreaker(Clock clock, Duration cooldown) {
        if (cooldown == null || cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative");
        }
        this.clock = clock;
        this.cooldown = cooldown;
    }

    /**
     * @return 0 when closed, otherwise seconds until the cooldown ends (at least 1)
     */
    public long remainingCooldownSeconds() {
        long until = cooldownUntilMs.get();
        long now = clock.millis();
        if (until <= now) return 0;
        return Math.max(1, (until - now + 999) / 1000);
    }

    public boolean isOpen() {
        return remainingCooldownSeconds() > 0;
    }

    public void trip() {
        long until = clock.millis() + cooldown.toMillis();
        cooldownUntilMs.set(until);
        log.warn("Upstream quota exhausted, short-circuiting upstream calls for {} ms", cooldown.toMillis());
    }

    public void recordSuccess() {
        cooldownUntilMs.set(0);
    }

    public long cooldownUntilMs() {
        return cooldownUntilMs.get();
    }
}
