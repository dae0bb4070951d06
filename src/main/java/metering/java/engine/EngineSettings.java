package metering.java.engine;

import metering.core.idempotency.IdempotencyGuard;
import metering.core.usage.UsageAccountant;

import java.time.Duration;

/**
 * Tunables of the metering engine.
 *
 * @param usageTtl usage counter TTL, refreshed on every increment
 * @param maxCasRetries compare-and-set retries before a limit-aware increment fails closed
 * @param idempotencyTtl how long an event id is remembered
 * @param rateLimitTtlBuffer added to the window length to form the window key TTL
 */
public record EngineSettings(
    Duration usageTtl,
    int maxCasRetries,
    Duration idempotencyTtl,
    Duration rateLimitTtlBuffer
) {
    public EngineSettings {
        if (usageTtl == null || usageTtl.isZero() || usageTtl.isNegative()) {
            throw new IllegalArgumentException("usageTtl must be > 0");
        }
        if (maxCasRetries < 0) {
            throw new IllegalArgumentException("maxCasRetries must be >= 0");
        }
        if (idempotencyTtl == null || idempotencyTtl.isZero() || idempotencyTtl.isNegative()) {
            throw new IllegalArgumentException("idempotencyTtl must be > 0");
        }
        if (rateLimitTtlBuffer == null || rateLimitTtlBuffer.isNegative()) {
            throw new IllegalArgumentException("rateLimitTtlBuffer must be >= 0");
        }
    }

    /**
     * 90-day usage TTL, 5 CAS retries, 24-hour idempotency window, 1-second window buffer.
     */
    public static EngineSettings defaults() {
        return new EngineSettings(
            UsageAccountant.DEFAULT_TTL,
            UsageAccountant.DEFAULT_MAX_RETRIES,
            IdempotencyGuard.DEFAULT_TTL,
            Duration.ofSeconds(1)
        );
    }

    public EngineSettings withMaxCasRetries(int retries) {
        return new EngineSettings(usageTtl, retries, idempotencyTtl, rateLimitTtlBuffer);
    }
}
