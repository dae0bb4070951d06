package metering.java.engine;

import java.time.Instant;
import java.util.Map;

/**
 * Durable record of one admitted, idempotency-checked usage event.
 * Replayed by {@link CounterRebuilder} to reconstruct usage counters.
 */
public record MeterEvent(
    String eventId,
    String subscriberId,
    String featureCode,
    long units,
    Instant timestamp,
    Map<String, String> metadata
) {
    public MeterEvent {
        if (eventId == null || eventId.isBlank()) throw new IllegalArgumentException("eventId must not be blank");
        if (subscriberId == null || subscriberId.isBlank()) throw new IllegalArgumentException("subscriberId must not be blank");
        if (featureCode == null || featureCode.isBlank()) throw new IllegalArgumentException("featureCode must not be blank");
        if (units <= 0) throw new IllegalArgumentException("units must be > 0");
        if (timestamp == null) throw new IllegalArgumentException("timestamp cannot be null");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
