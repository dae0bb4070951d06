package metering.java.engine;

/**
 * Payload handed to the notifier when a subscriber reaches or hits a limit.
 */
public record UsageAlert(
    AlertType type,
    String subscriberId,
    String planId,
    String featureCode,
    long limit,
    long currentUsage
) {
}
