package metering.java.engine;

/**
 * Outbound notifications (webhooks, e-mail, ...). Delivery is someone else's job;
 * implementations must not block the request path for long.
 */
public interface UsageNotifier {

    void usageAlert(UsageAlert alert);

    void subscriptionRenewed(String subscriberId, String planId, int countersReset);
}
