package metering.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default notifier: writes every notification to the log.
 */
public final class LoggingUsageNotifier implements UsageNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingUsageNotifier.class);

    @Override
    public void usageAlert(UsageAlert alert) {
        log.info("{} subscriber={} plan={} feature={} usage={}/{}",
            alert.type().code(), alert.subscriberId(), alert.planId(), alert.featureCode(),
            alert.currentUsage(), alert.limit());
    }

    @Override
    public void subscriptionRenewed(String subscriberId, String planId, int countersReset) {
        log.info("subscription_renewed subscriber={} plan={} countersReset={}",
            subscriberId, planId, countersReset);
    }
}
