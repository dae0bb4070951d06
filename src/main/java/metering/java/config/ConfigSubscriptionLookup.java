package metering.java.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import metering.java.engine.BillingPeriod;
import metering.java.engine.PlanSnapshot;
import metering.java.engine.SubscriptionLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SubscriptionLookup} over plans and subscriptions declared in configuration:
 *
 * <pre>
 * metering.plans.pro {
 *   price = 29.00
 *   billing-period = monthly
 *   overage-unit-price = 0
 *   rate-limit { max-calls = 10, window-seconds = 60 }
 *   features { api_call = 1000, export = -1 }
 * }
 * metering.subscriptions { "alice" = pro }
 * </pre>
 *
 * Feature and subscriber names are read as object keys, so they may contain dots.
 *
 * <p>The catalogue is held in memory and swapped whole by {@link #reload(Config)}. Lookups see
 * either the old or the new catalogue, never a mix. A reload that fails validation leaves the
 * current catalogue in place. Without a reload, plan and subscription edits made after startup
 * are not seen.
 */
public final class ConfigSubscriptionLookup implements SubscriptionLookup {

    private static final Logger log = LoggerFactory.getLogger(ConfigSubscriptionLookup.class);

    private volatile Catalog catalog;

    public ConfigSubscriptionLookup(Map<String, PlanSnapshot> plans, Map<String, String> subscriptions) {
        this.catalog = Catalog.of(plans, subscriptions);
    }

    public static ConfigSubscriptionLookup from(Config config) {
        Catalog parsed = parse(config);
        return new ConfigSubscriptionLookup(parsed.plans(), parsed.subscriptions());
    }

    /**
     * Re-reads plans and subscriptions from {@code config} and swaps them in.
     *
     * @throws IllegalArgumentException if a plan is invalid or a subscriber references an unknown plan
     * @throws com.typesafe.config.ConfigException if a required setting is missing or mistyped
     */
    public void reload(Config config) {
        Catalog next = parse(config);
        Catalog previous = catalog;
        catalog = next;
        log.info("Reloaded subscriptions: {} plans, {} subscribers (was {} / {})",
            next.plans().size(), next.subscriptions().size(),
            previous.plans().size(), previous.subscriptions().size());
    }

    @Override
    public Optional<PlanSnapshot> findActiveSubscription(String subscriberId) {
        Catalog current = catalog;
        String planId = current.subscriptions().get(subscriberId);
        return planId == null ? Optional.empty() : Optional.of(current.plans().get(planId));
    }

    private static Catalog parse(Config config) {
        Config m = config.getConfig("metering");

        Map<String, PlanSnapshot> plans = new LinkedHashMap<>();
        ConfigObject planObjects = m.getObject("plans");
        for (String planId : planObjects.keySet()) {
            plans.put(planId, parsePlan(planId, ((ConfigObject) planObjects.get(planId)).toConfig()));
        }

        Map<String, String> subscriptions = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigValue> e : m.getObject("subscriptions").entrySet()) {
            subscriptions.put(e.getKey(), String.valueOf(e.getValue().unwrapped()));
        }
        return Catalog.of(plans, subscriptions);
    }

    private static PlanSnapshot parsePlan(String planId, Config plan) {
        Map<String, Long> features = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigValue> e : plan.getObject("features").entrySet()) {
            ConfigValue value = e.getValue();
            if (value.valueType() != ConfigValueType.NUMBER) {
                throw new IllegalArgumentException("plan " + planId + " feature " + e.getKey() + " limit must be a number");
            }
            features.put(e.getKey(), ((Number) value.unwrapped()).longValue());
        }
        return new PlanSnapshot(
            planId,
            new BigDecimal(plan.getString("price")),
            BillingPeriod.fromCode(plan.hasPath("billing-period") ? plan.getString("billing-period") : "monthly"),
            plan.hasPath("overage-unit-price") ? new BigDecimal(plan.getString("overage-unit-price")) : BigDecimal.ZERO,
            plan.hasPath("rate-limit.max-calls") ? plan.getInt("rate-limit.max-calls") : 0,
            plan.hasPath("rate-limit.window-seconds") ? plan.getLong("rate-limit.window-seconds") : 60L,
            features
        );
    }

    private record Catalog(Map<String, PlanSnapshot> plans, Map<String, String> subscriptions) {

        static Catalog of(Map<String, PlanSnapshot> plans, Map<String, String> subscriptions) {
            for (Map.Entry<String, String> s : subscriptions.entrySet()) {
                if (!plans.containsKey(s.getValue())) {
                    throw new IllegalArgumentException(
                        "subscriber " + s.getKey() + " references unknown plan " + s.getValue());
                }
            }
            return new Catalog(Map.copyOf(plans), Map.copyOf(subscriptions));
        }
    }
}
