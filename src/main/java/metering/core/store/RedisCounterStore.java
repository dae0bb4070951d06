package metering.core.store;

import metering.core.model.StoreUnavailableException;
import org.redisson.Redisson;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;
import org.redisson.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * {@link CounterStore} backed by Redis through Redisson.
 *
 * <p>Every compound operation is a Lua script, so Redis executes it as one atomic unit.
 * Values travel as strings ({@link StringCodec}) so counters stay readable with redis-cli.
 *
 * <p>Failure classification: any {@link RedisException} (command timeout, refused or dropped
 * connection, cluster errors) becomes a {@link StoreUnavailableException}. Nothing is retried
 * here; the engine components decide what a failure means.
 */
public final class RedisCounterStore implements CounterStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisCounterStore.class);

    static final String INCREMENT_SCRIPT = """
        local v = redis.call('INCRBY', KEYS[1], ARGV[1])
        if tonumber(ARGV[2]) > 0 then
            redis.call('PEXPIRE', KEYS[1], ARGV[2])
        end
        return v
        """;

    static final String GET_SCRIPT = """
        local v = redis.call('GET', KEYS[1])
        if not v then
            return 0
        end
        return tonumber(v)
        """;

    static final String SET_IF_ABSENT_SCRIPT = """
        local ok
        if tonumber(ARGV[2]) > 0 then
            ok = redis.call('SET', KEYS[1], ARGV[1], 'NX', 'PX', ARGV[2])
        else
            ok = redis.call('SET', KEYS[1], ARGV[1], 'NX')
        end
        if ok then
            return 1
        end
        return 0
        """;

    static final String COMPARE_AND_SET_SCRIPT = """
        local current = tonumber(redis.call('GET', KEYS[1]) or '0')
        if current ~= tonumber(ARGV[1]) then
            return 0
        end
        if tonumber(ARGV[3]) > 0 then
            redis.call('SET', KEYS[1], ARGV[2], 'PX', ARGV[3])
        else
            redis.call('SET', KEYS[1], ARGV[2])
        end
        return 1
        """;

    static final String SLIDING_WINDOW_SCRIPT = """
        local key = KEYS[1]
        local now = tonumber(ARGV[1])
        local windowStart = now - tonumber(ARGV[2])
        local maxCalls = tonumber(ARGV[3])
        redis.call('ZREMRANGEBYSCORE', key, '-inf', '(' .. windowStart)
        local count = redis.call('ZCARD', key)
        if count >= maxCalls then
            return {0, count}
        end
        redis.call('ZADD', key, now, ARGV[4])
        if tonumber(ARGV[5]) > 0 then
            redis.call('PEXPIRE', key, ARGV[5])
        end
        return {1, count + 1}
        """;

    private final RedissonClient client;

    public RedisCounterStore(RedissonClient client) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        this.client = client;
    }

    /**
     * Connects to a single Redis node.
     *
     * @param address e.g. {@code redis://localhost:6379}
     * @param timeout per-command response timeout
     * @param connectTimeout TCP connect timeout
     */
    public static RedisCounterStore connect(String address, Duration timeout, Duration connectTimeout) {
        Config config = new Config();
        config.setCodec(StringCodec.INSTANCE);
        config.useSingleServer()
            .setAddress(address)
            .setTimeout((int) timeout.toMillis())
            .setConnectTimeout((int) connectTimeout.toMillis())
            .setRetryAttempts(0);
        log.info("Connecting counter store to {} (timeout {} ms)", address, timeout.toMillis());
        return new RedisCounterStore(Redisson.create(config));
    }

    @Override
    public long increment(String key, long amount, Duration ttl) {
        return evalLong("increment", key, INCREMENT_SCRIPT, Long.toString(amount), ttlMillis(ttl));
    }

    @Override
    public long get(String key) {
        return evalLong("get", key, GET_SCRIPT);
    }

    @Override
    public void delete(String key) {
        call("delete", key, () -> client.getKeys().delete(key));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return evalLong("setIfAbsent", key, SET_IF_ABSENT_SCRIPT, value, ttlMillis(ttl)) == 1L;
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return evalLong("expire", key, "return redis.call('PEXPIRE', KEYS[1], ARGV[1])",
            ttlMillis(ttl)) == 1L;
    }

    @Override
    public boolean compareAndSet(String key, long expected, long update, Duration ttl) {
        return evalLong("compareAndSet", key, COMPARE_AND_SET_SCRIPT,
            Long.toString(expected), Long.toString(update), ttlMillis(ttl)) == 1L;
    }

    @Override
    public WindowAdmission slidingWindowAdmit(String key, long nowMillis, long windowMillis,
                                              int maxCalls, String marker, Duration ttl) {
        List<Object> reply = call("slidingWindowAdmit", key, () -> script().eval(
            RScript.Mode.READ_WRITE,
            SLIDING_WINDOW_SCRIPT,
            RScript.ReturnType.MULTI,
            keys(key),
            Long.toString(nowMillis),
            Long.toString(windowMillis),
            Integer.toString(maxCalls),
            marker,
            ttlMillis(ttl)));
        if (reply == null || reply.size() != 2) {
            throw new StoreUnavailableException("unexpected sliding window reply for " + key + ": " + reply);
        }
        return new WindowAdmission(toLong(reply.get(0)) == 1L, toLong(reply.get(1)));
    }

    @Override
    public boolean removeMarker(String key, String marker) {
        return evalLong("removeMarker", key, "return redis.call('ZREM', KEYS[1], ARGV[1])", marker) > 0L;
    }

    @Override
    public boolean ping() {
        try {
            return client.getNodesGroup().pingAll();
        } catch (RedisException e) {
            log.warn("Counter store ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        client.shutdown();
    }

    private long evalLong(String operation, String key, String lua, String... args) {
        Object reply = call(operation, key, () -> script().eval(
            RScript.Mode.READ_WRITE,
            lua,
            RScript.ReturnType.INTEGER,
            keys(key),
            (Object[]) args));
        return toLong(reply);
    }

    private <T> T call(String operation, String key, Supplier<T> command) {
        try {
            return command.get();
        } catch (RedisException e) {
            throw new StoreUnavailableException(operation + " failed for key " + key, e);
        }
    }

    private RScript script() {
        return client.getScript(StringCodec.INSTANCE);
    }

    private static List<Object> keys(String key) {
        return Collections.singletonList(key);
    }

    private static String ttlMillis(Duration ttl) {
        return ttl == null ? "0" : Long.toString(ttl.toMillis());
    }

    private static long toLong(Object reply) {
        if (reply instanceof Number number) {
            return number.longValue();
        }
        if (reply == null) {
            return 0L;
        }
        return Long.parseLong(reply.toString());
    }
}
