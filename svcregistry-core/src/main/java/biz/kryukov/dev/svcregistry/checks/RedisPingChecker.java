package biz.kryukov.dev.svcregistry.checks;

import biz.kryukov.dev.svcregistry.CheckConnectionException;
import biz.kryukov.dev.svcregistry.CheckDnsException;
import biz.kryukov.dev.svcregistry.CheckException;
import biz.kryukov.dev.svcregistry.CheckOutcome;
import biz.kryukov.dev.svcregistry.CheckProtocolException;
import biz.kryukov.dev.svcregistry.CheckTimeoutException;
import biz.kryukov.dev.svcregistry.EndpointView;
import biz.kryukov.dev.svcregistry.Protocol;
import biz.kryukov.dev.svcregistry.ServiceChecker;

import redis.clients.jedis.Jedis;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisDataException;

import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Redis health checker: PING/PONG over a fresh, non-pooled Jedis connection.
 *
 * <p>Every check opens its own connection with the service's timeout, so a result
 * reflects raw connectivity rather than the state of an application client pool.</p>
 */
public final class RedisPingChecker implements ServiceChecker {

    private final String password;
    private final int database;

    private RedisPingChecker(Builder builder) {
        this.password = builder.password;
        this.database = builder.database;
    }

    @Override
    public CheckOutcome check(EndpointView endpoint) {
        long startNs = System.nanoTime();
        int timeoutMs = (int) endpoint.endpoint().timeout().toMillis();
        try (Jedis jedis = new Jedis(endpoint.host(), endpoint.port(), timeoutMs)) {
            if (password != null && !password.isEmpty()) {
                jedis.auth(password);
            }
            if (database > 0) {
                jedis.select(database);
            }
            String result = jedis.ping();
            if (!"PONG".equals(result)) {
                throw new CheckProtocolException("Redis PING returned: " + result);
            }
            return CheckOutcome.healthy(elapsed(startNs));
        } catch (JedisDataException e) {
            return CheckOutcome.failure(
                    new CheckProtocolException("Redis error: " + e.getMessage(), e),
                    elapsed(startNs));
        } catch (JedisConnectionException e) {
            return CheckOutcome.failure(connectionFailure(e), elapsed(startNs));
        } catch (Exception e) {
            return CheckOutcome.failure(e, elapsed(startNs));
        }
    }

    /**
     * Maps a Jedis connection failure to a check exception by its underlying cause.
     * Jedis reports per-address connect failures as suppressed exceptions.
     */
    static CheckException connectionFailure(JedisConnectionException e) {
        List<Throwable> causes = new ArrayList<>(List.of(e.getSuppressed()));
        for (Throwable t = e.getCause(); t != null && t != e; t = t.getCause()) {
            causes.add(t);
        }
        for (Throwable t : causes) {
            if (t instanceof UnknownHostException) {
                return new CheckDnsException("Redis host not found: " + t.getMessage(), e);
            }
            if (t instanceof SocketTimeoutException) {
                return new CheckTimeoutException("Redis timed out: " + t.getMessage(), e);
            }
        }
        return new CheckConnectionException("Redis connection failed: " + e.getMessage(), e);
    }

    private static Duration elapsed(long startNs) {
        return Duration.ofNanos(System.nanoTime() - startNs);
    }

    @Override
    public Set<Protocol> protocols() {
        return Set.of(Protocol.TCP);
    }

    public static RedisPingChecker create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String password;
        private int database;

        private Builder() {}

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder database(int database) {
            this.database = database;
            return this;
        }

        public RedisPingChecker build() {
            return new RedisPingChecker(this);
        }
    }
}
