package com.rpc.pooling.pool;

import com.rpc.pooling.connection.TransportOptions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable configuration for a {@link ConnectionPool} to a single remote target.
 */
public class PoolConfig {

    public static final int DEFAULT_POOL_SIZE = 5;
    public static final int DEFAULT_MAX_MESSAGE_SIZE = 10 * 1024 * 1024;

    private final String target;
    private final int poolSize;
    private final Duration keepaliveTime;
    private final Duration keepaliveTimeout;
    private final Duration maxConnectionIdle;
    private final Duration maxConnectionAge;
    private final Duration maxConnectionAgeGrace;
    private final int maxMessageSize;
    private final Duration repairInterval;
    private final List<Object> extraOptions;

    private PoolConfig(Builder builder) {
        this.target = builder.target;
        this.poolSize = builder.poolSize;
        this.keepaliveTime = builder.keepaliveTime;
        this.keepaliveTimeout = builder.keepaliveTimeout;
        this.maxConnectionIdle = builder.maxConnectionIdle;
        this.maxConnectionAge = builder.maxConnectionAge;
        this.maxConnectionAgeGrace = builder.maxConnectionAgeGrace;
        this.maxMessageSize = builder.maxMessageSize;
        this.repairInterval = builder.repairInterval;
        this.extraOptions = List.copyOf(builder.extraOptions);
    }

    public String getTarget() { return target; }
    public int getPoolSize() { return poolSize; }
    public Duration getKeepaliveTime() { return keepaliveTime; }
    public Duration getKeepaliveTimeout() { return keepaliveTimeout; }
    public Duration getMaxConnectionIdle() { return maxConnectionIdle; }
    public Duration getMaxConnectionAge() { return maxConnectionAge; }
    public Duration getMaxConnectionAgeGrace() { return maxConnectionAgeGrace; }
    public int getMaxMessageSize() { return maxMessageSize; }
    public Duration getRepairInterval() { return repairInterval; }
    public List<Object> getExtraOptions() { return extraOptions; }

    /**
     * Builds the transport options shared by every connection dialed for this config.
     */
    public TransportOptions toTransportOptions() {
        return new TransportOptions(keepaliveTime, keepaliveTimeout, maxConnectionIdle,
                maxConnectionAge, maxConnectionAgeGrace, maxMessageSize, extraOptions);
    }

    /**
     * Returns a configuration for {@code target} with every other setting at its default.
     */
    public static PoolConfig defaults(String target) {
        return builder().target(target).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this configuration.
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .target(target)
                .poolSize(poolSize)
                .keepaliveTime(keepaliveTime)
                .keepaliveTimeout(keepaliveTimeout)
                .maxConnectionIdle(maxConnectionIdle)
                .maxConnectionAge(maxConnectionAge)
                .maxConnectionAgeGrace(maxConnectionAgeGrace)
                .maxMessageSize(maxMessageSize)
                .repairInterval(repairInterval);
        builder.extraOptions.addAll(extraOptions);
        return builder;
    }

    public static class Builder {
        private String target;
        private int poolSize = DEFAULT_POOL_SIZE;
        private Duration keepaliveTime = Duration.ofSeconds(30);
        private Duration keepaliveTimeout = Duration.ofSeconds(10);
        private Duration maxConnectionIdle = Duration.ofMinutes(5);
        private Duration maxConnectionAge = Duration.ofMinutes(30);
        private Duration maxConnectionAgeGrace = Duration.ofMinutes(5);
        private int maxMessageSize = DEFAULT_MAX_MESSAGE_SIZE;
        private Duration repairInterval = Duration.ofSeconds(30);
        private final List<Object> extraOptions = new ArrayList<>();

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        /**
         * Sets the number of connections. Values {@code <= 0} fall back to {@link PoolConfig#DEFAULT_POOL_SIZE}.
         */
        public Builder poolSize(int poolSize) {
            this.poolSize = poolSize > 0 ? poolSize : DEFAULT_POOL_SIZE;
            return this;
        }

        public Builder keepaliveTime(Duration keepaliveTime) {
            this.keepaliveTime = requireNonNegative(keepaliveTime, "keepaliveTime");
            return this;
        }

        public Builder keepaliveTimeout(Duration keepaliveTimeout) {
            this.keepaliveTimeout = requireNonNegative(keepaliveTimeout, "keepaliveTimeout");
            return this;
        }

        public Builder maxConnectionIdle(Duration maxConnectionIdle) {
            this.maxConnectionIdle = requireNonNegative(maxConnectionIdle, "maxConnectionIdle");
            return this;
        }

        public Builder maxConnectionAge(Duration maxConnectionAge) {
            this.maxConnectionAge = requireNonNegative(maxConnectionAge, "maxConnectionAge");
            return this;
        }

        public Builder maxConnectionAgeGrace(Duration maxConnectionAgeGrace) {
            this.maxConnectionAgeGrace = requireNonNegative(maxConnectionAgeGrace, "maxConnectionAgeGrace");
            return this;
        }

        public Builder maxMessageSize(int maxMessageSize) {
            if (maxMessageSize <= 0) throw new IllegalArgumentException("maxMessageSize must be > 0");
            this.maxMessageSize = maxMessageSize;
            return this;
        }

        public Builder repairInterval(Duration repairInterval) {
            if (repairInterval == null || repairInterval.isZero() || repairInterval.isNegative()) {
                throw new IllegalArgumentException("repairInterval must be > 0");
            }
            this.repairInterval = repairInterval;
            return this;
        }

        /**
         * Adds a transport-specific option (credentials, interceptors, ...) passed to the
         * {@link com.rpc.pooling.connection.ConnectionFactory} unmodified.
         */
        public Builder extraOption(Object option) {
            if (option == null) throw new IllegalArgumentException("extra option must not be null");
            this.extraOptions.add(option);
            return this;
        }

        public Builder extraOptions(List<?> options) {
            if (options != null) {
                options.forEach(this::extraOption);
            }
            return this;
        }

        public PoolConfig build() {
            if (target == null || target.isBlank()) {
                throw new IllegalArgumentException("target must not be blank");
            }
            return new PoolConfig(this);
        }

        private static Duration requireNonNegative(Duration value, String name) {
            if (value == null || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be >= 0");
            }
            return value;
        }
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "target='" + target + '\'' +
                ", poolSize=" + poolSize +
                ", keepaliveTime=" + keepaliveTime +
                ", keepaliveTimeout=" + keepaliveTimeout +
                ", maxConnectionIdle=" + maxConnectionIdle +
                ", maxConnectionAge=" + maxConnectionAge +
                ", maxConnectionAgeGrace=" + maxConnectionAgeGrace +
                ", maxMessageSize=" + maxMessageSize +
                ", repairInterval=" + repairInterval +
                ", extraOptions=" + extraOptions.size() +
                '}';
    }
}
