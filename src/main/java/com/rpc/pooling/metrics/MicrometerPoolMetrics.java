package com.rpc.pooling.metrics;

import com.rpc.pooling.pool.ConnectionPool;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link PoolMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code rpc.pool.repair.attempts} - Counter (tag: target)</li>
 *   <li>{@code rpc.pool.repair.successes} - Counter (tag: target)</li>
 *   <li>{@code rpc.pool.repair.failures} - Counter (tag: target)</li>
 *   <li>{@code rpc.pool.healthy.wait} - Timer (tag: target)</li>
 *   <li>{@code rpc.pool.healthy.exhausted} - Counter (tag: target)</li>
 *   <li>{@code rpc.pool.connections.healthy} - Gauge (tags: service, target)</li>
 *   <li>{@code rpc.pool.connections.total} - Gauge (tags: service, target)</li>
 * </ul>
 */
public class MicrometerPoolMetrics implements PoolMetrics {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();

    public MicrometerPoolMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Binds the pool gauges for {@code serviceName} to {@code pool}. Micrometer keeps the first
     * gauge registered under a name and tag set, so gauges left by an earlier pool for the same
     * service and target (for example one owned by a closed manager sharing this registry) are
     * removed first.
     */
    @Override
    public void registerPool(String serviceName, ConnectionPool pool) {
        Tags tags = Tags.of("service", serviceName, "target", pool.target());
        replaceGauge(Gauge.builder("rpc.pool.connections.healthy", pool, p -> p.getStats().healthyCount())
                .description("Connections currently READY or IDLE")
                .tags(tags)
                .strongReference(false), "rpc.pool.connections.healthy", tags);
        replaceGauge(Gauge.builder("rpc.pool.connections.total", pool, ConnectionPool::size)
                .description("Configured number of connections")
                .tags(tags)
                .strongReference(false), "rpc.pool.connections.total", tags);
    }

    private void replaceGauge(Gauge.Builder<ConnectionPool> builder, String name, Tags tags) {
        for (Gauge stale : registry.find(name).tags(tags).gauges()) {
            registry.remove(stale);
        }
        builder.register(registry);
    }

    @Override
    public void recordRepairAttempt(String target) {
        counter("rpc.pool.repair.attempts", "Broken connections the repair task tried to replace", target)
                .increment();
    }

    @Override
    public void recordRepairSuccess(String target) {
        counter("rpc.pool.repair.successes", "Broken connections replaced by the repair task", target)
                .increment();
    }

    @Override
    public void recordRepairFailure(String target) {
        counter("rpc.pool.repair.failures", "Replacement dials that failed", target)
                .increment();
    }

    @Override
    public void recordHealthyWait(String target, Duration waited) {
        Timer timer = timerCache.computeIfAbsent(target, t ->
                Timer.builder("rpc.pool.healthy.wait")
                        .description("Time spent selecting a healthy connection")
                        .tag("target", t)
                        .register(registry));
        timer.record(waited);
    }

    @Override
    public void recordNoHealthyConnection(String target) {
        counter("rpc.pool.healthy.exhausted", "Healthy selections that found no usable connection", target)
                .increment();
    }

    private Counter counter(String name, String description, String target) {
        return counterCache.computeIfAbsent(name + ":" + target, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("target", target)
                        .register(registry));
    }
}
