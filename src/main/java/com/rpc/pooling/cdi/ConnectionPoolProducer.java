package com.rpc.pooling.cdi;

import com.rpc.pooling.grpc.GrpcConnectionFactory;
import com.rpc.pooling.health.PoolManagerHealthCheck;
import com.rpc.pooling.manager.ConnectionPoolManager;
import com.rpc.pooling.manager.ServicePoolConfig;
import com.rpc.pooling.metrics.MicrometerPoolMetrics;
import com.rpc.pooling.metrics.NoOpPoolMetrics;
import com.rpc.pooling.metrics.PoolMetrics;
import com.rpc.pooling.pool.PoolConfig;
import com.rpc.pooling.pool.RoundRobinConnectionPool;
import com.rpc.pooling.scheduling.ExecutorTaskScheduler;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires a {@link ConnectionPoolManager} from MicroProfile Config properties.
 *
 * <p>Pools for every configured downstream service are created at startup; a service
 * whose pool cannot be built fails the deployment before it accepts traffic.
 * Services without a target are treated as not deployed.</p>
 *
 * <h2>Configuration</h2>
 * <pre>
 * rpc-pool:
 *   default-pool-size: 5
 *   repair-interval-seconds: 30
 *   scheduler-threads: 1
 *   services:
 *     user-service:
 *       target: user-service:50051
 *     order-service:
 *       target: order-service:50053
 * </pre>
 */
@ApplicationScoped
public class ConnectionPoolProducer {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPoolProducer.class);

    // ── Pool defaults ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "rpc-pool.default-pool-size", defaultValue = "5")
    int defaultPoolSize;

    @Inject
    @ConfigProperty(name = "rpc-pool.repair-interval-seconds", defaultValue = "30")
    long repairIntervalSeconds;

    @Inject
    @ConfigProperty(name = "rpc-pool.scheduler-threads", defaultValue = "1")
    int schedulerThreads;

    @Inject
    @ConfigProperty(name = "rpc-pool.close-timeout-seconds", defaultValue = "5")
    long closeTimeoutSeconds;

    // ── Downstream services ───────────────────────────────────

    @Inject
    @ConfigProperty(name = "rpc-pool.services.user-service.target")
    Optional<String> userServiceTarget;

    @Inject
    @ConfigProperty(name = "rpc-pool.services.product-service.target")
    Optional<String> productServiceTarget;

    @Inject
    @ConfigProperty(name = "rpc-pool.services.order-service.target")
    Optional<String> orderServiceTarget;

    @Inject
    @ConfigProperty(name = "rpc-pool.services.payment-service.target")
    Optional<String> paymentServiceTarget;

    @Inject
    @ConfigProperty(name = "rpc-pool.services.inventory-service.target")
    Optional<String> inventoryServiceTarget;

    @Inject
    @ConfigProperty(name = "rpc-pool.services.notification-service.target")
    Optional<String> notificationServiceTarget;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    private ExecutorTaskScheduler scheduler;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ConnectionPoolManager connectionPoolManager() {
        scheduler = new ExecutorTaskScheduler("rpc-pool-repair", schedulerThreads);
        PoolMetrics metrics = createMetrics();
        GrpcConnectionFactory connectionFactory = new GrpcConnectionFactory(Duration.ofSeconds(closeTimeoutSeconds));
        Duration repairInterval = Duration.ofSeconds(repairIntervalSeconds);

        ConnectionPoolManager manager = new ConnectionPoolManager(
                (name, config) -> new RoundRobinConnectionPool(
                        config.toBuilder().repairInterval(repairInterval).build(),
                        connectionFactory, scheduler, metrics),
                metrics);

        ServicePoolConfig services = servicePoolConfig();
        log.info("Producing ConnectionPoolManager: services={} defaultPoolSize={} repairInterval={}",
                services.getServices().keySet(), services.getDefaultPoolSize(), repairInterval);
        try {
            manager.createCommonPools(services);
        } catch (RuntimeException e) {
            log.error("Failed to provision downstream connection pools", e);
            closeQuietly(manager);
            scheduler.close();
            throw e;
        }
        return manager;
    }

    public void closeManager(@Disposes ConnectionPoolManager manager) {
        log.info("Closing ConnectionPoolManager");
        try {
            manager.close();
        } finally {
            if (scheduler != null) {
                scheduler.close();
            }
        }
    }

    @Produces
    @ApplicationScoped
    public PoolManagerHealthCheck poolManagerHealthCheck(ConnectionPoolManager manager) {
        return new PoolManagerHealthCheck(manager);
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    ServicePoolConfig servicePoolConfig() {
        ServicePoolConfig.Builder builder = ServicePoolConfig.builder()
                .defaultPoolSize(defaultPoolSize > 0 ? defaultPoolSize : PoolConfig.DEFAULT_POOL_SIZE);
        userServiceTarget.ifPresent(builder::userService);
        productServiceTarget.ifPresent(builder::productService);
        orderServiceTarget.ifPresent(builder::orderService);
        paymentServiceTarget.ifPresent(builder::paymentService);
        inventoryServiceTarget.ifPresent(builder::inventoryService);
        notificationServiceTarget.ifPresent(builder::notificationService);
        return builder.build();
    }

    private PoolMetrics createMetrics() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Connection pool metrics enabled (Micrometer)");
            return new MicrometerPoolMetrics(meterRegistry.get());
        }
        log.info("Connection pool metrics disabled: no MeterRegistry available");
        return new NoOpPoolMetrics();
    }

    private static void closeQuietly(ConnectionPoolManager manager) {
        try {
            manager.close();
        } catch (RuntimeException e) {
            log.warn("Error closing partially provisioned pools: {}", e.getMessage());
        }
    }
}
