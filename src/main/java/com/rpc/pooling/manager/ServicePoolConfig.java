package com.rpc.pooling.manager;

import com.rpc.pooling.pool.PoolConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Targets of the downstream services a process talks to, used by
 * {@link ConnectionPoolManager#createCommonPools(ServicePoolConfig)}.
 * Services with a blank target are treated as not deployed and skipped.
 */
public class ServicePoolConfig {

    public static final String USER_SERVICE = "user-service";
    public static final String PRODUCT_SERVICE = "product-service";
    public static final String ORDER_SERVICE = "order-service";
    public static final String PAYMENT_SERVICE = "payment-service";
    public static final String INVENTORY_SERVICE = "inventory-service";
    public static final String NOTIFICATION_SERVICE = "notification-service";

    /**
     * Well-known downstream services, in provisioning order.
     */
    public static final List<String> COMMON_SERVICES = List.of(
            USER_SERVICE, PRODUCT_SERVICE, ORDER_SERVICE,
            PAYMENT_SERVICE, INVENTORY_SERVICE, NOTIFICATION_SERVICE);

    private final Map<String, ServiceTarget> services;
    private final int defaultPoolSize;

    private ServicePoolConfig(Builder builder) {
        this.services = Collections.unmodifiableMap(new LinkedHashMap<>(builder.services));
        this.defaultPoolSize = builder.defaultPoolSize;
    }

    /**
     * Returns the configured services keyed by name, in registration order.
     */
    public Map<String, ServiceTarget> getServices() { return services; }
    public int getDefaultPoolSize() { return defaultPoolSize; }

    /**
     * Returns the pool configuration for one configured service.
     */
    public PoolConfig poolConfigFor(ServiceTarget service) {
        return PoolConfig.builder()
                .target(service.target())
                .poolSize(defaultPoolSize)
                .extraOptions(service.extraOptions())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Address and transport options of one downstream service.
     *
     * @param target       remote address; blank when the service is not deployed
     * @param extraOptions per-service transport options, e.g. TLS credentials
     */
    public record ServiceTarget(String target, List<Object> extraOptions) {

        public ServiceTarget {
            extraOptions = extraOptions != null ? List.copyOf(extraOptions) : List.of();
        }

        public boolean isConfigured() {
            return target != null && !target.isBlank();
        }
    }

    public static class Builder {
        private final Map<String, ServiceTarget> services = new LinkedHashMap<>();
        private int defaultPoolSize = PoolConfig.DEFAULT_POOL_SIZE;

        public Builder service(String name, String target) {
            return service(name, target, List.of());
        }

        public Builder service(String name, String target, List<?> extraOptions) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("service name must not be blank");
            }
            services.put(name, new ServiceTarget(target, extraOptions != null ? new ArrayList<>(extraOptions) : null));
            return this;
        }

        public Builder userService(String target) { return service(USER_SERVICE, target); }
        public Builder productService(String target) { return service(PRODUCT_SERVICE, target); }
        public Builder orderService(String target) { return service(ORDER_SERVICE, target); }
        public Builder paymentService(String target) { return service(PAYMENT_SERVICE, target); }
        public Builder inventoryService(String target) { return service(INVENTORY_SERVICE, target); }
        public Builder notificationService(String target) { return service(NOTIFICATION_SERVICE, target); }

        /**
         * Sets the pool size used for every service. Values {@code <= 0} fall back to
         * {@link PoolConfig#DEFAULT_POOL_SIZE}.
         */
        public Builder defaultPoolSize(int defaultPoolSize) {
            this.defaultPoolSize = defaultPoolSize > 0 ? defaultPoolSize : PoolConfig.DEFAULT_POOL_SIZE;
            return this;
        }

        public ServicePoolConfig build() {
            return new ServicePoolConfig(this);
        }
    }
}
