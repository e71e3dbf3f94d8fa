package com.rpc.pooling.pool;

import com.rpc.pooling.connection.Connection;
import com.rpc.pooling.connection.ConnectionException;
import com.rpc.pooling.connection.ConnectionFactory;
import com.rpc.pooling.connection.ConnectivityState;
import com.rpc.pooling.metrics.MicrometerPoolMetrics;
import com.rpc.pooling.metrics.NoOpPoolMetrics;
import com.rpc.pooling.scheduling.TaskScheduler;
import com.rpc.pooling.testing.FakeConnection;
import com.rpc.pooling.testing.FakeConnectionFactory;
import com.rpc.pooling.testing.ManualTaskScheduler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RoundRobinConnectionPool Tests")
class RoundRobinConnectionPoolTest {

    private static final String TARGET = "order-service:50053";

    private final FakeConnectionFactory factory = new FakeConnectionFactory();
    private final ManualTaskScheduler scheduler = new ManualTaskScheduler();
    private final List<RoundRobinConnectionPool> pools = new ArrayList<>();

    @AfterEach
    void closePools() {
        for (RoundRobinConnectionPool pool : pools) {
            try {
                pool.close();
            } catch (PoolCloseException ignored) {
                // some tests make connections fail on close
            }
        }
    }

    private RoundRobinConnectionPool newPool(int size) {
        RoundRobinConnectionPool pool = new RoundRobinConnectionPool(
                PoolConfig.builder().target(TARGET).poolSize(size).build(),
                factory, scheduler, new NoOpPoolMetrics());
        pools.add(pool);
        return pool;
    }

    private FakeConnection slot(RoundRobinConnectionPool pool, int index) {
        return (FakeConnection) pool.getAll().get(index);
    }

    /**
     * Delegates to {@link #factory}; every dial after the first {@code initialDials} signals
     * {@code dialing} and then holds until {@code release} opens.
     */
    private ConnectionFactory gatedAfterInit(int initialDials, AtomicInteger dials,
                                             CountDownLatch dialing, CountDownLatch release) {
        return (target, options) -> {
            if (dials.incrementAndGet() > initialDials) {
                dialing.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return factory.connect(target, options);
        };
    }

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Should dial exactly poolSize connections to the target")
        void dialsPoolSizeConnections() {
            RoundRobinConnectionPool pool = newPool(4);

            assertEquals(4, pool.size());
            assertEquals(TARGET, pool.target());
            assertEquals(4, factory.attempts());
            assertEquals(4, pool.getAll().size());
            pool.getAll().forEach(c -> assertEquals(TARGET, c.target()));
        }

        @Test
        @DisplayName("Should default to 5 connections when pool size is not positive")
        void defaultsPoolSize() {
            RoundRobinConnectionPool pool = newPool(0);
            assertEquals(5, pool.size());
            assertEquals(5, factory.attempts());
        }

        @Test
        @DisplayName("Should share one set of transport options across all dials")
        void sharesTransportOptions() {
            newPool(3);
            assertEquals(3, factory.optionsSeen().size());
            assertEquals(1, new HashSet<>(factory.optionsSeen()).size());
        }

        @Test
        @DisplayName("Should schedule exactly one repair task at the configured interval")
        void schedulesOneRepairTask() {
            new RoundRobinConnectionPool(
                    PoolConfig.builder().target(TARGET).repairInterval(Duration.ofSeconds(7)).build(),
                    factory, scheduler, null).close();

            assertEquals(1, scheduler.registered());
            assertEquals(Duration.ofSeconds(7), scheduler.intervalOf(0));
        }

        @Test
        @DisplayName("Should close the k-1 created connections when the k-th dial fails")
        void constructionIsAllOrNothing() {
            factory.failOnAttempt(3);

            ConnectionException e = assertThrows(ConnectionException.class, () -> newPool(5));

            assertTrue(e.getMessage().contains("connection 2"));
            assertEquals(3, factory.attempts());
            assertEquals(2, factory.created().size());
            factory.created().forEach(c -> assertEquals(1, c.closeCalls()));
            assertEquals(0, scheduler.registered(), "No repair task for a failed pool");
        }

        @Test
        @DisplayName("Should close created connections when the repair task cannot be scheduled")
        void closesConnectionsWhenSchedulingFails() {
            TaskScheduler broken = (name, task, interval) -> {
                throw new IllegalStateException("scheduler shut down");
            };

            assertThrows(ConnectionException.class, () -> new RoundRobinConnectionPool(
                    PoolConfig.defaults(TARGET), factory, broken, new NoOpPoolMetrics()));
            assertEquals(5, factory.created().size());
            factory.created().forEach(c -> assertTrue(c.isClosed()));
        }

        @Test
        @DisplayName("Should reject a factory returning null")
        void rejectsNullConnection() {
            AtomicInteger calls = new AtomicInteger();
            ConnectionFactory nullOnSecond = (target, options) ->
                    calls.incrementAndGet() == 2 ? null : factory.connect(target, options);

            assertThrows(ConnectionException.class, () -> new RoundRobinConnectionPool(
                    PoolConfig.defaults(TARGET), nullOnSecond, scheduler, new NoOpPoolMetrics()));
            assertTrue(factory.created().get(0).isClosed());
        }

        @Test
        @DisplayName("Should run its own repair thread when no scheduler is given")
        void ownsSchedulerWhenNoneGiven() {
            RoundRobinConnectionPool pool = new RoundRobinConnectionPool(PoolConfig.defaults(TARGET), factory);
            assertEquals(5, pool.size());
            assertDoesNotThrow(pool::close);
            assertTrue(pool.isClosed());
        }
    }

    @Nested
    @DisplayName("Round-robin selection")
    class RoundRobinTests {

        @Test
        @DisplayName("N calls should return N distinct slots, then repeat the same cycle")
        void visitsEverySlotOncePerCycle() {
            RoundRobinConnectionPool pool = newPool(4);
            List<Connection> all = pool.getAll();

            List<Connection> firstCycle = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                firstCycle.add(pool.get());
            }
            List<Connection> secondCycle = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                secondCycle.add(pool.get());
            }

            assertEquals(all, firstCycle);
            assertEquals(firstCycle, secondCycle);
        }

        @Test
        @DisplayName("Should hand out every slot equally under concurrent callers")
        void fairUnderConcurrency() throws Exception {
            RoundRobinConnectionPool pool = newPool(4);
            int threads = 8;
            int callsPerThread = 500;
            Map<Connection, AtomicInteger> counts = new ConcurrentHashMap<>();
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int t = 0; t < threads; t++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        for (int i = 0; i < callsPerThread; i++) {
                            counts.computeIfAbsent(pool.get(), c -> new AtomicInteger()).incrementAndGet();
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(4, counts.size());
            counts.values().forEach(count -> assertEquals(threads * callsPerThread / 4, count.get()));
        }

        @Test
        @DisplayName("Should return connections regardless of their state")
        void ignoresState() {
            factory.initialState(ConnectivityState.TRANSIENT_FAILURE);
            RoundRobinConnectionPool pool = newPool(2);
            assertEquals(ConnectivityState.TRANSIENT_FAILURE, pool.get().getState());
        }

        @Test
        @DisplayName("Should reject selection after close")
        void rejectsAfterClose() {
            RoundRobinConnectionPool pool = newPool(2);
            pool.close();
            assertThrows(IllegalStateException.class, pool::get);
            assertThrows(IllegalStateException.class, () -> pool.getHealthy(Duration.ofMillis(10)));
            assertThrows(IllegalStateException.class, pool::getAll);
        }
    }

    @Nested
    @DisplayName("Health-aware selection")
    class HealthySelectionTests {

        @Test
        @DisplayName("Should return the only READY slot immediately")
        void returnsReadySlotWithoutWaiting() {
            factory.initialState(ConnectivityState.TRANSIENT_FAILURE);
            RoundRobinConnectionPool pool = newPool(4);
            slot(pool, 0).setState(ConnectivityState.READY);

            long start = System.nanoTime();
            Connection healthy = pool.getHealthy(Duration.ofSeconds(5));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertSame(slot(pool, 0), healthy);
            assertTrue(elapsedMs < 1000, "Should not wait, took " + elapsedMs + "ms");
        }

        @Test
        @DisplayName("Should scan from the cursor and accept IDLE connections")
        void scansFromCursor() {
            factory.initialState(ConnectivityState.TRANSIENT_FAILURE);
            RoundRobinConnectionPool pool = newPool(4);
            slot(pool, 1).setState(ConnectivityState.READY);
            slot(pool, 3).setState(ConnectivityState.IDLE);
            pool.get();
            pool.get();

            assertSame(slot(pool, 3), pool.getHealthy(Duration.ofMillis(100)));
        }

        @Test
        @DisplayName("Should not advance the round-robin cursor")
        void doesNotMoveCursor() {
            RoundRobinConnectionPool pool = newPool(3);
            pool.getHealthy(Duration.ofMillis(100));
            pool.getHealthy(Duration.ofMillis(100));

            assertSame(slot(pool, 0), pool.get());
        }

        @Test
        @DisplayName("Should fail at the deadline when every slot stays in TRANSIENT_FAILURE")
        void exhaustionAtDeadline() {
            factory.initialState(ConnectivityState.TRANSIENT_FAILURE);
            RoundRobinConnectionPool pool = newPool(3);

            long start = System.nanoTime();
            NoHealthyConnectionException e = assertThrows(NoHealthyConnectionException.class,
                    () -> pool.getHealthy(Duration.ofMillis(300)));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertEquals(TARGET, e.getTarget());
            assertTrue(elapsedMs >= 290, "Returned before the deadline: " + elapsedMs + "ms");
            assertTrue(elapsedMs < 2000, "Returned long after the deadline: " + elapsedMs + "ms");
        }

        @Test
        @DisplayName("Should return a connection that recovers while waiting")
        void waitsForRecovery() throws Exception {
            factory.initialState(ConnectivityState.TRANSIENT_FAILURE);
            RoundRobinConnectionPool pool = newPool(3);
            FakeConnection first = slot(pool, 0);

            Thread recover = new Thread(() -> {
                try {
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                first.setState(ConnectivityState.READY);
            });
            recover.start();

            assertSame(first, pool.getHealthy(Duration.ofSeconds(5)));
            recover.join();
        }

        @Test
        @DisplayName("Should fail with the interrupt flag preserved when interrupted")
        void interruptCancelsWait() {
            factory.initialState(ConnectivityState.TRANSIENT_FAILURE);
            RoundRobinConnectionPool pool = newPool(2);

            Thread.currentThread().interrupt();
            try {
                NoHealthyConnectionException e = assertThrows(NoHealthyConnectionException.class,
                        () -> pool.getHealthy(Duration.ofSeconds(5)));
                assertInstanceOf(InterruptedException.class, e.getCause());
                assertTrue(Thread.currentThread().isInterrupted());
            } finally {
                Thread.interrupted();
            }
        }
    }

    @Nested
    @DisplayName("Background repair")
    class RepairTests {

        @Test
        @DisplayName("Should replace a SHUTDOWN slot with a fresh connection after one tick")
        void replacesShutdownSlot() {
            RoundRobinConnectionPool pool = newPool(3);
            FakeConnection broken = slot(pool, 1);
            broken.setState(ConnectivityState.SHUTDOWN);

            scheduler.tick();

            Connection replacement = pool.getAll().get(1);
            assertNotSame(broken, replacement);
            assertEquals(TARGET, replacement.target());
            assertEquals(1, broken.closeCalls());
            assertNotEquals(ConnectivityState.SHUTDOWN, pool.getStats().connections().get(1).state());
        }

        @Test
        @DisplayName("Should replace TRANSIENT_FAILURE slots and leave healthy ones alone")
        void replacesOnlyBrokenSlots() {
            RoundRobinConnectionPool pool = newPool(4);
            List<Connection> before = pool.getAll();
            slot(pool, 0).setState(ConnectivityState.TRANSIENT_FAILURE);
            slot(pool, 2).setState(ConnectivityState.CONNECTING);
            slot(pool, 3).setState(ConnectivityState.IDLE);

            scheduler.tick();

            List<Connection> after = pool.getAll();
            assertNotSame(before.get(0), after.get(0));
            assertSame(before.get(1), after.get(1));
            assertSame(before.get(2), after.get(2));
            assertSame(before.get(3), after.get(3));
            assertEquals(5, factory.attempts());
        }

        @Test
        @DisplayName("Should keep the slot and retry on the next tick when the re-dial fails")
        void retriesFailedRepair() {
            RoundRobinConnectionPool pool = newPool(2);
            FakeConnection broken = slot(pool, 0);
            broken.setState(ConnectivityState.TRANSIENT_FAILURE);
            factory.failAll(true);

            assertDoesNotThrow(scheduler::tick);
            assertSame(broken, pool.getAll().get(0));
            assertFalse(broken.isClosed());

            assertDoesNotThrow(scheduler::tick);
            assertSame(broken, pool.getAll().get(0));

            factory.failAll(false);
            scheduler.tick();
            assertNotSame(broken, pool.getAll().get(0));
            assertTrue(broken.isClosed());
        }

        @Test
        @DisplayName("Should record repair attempts, failures and successes")
        void recordsRepairMetrics() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            RoundRobinConnectionPool pool = new RoundRobinConnectionPool(
                    PoolConfig.builder().target(TARGET).poolSize(2).build(),
                    factory, scheduler, new MicrometerPoolMetrics(registry));
            pools.add(pool);
            slot(pool, 0).setState(ConnectivityState.SHUTDOWN);

            factory.failAll(true);
            scheduler.tick();
            factory.failAll(false);
            scheduler.tick();

            assertEquals(2.0, registry.get("rpc.pool.repair.attempts").tag("target", TARGET).counter().count());
            assertEquals(1.0, registry.get("rpc.pool.repair.failures").tag("target", TARGET).counter().count());
            assertEquals(1.0, registry.get("rpc.pool.repair.successes").tag("target", TARGET).counter().count());
        }

        @Test
        @DisplayName("A slow re-dial should not block selection")
        void slowRepairDoesNotBlockSelection() throws Exception {
            CountDownLatch dialing = new CountDownLatch(1);
            CountDownLatch releaseDial = new CountDownLatch(1);
            RoundRobinConnectionPool pool = new RoundRobinConnectionPool(
                    PoolConfig.builder().target(TARGET).poolSize(2).build(),
                    gatedAfterInit(2, new AtomicInteger(), dialing, releaseDial), scheduler, new NoOpPoolMetrics());
            pools.add(pool);
            slot(pool, 0).setState(ConnectivityState.TRANSIENT_FAILURE);

            Thread repair = new Thread(scheduler::tick);
            repair.start();
            assertTrue(dialing.await(5, TimeUnit.SECONDS));

            assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
                pool.get();
                pool.getHealthy(Duration.ofMillis(100));
                pool.getStats();
            });

            releaseDial.countDown();
            repair.join(5000);
            assertNotSame(factory.created().get(0), pool.getAll().get(0));
        }

        @Test
        @DisplayName("A repair pass started while another is dialing should do nothing")
        void overlappingRepairIsSkipped() throws Exception {
            CountDownLatch dialing = new CountDownLatch(1);
            CountDownLatch releaseDial = new CountDownLatch(1);
            AtomicInteger dials = new AtomicInteger();
            RoundRobinConnectionPool pool = new RoundRobinConnectionPool(
                    PoolConfig.builder().target(TARGET).poolSize(2).build(),
                    gatedAfterInit(2, dials, dialing, releaseDial), scheduler, new NoOpPoolMetrics());
            pools.add(pool);
            FakeConnection broken = slot(pool, 0);
            broken.setState(ConnectivityState.TRANSIENT_FAILURE);

            Thread repair = new Thread(scheduler::tick);
            repair.start();
            assertTrue(dialing.await(5, TimeUnit.SECONDS));

            assertTimeoutPreemptively(Duration.ofSeconds(2), pool::repair);
            assertEquals(3, dials.get());

            releaseDial.countDown();
            repair.join(5000);
            assertFalse(repair.isAlive());
            assertEquals(3, dials.get());
            assertEquals(3, factory.created().size());
            assertSame(factory.created().get(2), pool.getAll().get(0));
            assertEquals(1, broken.closeCalls());
        }

        @Test
        @DisplayName("close() should wait for an in-flight re-dial and discard its connection")
        void closeWaitsForInFlightRepair() throws Exception {
            CountDownLatch dialing = new CountDownLatch(1);
            CountDownLatch releaseDial = new CountDownLatch(1);
            AtomicInteger dials = new AtomicInteger();
            RoundRobinConnectionPool pool = new RoundRobinConnectionPool(
                    PoolConfig.builder().target(TARGET).poolSize(2).build(),
                    gatedAfterInit(2, dials, dialing, releaseDial), scheduler, new NoOpPoolMetrics());
            pools.add(pool);
            FakeConnection broken = slot(pool, 0);
            broken.setState(ConnectivityState.TRANSIENT_FAILURE);

            Thread repair = new Thread(scheduler::tick);
            repair.start();
            assertTrue(dialing.await(5, TimeUnit.SECONDS));

            Thread closer = new Thread(pool::close);
            closer.start();
            closer.join(200);
            assertTrue(closer.isAlive());
            assertTrue(pool.isClosed());

            releaseDial.countDown();
            repair.join(5000);
            closer.join(5000);
            assertFalse(repair.isAlive());
            assertFalse(closer.isAlive());

            FakeConnection fresh = factory.created().get(2);
            assertEquals(1, fresh.closeCalls());
            assertSame(broken, pool.getAll().get(0));
            assertEquals(1, broken.closeCalls());
            assertEquals(2, pool.getStats().shutdownCount());
        }

        @Test
        @DisplayName("A null re-dial should count as a failed repair")
        void nullRepairIsAFailure() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            AtomicInteger dials = new AtomicInteger();
            ConnectionFactory nullAfterInit = (target, options) ->
                    dials.incrementAndGet() > 2 ? null : factory.connect(target, options);
            RoundRobinConnectionPool pool = new RoundRobinConnectionPool(
                    PoolConfig.builder().target(TARGET).poolSize(2).build(),
                    nullAfterInit, scheduler, new MicrometerPoolMetrics(registry));
            pools.add(pool);
            FakeConnection broken = slot(pool, 1);
            broken.setState(ConnectivityState.SHUTDOWN);

            assertDoesNotThrow(scheduler::tick);

            assertSame(broken, pool.getAll().get(1));
            assertFalse(broken.isClosed());
            assertEquals(1.0, registry.get("rpc.pool.repair.failures").tag("target", TARGET).counter().count());
            assertNull(registry.find("rpc.pool.repair.successes").tag("target", TARGET).counter());
        }

        @Test
        @DisplayName("Should not repair after the pool is closed")
        void noRepairAfterClose() {
            RoundRobinConnectionPool pool = newPool(2);
            slot(pool, 0).setState(ConnectivityState.TRANSIENT_FAILURE);
            pool.close();
            int attempts = factory.attempts();

            scheduler.tick();

            assertEquals(attempts, factory.attempts());
            assertEquals(0, scheduler.active());
        }
    }

    @Nested
    @DisplayName("Statistics")
    class StatsTests {

        @Test
        @DisplayName("Should count slots per state in index order")
        void countsStates() {
            RoundRobinConnectionPool pool = newPool(5);
            slot(pool, 1).setState(ConnectivityState.IDLE);
            slot(pool, 2).setState(ConnectivityState.CONNECTING);
            slot(pool, 3).setState(ConnectivityState.TRANSIENT_FAILURE);
            slot(pool, 4).setState(ConnectivityState.SHUTDOWN);

            PoolStats stats = pool.getStats();

            assertEquals(TARGET, stats.target());
            assertEquals(5, stats.poolSize());
            assertEquals(1, stats.readyCount());
            assertEquals(1, stats.idleCount());
            assertEquals(1, stats.connectingCount());
            assertEquals(1, stats.transientFailureCount());
            assertEquals(1, stats.shutdownCount());
            assertEquals(40.0, stats.healthyPercentage(), 0.001);
            for (int i = 0; i < 5; i++) {
                assertEquals(i, stats.connections().get(i).index());
            }
        }

        @Test
        @DisplayName("getAll() should return an immutable snapshot")
        void getAllIsSnapshot() {
            RoundRobinConnectionPool pool = newPool(2);
            List<Connection> all = pool.getAll();
            assertThrows(UnsupportedOperationException.class, () -> all.set(0, all.get(1)));
        }
    }

    @Nested
    @DisplayName("Close")
    class CloseTests {

        @Test
        @DisplayName("Should close every slot and cancel the repair task")
        void closesEverything() {
            RoundRobinConnectionPool pool = newPool(3);
            List<Connection> all = pool.getAll();

            pool.close();

            all.forEach(c -> assertTrue(((FakeConnection) c).isClosed()));
            assertEquals(0, scheduler.active());
            assertTrue(pool.isClosed());
        }

        @Test
        @DisplayName("Closing twice should succeed without closing slots again")
        void closeIsIdempotent() {
            RoundRobinConnectionPool pool = newPool(3);
            List<Connection> all = pool.getAll();

            pool.close();
            assertDoesNotThrow(pool::close);

            all.forEach(c -> assertEquals(1, ((FakeConnection) c).closeCalls()));
        }

        @Test
        @DisplayName("Should attempt every slot and aggregate close failures")
        void aggregatesCloseFailures() {
            RoundRobinConnectionPool pool = newPool(4);
            slot(pool, 0).failOnClose(new IllegalStateException("stuck 0"));
            slot(pool, 2).failOnClose(new IllegalStateException("stuck 2"));
            List<Connection> all = pool.getAll();

            PoolCloseException e = assertThrows(PoolCloseException.class, pool::close);

            assertEquals(2, e.getFailures().size());
            all.forEach(c -> assertEquals(1, ((FakeConnection) c).closeCalls()));
            Set<String> causes = new HashSet<>();
            e.getFailures().forEach(f -> causes.add(f.getCause().getMessage()));
            assertEquals(Set.of("stuck 0", "stuck 2"), causes);
            assertDoesNotThrow(pool::close);
        }
    }
}
