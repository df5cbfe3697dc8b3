package io.fullerstack.inject.registry;

import io.fullerstack.inject.AmbiguousScopeException;
import io.fullerstack.inject.Container;
import io.fullerstack.inject.ContainerFactory;
import io.fullerstack.inject.DuplicateRegistrationException;
import io.fullerstack.inject.container.LightContainer;
import io.fullerstack.inject.scope.ScopeHandle;
import io.fullerstack.inject.testkit.TestServices.SimpleTestService;
import io.fullerstack.inject.testkit.TestServices.TestService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Registration, resolution and ambient scopes racing across threads.
 */
class ContainerRegistryConcurrencyTest {

    private static final int THREADS = 8;

    private final ContainerRegistry registry = new ContainerRegistry();
    private final ExecutorService executor = Executors.newFixedThreadPool(THREADS);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        registry.dispose();
    }

    @Test
    void concurrentRegistrationOfSameNamespaceAdmitsExactlyOne() throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < THREADS; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                try {
                    registry.register(new LightContainer(), "Shared", null);
                    admitted.incrementAndGet();
                } catch (DuplicateRegistrationException e) {
                    rejected.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        assertThat(admitted.get()).isEqualTo(1);
        assertThat(rejected.get()).isEqualTo(THREADS - 1);
        assertThat(registry.containerCount()).isEqualTo(1);
    }

    @Test
    void threadsResolveFromTheirOwnAmbientScope() throws Exception {
        for (int i = 0; i < THREADS; i++) {
            String data = "scope-" + i;
            Container container = ContainerFactory.builder()
                .registry(registry)
                .namespaceScope("Tenant" + i)
                .disposeRegistered(true)
                .detectCycles(false)
                .create();
            container.registerSingletonLazy(TestService.class, () -> new SimpleTestService(data));
        }

        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            int tenant = i;
            futures.add(executor.submit(() -> {
                start.await();
                for (int round = 0; round < 500; round++) {
                    try (ScopeHandle ignored = registry.beginScope("Tenant" + tenant + ".Request")) {
                        if (!registry.resolve(TestService.class).data().equals("scope-" + tenant)) {
                            return false;
                        }
                    }
                }
                return true;
            }));
        }
        start.countDown();

        for (Future<Boolean> future : futures) {
            assertThat(future.get(10, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    void namespaceResolutionSeesRegistrationsMadeByOtherThreads() throws Exception {
        Container root = ContainerFactory.builder()
            .registry(registry)
            .namespaceScope("a")
            .disposeRegistered(true)
            .detectCycles(false)
            .create();
        root.registerSingleton(TestService.class, new SimpleTestService("root"));
        assertThat(registry.resolve(TestService.class, "a.b.c").data()).isEqualTo("root");

        Future<?> registration = executor.submit(() -> {
            Container specific = ContainerFactory.builder()
                .registry(registry)
                .namespaceScope("a.b")
                .disposeRegistered(true)
                .detectCycles(false)
                .create();
            specific.registerSingleton(TestService.class, new SimpleTestService("specific"));
        });
        registration.get(5, TimeUnit.SECONDS);

        assertThat(registry.resolve(TestService.class, "a.b.c").data()).isEqualTo("specific");
    }

    @Test
    void unscopedResolutionNeverSeesChurningContainerAsTheOnlyOne() throws Exception {
        LightContainer permanent = new LightContainer();
        TestService expected = new SimpleTestService("permanent");
        permanent.registerSingleton(TestService.class, expected);
        registry.register(permanent);

        int churners = 2;
        int readers = THREADS - churners;
        AtomicBoolean running = new AtomicBoolean(true);
        CountDownLatch start = new CountDownLatch(1);

        List<Future<Integer>> churn = new ArrayList<>();
        for (int i = 0; i < churners; i++) {
            churn.add(executor.submit(() -> {
                start.await();
                int cycles = 0;
                do {
                    LightContainer transientContainer = new LightContainer();
                    transientContainer.registerSingleton(TestService.class, new SimpleTestService("churn"));
                    registry.register(transientContainer);
                    registry.unregister(transientContainer);
                    cycles++;
                } while (running.get() || cycles < 1_000);
                return cycles;
            }));
        }

        List<Future<int[]>> reads = new ArrayList<>();
        for (int i = 0; i < readers; i++) {
            reads.add(executor.submit(() -> {
                start.await();
                int fromPermanent = 0;
                int ambiguous = 0;
                for (int round = 0; round < 20_000; round++) {
                    try {
                        TestService resolved = registry.resolve(TestService.class);
                        if (resolved != expected) {
                            throw new AssertionError("Resolved from churning container: " + resolved);
                        }
                        fromPermanent++;
                    } catch (AmbiguousScopeException e) {
                        ambiguous++;
                    }
                }
                return new int[] {fromPermanent, ambiguous};
            }));
        }

        start.countDown();
        try {
            for (Future<int[]> read : reads) {
                int[] counts = read.get(30, TimeUnit.SECONDS);
                assertThat(counts[0] + counts[1]).isEqualTo(20_000);
            }
        } finally {
            running.set(false);
        }
        for (Future<Integer> cycles : churn) {
            assertThat(cycles.get(10, TimeUnit.SECONDS)).isPositive();
        }

        assertThat(registry.containerCount()).isEqualTo(1);
        assertThat(registry.resolve(TestService.class)).isSameAs(expected);
    }

    @Test
    void lazySingletonRaceTracksEveryCreatedInstance() throws Exception {
        LightContainer container = new LightContainer(true, false);
        Set<TestService> created = ConcurrentHashMap.newKeySet();
        CountDownLatch inside = new CountDownLatch(THREADS);
        container.registerSingletonLazy(TestService.class, () -> {
            inside.countDown();
            try {
                inside.await(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            TestService service = new ClosingService();
            created.add(service);
            return service;
        });

        CountDownLatch start = new CountDownLatch(1);
        List<Future<TestService>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return container.resolve(TestService.class);
            }));
        }
        start.countDown();
        for (Future<TestService> future : futures) {
            assertThat(future.get(10, TimeUnit.SECONDS)).isIn(created);
        }

        TestService cached = container.resolve(TestService.class);
        assertThat(created).contains(cached);
        assertThat(container.trackedCount()).isEqualTo(created.size());

        container.close();
        assertThat(created).allSatisfy(s -> assertThat(((ClosingService) s).closed).isTrue());
    }

    private static final class ClosingService implements TestService, AutoCloseable {
        private volatile boolean closed;

        @Override
        public String data() {
            return "racy";
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
