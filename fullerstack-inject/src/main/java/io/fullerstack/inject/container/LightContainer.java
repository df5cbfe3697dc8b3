package io.fullerstack.inject.container;

import io.fullerstack.inject.Container;
import io.fullerstack.inject.ContainerDisposedException;
import io.fullerstack.inject.DisposalException;
import io.fullerstack.inject.Lifetime;
import io.fullerstack.inject.NotRegisteredException;
import io.fullerstack.inject.TypeMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Default {@link Container} implementation.
 *
 * <ul>
 *   <li>Registrations live in a {@link ConcurrentHashMap} keyed by type</li>
 *   <li>Produced {@link AutoCloseable} instances are queued in creation order when the
 *       container owns disposal, and closed FIFO by {@link #close()}. An instance is
 *       queued once however often it is enrolled</li>
 *   <li>Optional per-thread cycle detection via {@link ResolutionStack}</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> registration and resolution may be called from any thread.
 * Lazy singleton creation is not mutually excluded: concurrent first resolutions can
 * each run the factory, the last write to the cache slot wins, and every instance
 * produced is still tracked for disposal. Closing is not synchronized with in-flight
 * resolutions; a resolution that observes the closed flag fails immediately.
 */
public class LightContainer implements Container {

    private static final Logger logger = LoggerFactory.getLogger(LightContainer.class);

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final long id = SEQUENCE.incrementAndGet();
    private final boolean disposeRegistered;
    private final ResolutionStack resolutionStack;
    private final Map<Class<?>, Registration> registrations = new ConcurrentHashMap<>();
    private final Queue<AutoCloseable> disposables = new ConcurrentLinkedQueue<>();
    // Identity set of every instance ever queued; also the lock for enrollment
    private final Set<AutoCloseable> enrolled = Collections.newSetFromMap(new IdentityHashMap<>());
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Runnable onClose;

    /**
     * Creates a container that owns disposal and does not detect cycles.
     */
    public LightContainer() {
        this(true, false);
    }

    /**
     * @param disposeRegistered if true, produced {@link AutoCloseable} instances are closed with the container
     * @param detectCycles      if true, re-entrant resolution of a type on one thread raises
     *                          {@link io.fullerstack.inject.CircularDependencyException}
     */
    public LightContainer(boolean disposeRegistered, boolean detectCycles) {
        this.disposeRegistered = disposeRegistered;
        this.resolutionStack = detectCycles ? new ResolutionStack() : null;
    }

    // --- Registration ---

    @Override
    public <T> void registerSingletonLazy(Class<T> type, Supplier<? extends T> factory) {
        Objects.requireNonNull(factory, "Factory cannot be null");
        register(type, new Registration(c -> factory.get(), Lifetime.SINGLETON));
    }

    @Override
    public <T> void registerSingletonLazy(Class<T> type, Function<? super Container, ? extends T> factory) {
        register(type, new Registration(factory, Lifetime.SINGLETON));
    }

    @Override
    public <T> void registerSingleton(Class<T> type, T instance) {
        register(type, Registration.ofInstance(instance));
        track(instance);
    }

    @Override
    public <T> void registerTransient(Class<T> type, Supplier<? extends T> factory) {
        Objects.requireNonNull(factory, "Factory cannot be null");
        register(type, new Registration(c -> factory.get(), Lifetime.TRANSIENT));
    }

    @Override
    public <T> void registerTransient(Class<T> type, Function<? super Container, ? extends T> factory) {
        register(type, new Registration(factory, Lifetime.TRANSIENT));
    }

    private void register(Class<?> type, Registration registration) {
        Objects.requireNonNull(type, "Type cannot be null");
        ensureOpen();
        Registration previous = registrations.put(type, registration);
        if (logger.isDebugEnabled()) {
            logger.debug("{} registered {} as {}{}", this, type.getName(), registration.lifetime(),
                previous != null ? " (replaced)" : "");
        }
    }

    /**
     * Sets the single callback invoked at the end of {@link #close()}. A later call replaces it.
     *
     * @throws ContainerDisposedException if the container is already closed
     */
    public void subscribeOnClose(Runnable callback) {
        Objects.requireNonNull(callback, "Callback cannot be null");
        if (closed.get()) {
            throw new ContainerDisposedException("Cannot subscribe to the close callback of a closed container");
        }
        this.onClose = callback;
    }

    // --- Resolution ---

    @Override
    public <T> T resolve(Class<T> type) {
        Objects.requireNonNull(type, "Type cannot be null");
        ensureOpen();
        Registration registration = registrations.get(type);
        if (registration == null) {
            throw new NotRegisteredException(type);
        }
        return resolveRegistered(type, registration);
    }

    @Override
    public <T> Optional<T> tryResolve(Class<T> type) {
        Objects.requireNonNull(type, "Type cannot be null");
        ensureOpen();
        Registration registration = registrations.get(type);
        if (registration == null) {
            return Optional.empty();
        }
        return Optional.of(resolveRegistered(type, registration));
    }

    private <T> T resolveRegistered(Class<T> type, Registration registration) {
        if (resolutionStack == null) {
            return dispatch(type, registration);
        }
        try (ResolutionStack.Entry ignored = resolutionStack.enter(type)) {
            return dispatch(type, registration);
        }
    }

    private <T> T dispatch(Class<T> type, Registration registration) {
        return switch (registration.lifetime()) {
            case TRANSIENT -> resolveTransient(type, registration);
            case SINGLETON -> resolveSingleton(type, registration);
        };
    }

    private <T> T resolveTransient(Class<T> type, Registration registration) {
        Object instance = registration.create(this);
        track(instance);
        return checked(type, instance);
    }

    private <T> T resolveSingleton(Class<T> type, Registration registration) {
        if (registration.cachedInstance() == null) {
            Object created = registration.create(this);
            registration.cache(created);
            track(created);
        }
        // Re-read: a concurrent first resolution may have written the slot after us
        return checked(type, registration.cachedInstance());
    }

    private static <T> T checked(Class<T> type, Object instance) {
        if (!type.isInstance(instance)) {
            throw new TypeMismatchException(type, instance);
        }
        return type.cast(instance);
    }

    private void track(Object instance) {
        if (disposeRegistered && instance instanceof AutoCloseable closeable) {
            synchronized (enrolled) {
                if (enrolled.add(closeable)) {
                    disposables.add(closeable);
                }
            }
        }
    }

    @Override
    public boolean isRegistered(Class<?> type) {
        return registrations.containsKey(type);
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    /**
     * @return true if this container closes the instances it produces
     */
    public boolean disposesRegistered() {
        return disposeRegistered;
    }

    /**
     * @return true if this container raises on re-entrant resolution
     */
    public boolean detectsCycles() {
        return resolutionStack != null;
    }

    /**
     * @return number of instances currently queued for disposal
     */
    public int trackedCount() {
        return disposables.size();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new ContainerDisposedException("Cannot use " + this + ": it has been closed");
        }
    }

    // --- Cleanup ---

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        DisposalException failure = null;
        if (disposeRegistered) {
            AutoCloseable next;
            while ((next = disposables.poll()) != null) {
                try {
                    next.close();
                } catch (Exception e) {
                    logger.warn("{} failed to close {}", this, next.getClass().getName(), e);
                    if (failure == null) {
                        failure = new DisposalException("Failed to close instances owned by " + this, e);
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
        }

        synchronized (enrolled) {
            enrolled.clear();
        }
        registrations.clear();
        logger.debug("{} closed", this);

        Runnable callback = onClose;
        onClose = null;
        if (callback != null) {
            callback.run();
        }

        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public String toString() {
        return "Container[id=" + id + ", registrations=" + registrations.size() + ", closed=" + closed.get() + "]";
    }
}
