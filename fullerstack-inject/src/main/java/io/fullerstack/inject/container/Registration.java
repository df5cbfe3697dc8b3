package io.fullerstack.inject.container;

import io.fullerstack.inject.Container;
import io.fullerstack.inject.Lifetime;

import java.util.Objects;
import java.util.function.Function;

/**
 * Factory, lifetime and cache slot for one type within one container.
 *
 * <p>The factory and lifetime never change after construction. The cache slot is
 * written by singleton resolution and is never written for transient registrations.
 *
 * <p>The slot is {@code volatile} but creation is not guarded: two threads resolving
 * a lazy singleton for the first time may both run the factory, and the later
 * write stays cached.
 */
public final class Registration {

    private final Function<? super Container, ?> factory;
    private final Lifetime lifetime;
    private volatile Object cachedInstance;

    /**
     * Creates a registration whose instances come from {@code factory}.
     *
     * @param factory  creates instances, receives the owning container
     * @param lifetime the lifetime policy
     */
    public Registration(Function<? super Container, ?> factory, Lifetime lifetime) {
        this.factory = Objects.requireNonNull(factory, "Factory cannot be null");
        this.lifetime = Objects.requireNonNull(lifetime, "Lifetime cannot be null");
    }

    /**
     * Creates a singleton registration around an instance that already exists.
     *
     * @param instance the pre-built instance, becomes the cached value
     * @return a singleton registration with a populated cache slot
     */
    public static Registration ofInstance(Object instance) {
        Objects.requireNonNull(instance, "Instance cannot be null");
        Registration registration = new Registration(c -> instance, Lifetime.SINGLETON);
        registration.cachedInstance = instance;
        return registration;
    }

    /**
     * Invokes the factory.
     *
     * @param container the container performing the resolution
     * @return whatever the factory produced, possibly null
     */
    public Object create(Container container) {
        return factory.apply(container);
    }

    public Lifetime lifetime() {
        return lifetime;
    }

    /**
     * @return the cached singleton, or null if none has been created yet
     */
    public Object cachedInstance() {
        return cachedInstance;
    }

    void cache(Object instance) {
        if (lifetime != Lifetime.SINGLETON) {
            throw new IllegalStateException("Only singleton registrations cache instances");
        }
        this.cachedInstance = instance;
    }

    @Override
    public String toString() {
        return "Registration[lifetime=" + lifetime + ", cached=" + (cachedInstance != null) + "]";
    }
}
