package io.fullerstack.inject;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Owner of service registrations that resolves and disposes instances.
 *
 * <p>Each type key maps to at most one registration. Registering a type again
 * replaces the previous registration; nothing is merged.
 *
 * <p><b>Lifetimes:</b>
 * <ul>
 *   <li>{@link Lifetime#SINGLETON} - created on first resolution (or supplied up front) and cached</li>
 *   <li>{@link Lifetime#TRANSIENT} - a fresh instance on every resolution</li>
 * </ul>
 *
 * <p><b>Disposal:</b> when the container owns disposal, every produced instance that
 * implements {@link AutoCloseable} is tracked and closed, in creation order, by
 * {@link #close()}.
 *
 * <p>Containers are normally obtained from {@link ContainerFactory}, which also
 * registers them with a {@link io.fullerstack.inject.registry.ContainerRegistry}.
 *
 * <pre>{@code
 * Container container = ContainerFactory.builder().namespaceScope("App.UI").create();
 * container.registerSingletonLazy(Renderer.class, GlRenderer::new);
 * container.registerTransient(Widget.class, c -> new Widget(c.resolve(Renderer.class)));
 * }</pre>
 */
public interface Container extends AutoCloseable {

    /**
     * Registers a singleton created on first resolution.
     */
    <T> void registerSingletonLazy(Class<T> type, Supplier<? extends T> factory);

    /**
     * Registers a singleton created on first resolution by a factory that receives this container.
     */
    <T> void registerSingletonLazy(Class<T> type, Function<? super Container, ? extends T> factory);

    /**
     * Registers an already created singleton. The instance is enrolled for disposal
     * tracking immediately, as if the container had created it.
     */
    <T> void registerSingleton(Class<T> type, T instance);

    /**
     * Registers a type that is created anew on every resolution.
     */
    <T> void registerTransient(Class<T> type, Supplier<? extends T> factory);

    /**
     * Registers a type that is created anew on every resolution by a factory that receives this container.
     */
    <T> void registerTransient(Class<T> type, Function<? super Container, ? extends T> factory);

    /**
     * Resolves an instance of {@code type}.
     *
     * @throws ContainerDisposedException if the container has been closed
     * @throws NotRegisteredException     if {@code type} has no registration
     * @throws TypeMismatchException      if the factory produced an incompatible instance
     * @throws CircularDependencyException if cycle detection is on and {@code type} is already being resolved
     */
    <T> T resolve(Class<T> type);

    /**
     * Same as {@link #resolve(Class)}, except that a missing registration yields an
     * empty result. Every other failure is still thrown.
     */
    <T> Optional<T> tryResolve(Class<T> type);

    /**
     * @return true if {@code type} currently has a registration
     */
    boolean isRegistered(Class<?> type);

    /**
     * @return true once {@link #close()} has run
     */
    boolean isClosed();

    /**
     * Closes the container. Safe to call any number of times; only the first call has an effect.
     *
     * @throws DisposalException if one or more tracked instances failed to close
     */
    @Override
    void close();
}
