package io.fullerstack.inject.scope;

/**
 * Releasable handle for an ambient scope opened with
 * {@link io.fullerstack.inject.registry.ContainerRegistry#beginScope(String)} or
 * {@link io.fullerstack.inject.registry.ContainerRegistry#beginScope(Object)}.
 *
 * <p>Handles must be closed on the opening thread, in reverse order of opening:
 * <pre>{@code
 * try (ScopeHandle ui = registry.beginScope("App.UI")) {
 *     Renderer renderer = registry.resolve(Renderer.class);
 * }
 * }</pre>
 */
public interface ScopeHandle extends AutoCloseable {

    /**
     * @return the frame this handle releases
     */
    ScopeFrame frame();

    /**
     * Pops the frame. Closing an already closed handle does nothing.
     *
     * @throws io.fullerstack.inject.OutOfOrderScopeException if the frame is not the
     *         innermost active scope of the calling thread
     */
    @Override
    void close();
}
