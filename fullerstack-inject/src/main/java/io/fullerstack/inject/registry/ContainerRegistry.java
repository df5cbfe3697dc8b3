package io.fullerstack.inject.registry;

import io.fullerstack.inject.AmbiguousScopeException;
import io.fullerstack.inject.Container;
import io.fullerstack.inject.DuplicateRegistrationException;
import io.fullerstack.inject.NotRegisteredException;
import io.fullerstack.inject.scope.ScopeController;
import io.fullerstack.inject.scope.ScopeFrame;
import io.fullerstack.inject.scope.ScopeHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of live containers that picks the container to resolve from.
 *
 * <p>Uses three concurrent indices:
 * <ul>
 *   <li><b>Flat index:</b> every registered container, keyed by identity</li>
 *   <li><b>Namespace index:</b> dot-delimited namespace scope to container, exact match</li>
 *   <li><b>Owner index:</b> scope-owner identity to container</li>
 * </ul>
 *
 * <h3>Resolution order for {@link #resolve(Class)}:</h3>
 * <ol>
 *   <li>Ambient scope of the calling thread, if one is open ({@link #beginScope(String)})</li>
 *   <li>The only registered container, if exactly one is registered</li>
 *   <li>Otherwise {@link NotRegisteredException} (none) or {@link AmbiguousScopeException} (several)</li>
 * </ol>
 *
 * <h3>Namespace resolution:</h3>
 * <p>{@link #resolve(Class, String)} walks from the queried namespace towards the root,
 * stripping one trailing segment at a time, and asks each bound container in turn:
 * <pre>{@code
 * registry.register(appContainer, "App", null);
 * registry.register(uiContainer, "App.UI", null);
 *
 * // chain for "App.UI.Widgets" is [uiContainer, appContainer]
 * Renderer renderer = registry.resolve(Renderer.class, "App.UI.Widgets");
 * }</pre>
 *
 * <h3>Thread Safety:</h3>
 * <ul>
 *   <li>All indices are {@link ConcurrentHashMap}s; registration may race with resolution</li>
 *   <li>The container count and the single-container fast path are published together as
 *       one immutable snapshot under a short lock; readers that find the snapshot stale
 *       fall back to scanning the flat index</li>
 *   <li>Namespace chains are cached and the whole cache is dropped on every mutation</li>
 *   <li>Ambient scopes are thread-local, see {@link ScopeController}</li>
 * </ul>
 */
public class ContainerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ContainerRegistry.class);

    private static final ContainerRegistry GLOBAL = new ContainerRegistry();

    private final ConcurrentMap<IdentityKey, ContainerRegistration> containers = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ContainerRegistration> namespaceIndex = new ConcurrentHashMap<>();
    private final ConcurrentMap<IdentityKey, ContainerRegistration> ownerIndex = new ConcurrentHashMap<>();
    private final NamespaceChainCache chainCache = new NamespaceChainCache();
    private final ScopeController scopes = new ScopeController();

    private final Object snapshotLock = new Object();
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    /**
     * Container count and, when the count is exactly one, that container.
     */
    private record Snapshot(int count, ContainerRegistration single) {
        static final Snapshot EMPTY = new Snapshot(0, null);
    }

    /**
     * @return the process-wide registry
     */
    public static ContainerRegistry global() {
        return GLOBAL;
    }

    // =========================================================================
    // Registration
    // =========================================================================

    /**
     * Registers a container without any scope.
     */
    public void register(Container container) {
        register(container, null, null);
    }

    /**
     * Registers a container, optionally bound to a namespace scope and/or a scope owner.
     *
     * @param container      the container
     * @param namespaceScope dot-delimited namespace, or null
     * @param scopeOwner     owner object compared by identity, or null
     * @throws DuplicateRegistrationException if the container, namespace or owner is already bound
     * @throws IllegalArgumentException       if the namespace scope is whitespace only
     */
    public void register(Container container, String namespaceScope, Object scopeOwner) {
        Objects.requireNonNull(container, "Container cannot be null");
        if (namespaceScope != null) {
            validateNamespaceScope(namespaceScope);
        }

        ContainerRegistration registration = new ContainerRegistration(container, namespaceScope, scopeOwner);
        IdentityKey containerKey = IdentityKey.of(container);

        if (containers.putIfAbsent(containerKey, registration) != null) {
            throw new DuplicateRegistrationException("Container is already registered: " + container);
        }

        if (namespaceScope != null && namespaceIndex.putIfAbsent(namespaceScope, registration) != null) {
            rollback(containerKey, registration);
            throw new DuplicateRegistrationException(
                "A container with namespace scope '" + namespaceScope + "' is already registered.");
        }

        if (scopeOwner != null && ownerIndex.putIfAbsent(IdentityKey.of(scopeOwner), registration) != null) {
            if (namespaceScope != null) {
                namespaceIndex.remove(namespaceScope, registration);
            }
            rollback(containerKey, registration);
            throw new DuplicateRegistrationException(
                "A container with scope owner '" + scopeOwner.getClass().getName() + "' is already registered.");
        }

        chainCache.invalidate();
        refreshSnapshot();
        logger.debug("Registered {}", registration);
    }

    private void rollback(IdentityKey containerKey, ContainerRegistration registration) {
        containers.remove(containerKey, registration);
        // A concurrent chain build or snapshot refresh may have observed the partial registration
        chainCache.invalidate();
        refreshSnapshot();
    }

    /**
     * Removes a container from every index. Unknown or null containers are ignored.
     */
    public void unregister(Container container) {
        if (container == null) {
            return;
        }
        ContainerRegistration registration = containers.remove(IdentityKey.of(container));
        if (registration == null) {
            return;
        }
        if (registration.namespaceScope() != null) {
            namespaceIndex.remove(registration.namespaceScope(), registration);
        }
        if (registration.scopeOwner() != null) {
            ownerIndex.remove(IdentityKey.of(registration.scopeOwner()), registration);
        }

        chainCache.invalidate();
        refreshSnapshot();
        logger.debug("Unregistered {}", registration);
    }

    private void refreshSnapshot() {
        synchronized (snapshotLock) {
            Iterator<ContainerRegistration> it = containers.values().iterator();
            if (!it.hasNext()) {
                snapshot = Snapshot.EMPTY;
                return;
            }
            ContainerRegistration first = it.next();
            snapshot = it.hasNext()
                ? new Snapshot(containers.size(), null)
                : new Snapshot(1, first);
        }
    }

    /**
     * @return true if {@code container} is currently registered
     */
    public boolean isRegistered(Container container) {
        return container != null && containers.containsKey(IdentityKey.of(container));
    }

    /**
     * @return number of registered containers
     */
    public int containerCount() {
        return containers.size();
    }

    // =========================================================================
    // Resolution
    // =========================================================================

    /**
     * Resolves from the ambient scope, or from the only registered container.
     *
     * @throws NotRegisteredException  if no candidate container provides {@code type}
     * @throws AmbiguousScopeException if several containers are registered and no scope is open
     */
    public <T> T resolve(Class<T> type) {
        return tryResolve(type).orElseThrow(() -> new NotRegisteredException(type));
    }

    /**
     * Resolves from the most specific container bound to {@code namespaceScope} or one of its ancestors.
     * If none is bound, falls back to the only registered container.
     *
     * @throws NotRegisteredException  if no container in the chain provides {@code type}
     * @throws AmbiguousScopeException if nothing is bound along the chain and several containers are registered
     */
    public <T> T resolve(Class<T> type, String namespaceScope) {
        return tryResolve(type, namespaceScope).orElseThrow(() -> new NotRegisteredException(type,
            "Service of type " + type.getName() + " is not registered for namespace scope '" + namespaceScope + "'."));
    }

    /**
     * Resolves from the container bound to {@code scopeOwner}.
     *
     * @throws NotRegisteredException if no container is bound to the owner or it does not provide {@code type}
     */
    public <T> T resolve(Class<T> type, Object scopeOwner) {
        return tryResolve(type, scopeOwner).orElseThrow(() -> new NotRegisteredException(type,
            "Service of type " + type.getName() + " is not registered for scope owner '"
                + scopeOwner.getClass().getName() + "'."));
    }

    /**
     * Same as {@link #resolve(Class)} except that finding no provider yields an empty result.
     *
     * @throws AmbiguousScopeException if several containers are registered and no scope is open
     */
    public <T> Optional<T> tryResolve(Class<T> type) {
        Objects.requireNonNull(type, "Type cannot be null");

        ScopeFrame frame = scopes.current();
        if (frame != null) {
            return switch (frame.kind()) {
                case NAMESPACE -> tryResolve(type, frame.namespaceScope());
                case OBJECT -> tryResolve(type, frame.scopeOwner());
            };
        }

        ContainerRegistration single = singleContainer();
        if (single != null) {
            return single.container().tryResolve(type);
        }
        if (containers.isEmpty()) {
            return Optional.empty();
        }
        throw new AmbiguousScopeException(type, containers.size());
    }

    /**
     * Same as {@link #resolve(Class, String)} except that finding no provider yields an empty result.
     *
     * @throws AmbiguousScopeException if nothing is bound along the chain and several containers are registered
     */
    public <T> Optional<T> tryResolve(Class<T> type, String namespaceScope) {
        Objects.requireNonNull(type, "Type cannot be null");
        validateNamespaceScope(namespaceScope);

        List<ContainerRegistration> chain = chainCache.chain(namespaceScope, namespaceIndex::get);
        if (chain.isEmpty()) {
            ContainerRegistration single = singleContainer();
            if (single != null) {
                return single.container().tryResolve(type);
            }
            if (containers.isEmpty()) {
                return Optional.empty();
            }
            throw new AmbiguousScopeException(type, namespaceScope, containers.size());
        }

        for (ContainerRegistration registration : chain) {
            Optional<T> instance = registration.container().tryResolve(type);
            if (instance.isPresent()) {
                return instance;
            }
        }
        return Optional.empty();
    }

    /**
     * Same as {@link #resolve(Class, Object)} except that finding no provider yields an empty result.
     */
    public <T> Optional<T> tryResolve(Class<T> type, Object scopeOwner) {
        Objects.requireNonNull(type, "Type cannot be null");
        Objects.requireNonNull(scopeOwner, "Scope owner cannot be null");

        ContainerRegistration registration = ownerIndex.get(IdentityKey.of(scopeOwner));
        return registration != null ? registration.container().tryResolve(type) : Optional.empty();
    }

    /**
     * Resolves directly from a container the caller already holds.
     */
    public static <T> T resolveFrom(Container container, Class<T> type) {
        Objects.requireNonNull(container, "Container cannot be null");
        return container.resolve(type);
    }

    /**
     * Attempts to resolve directly from a container the caller already holds.
     */
    public static <T> Optional<T> tryResolveFrom(Container container, Class<T> type) {
        Objects.requireNonNull(container, "Container cannot be null");
        return container.tryResolve(type);
    }

    /**
     * @return the only registered container, or null if there are none or several
     */
    private ContainerRegistration singleContainer() {
        Snapshot current = snapshot;
        if (current.count() == 1
            && containers.get(IdentityKey.of(current.single().container())) == current.single()) {
            return current.single();
        }

        // Snapshot stale or not single: decide from the flat index itself
        Iterator<ContainerRegistration> it = containers.values().iterator();
        if (!it.hasNext()) {
            return null;
        }
        ContainerRegistration first = it.next();
        return it.hasNext() ? null : first;
    }

    // =========================================================================
    // Ambient scopes
    // =========================================================================

    /**
     * Opens an ambient namespace scope on the calling thread.
     */
    public ScopeHandle beginScope(String namespaceScope) {
        validateNamespaceScope(namespaceScope);
        return scopes.pushNamespace(namespaceScope);
    }

    /**
     * Opens an ambient owner scope on the calling thread.
     */
    public ScopeHandle beginScope(Object scopeOwner) {
        Objects.requireNonNull(scopeOwner, "Scope owner cannot be null");
        return scopes.pushOwner(scopeOwner);
    }

    /**
     * @return the innermost ambient scope of the calling thread, if any
     */
    public Optional<ScopeFrame> currentScope() {
        return Optional.ofNullable(scopes.current());
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Forgets every container and invalidates ambient scopes on all threads.
     *
     * <p>Containers are not closed and remain usable directly.
     */
    public void dispose() {
        int count = containers.size();
        containers.clear();
        namespaceIndex.clear();
        ownerIndex.clear();
        chainCache.invalidate();
        synchronized (snapshotLock) {
            snapshot = Snapshot.EMPTY;
        }
        scopes.reset();
        logger.info("Container registry disposed ({} containers dropped)", count);
    }

    int cachedChainCount() {
        return chainCache.size();
    }

    private static void validateNamespaceScope(String namespaceScope) {
        Objects.requireNonNull(namespaceScope, "Namespace scope cannot be null");
        if (!namespaceScope.isEmpty() && namespaceScope.isBlank()) {
            throw new IllegalArgumentException("Namespace scope cannot be whitespace");
        }
    }

    @Override
    public String toString() {
        return "ContainerRegistry[containers=" + containers.size()
            + ", namespaces=" + namespaceIndex.size()
            + ", owners=" + ownerIndex.size() + "]";
    }
}
