package io.fullerstack.inject.registry;

import io.fullerstack.inject.Container;

import java.util.Objects;

/**
 * A container as the registry sees it: the container plus the scopes it is bound to.
 *
 * <p>The scope owner is a lookup back-reference only. The registry never closes it or
 * keeps it alive beyond the container's registration.
 */
public final class ContainerRegistration {

    private final Container container;
    private final String namespaceScope;
    private final Object scopeOwner;

    ContainerRegistration(Container container, String namespaceScope, Object scopeOwner) {
        this.container = Objects.requireNonNull(container, "Container cannot be null");
        this.namespaceScope = namespaceScope;
        this.scopeOwner = scopeOwner;
    }

    public Container container() {
        return container;
    }

    /**
     * @return the namespace scope, or null if the container is not namespace scoped
     */
    public String namespaceScope() {
        return namespaceScope;
    }

    /**
     * @return the scope owner, or null if the container is not owner scoped
     */
    public Object scopeOwner() {
        return scopeOwner;
    }

    @Override
    public String toString() {
        return "ContainerRegistration[" + container
            + (namespaceScope != null ? ", namespace=" + namespaceScope : "")
            + (scopeOwner != null ? ", owner=" + scopeOwner.getClass().getSimpleName() : "")
            + "]";
    }
}
