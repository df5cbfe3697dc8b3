package io.fullerstack.inject;

import io.fullerstack.inject.config.InjectConfig;
import io.fullerstack.inject.container.LightContainer;
import io.fullerstack.inject.registry.ContainerRegistry;

import java.util.Objects;

/**
 * Creates containers that are registered with a {@link ContainerRegistry} and
 * unregister themselves when closed.
 *
 * <p><b>Usage:</b>
 * <pre>
 * // Unscoped container in the global registry, defaults from inject.properties
 * Container root = ContainerFactory.createContainer();
 *
 * // Namespace-scoped container with explicit options
 * Container ui = ContainerFactory.builder()
 *     .namespaceScope("App.UI")
 *     .disposeRegistered(true)
 *     .detectCycles(true)
 *     .create();
 * </pre>
 *
 * <p>Defaults for {@code disposeRegistered} and {@code detectCycles} come from
 * {@link InjectConfig}, resolved for the namespace scope when one is given.
 */
public final class ContainerFactory {

    private ContainerFactory() {
    }

    /**
     * Creates an unscoped container registered with the global registry.
     */
    public static Container createContainer() {
        return builder().create();
    }

    /**
     * Creates an unscoped container registered with the global registry.
     *
     * @param disposeRegistered if true, produced {@link AutoCloseable} instances are closed with the container
     */
    public static Container createContainer(boolean disposeRegistered) {
        return builder().disposeRegistered(disposeRegistered).create();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for container creation options.
     */
    public static final class Builder {

        private ContainerRegistry registry = ContainerRegistry.global();
        private String namespaceScope;
        private Object scopeOwner;
        private Boolean disposeRegistered;
        private Boolean detectCycles;

        private Builder() {
        }

        /**
         * Registry to register with. Defaults to {@link ContainerRegistry#global()}.
         */
        public Builder registry(ContainerRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
            return this;
        }

        public Builder namespaceScope(String namespaceScope) {
            this.namespaceScope = namespaceScope;
            return this;
        }

        public Builder scopeOwner(Object scopeOwner) {
            this.scopeOwner = scopeOwner;
            return this;
        }

        public Builder disposeRegistered(boolean disposeRegistered) {
            this.disposeRegistered = disposeRegistered;
            return this;
        }

        public Builder detectCycles(boolean detectCycles) {
            this.detectCycles = detectCycles;
            return this;
        }

        /**
         * Creates and registers the container.
         *
         * @throws DuplicateRegistrationException if the namespace scope or owner is already bound;
         *                                        the new container is closed before this propagates
         */
        public Container create() {
            boolean dispose;
            boolean cycles;
            if (disposeRegistered != null && detectCycles != null) {
                dispose = disposeRegistered;
                cycles = detectCycles;
            } else {
                InjectConfig config = namespaceScope != null && !namespaceScope.isBlank()
                    ? InjectConfig.forScope(namespaceScope)
                    : InjectConfig.global();
                dispose = disposeRegistered != null
                    ? disposeRegistered
                    : config.getBoolean(InjectConfig.DISPOSE_REGISTERED, true);
                cycles = detectCycles != null
                    ? detectCycles
                    : config.getBoolean(InjectConfig.DETECT_CYCLES, false);
            }

            LightContainer container = new LightContainer(dispose, cycles);
            try {
                registry.register(container, namespaceScope, scopeOwner);
            } catch (RuntimeException e) {
                container.close();
                throw e;
            }
            container.subscribeOnClose(() -> registry.unregister(container));
            return container;
        }
    }
}
