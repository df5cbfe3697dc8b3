package io.fullerstack.inject.bootstrap;

import io.fullerstack.inject.Container;
import io.fullerstack.inject.ContainerFactory;
import io.fullerstack.inject.InjectionException;
import io.fullerstack.inject.registry.ContainerRegistry;
import io.fullerstack.inject.spi.ContainerModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.BiConsumer;

/**
 * Convention-based composition root.
 * <p>
 * Discovers {@link ContainerModule} implementations via {@link ServiceLoader}, creates
 * one registered container per module and lets the module populate it.
 * <p>
 * <strong>Bootstrap Flow:</strong>
 * <ol>
 *   <li>Load {@link ContainerModule} implementations via {@link ServiceLoader}</li>
 *   <li>Create a container per module through {@link ContainerFactory}, bound to the module's namespace scope</li>
 *   <li>Call {@link ContainerModule#configure(Container)}</li>
 * </ol>
 * <p>
 * <strong>Usage:</strong>
 * <pre>
 * try (BootstrapResult result = InjectBootstrap.bootstrap()) {
 *     Renderer renderer = ContainerRegistry.global().resolve(Renderer.class, "App.UI");
 * }
 * </pre>
 *
 * @see ContainerModule
 */
public class InjectBootstrap {

    private static final Logger logger = LoggerFactory.getLogger(InjectBootstrap.class);

    /**
     * Bootstrap all modules into the global registry.
     *
     * @return Bootstrap result owning the created containers
     */
    public static BootstrapResult bootstrap() {
        return builder().bootstrap();
    }

    /**
     * Create a builder for custom bootstrap configuration.
     *
     * @return Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for customizing bootstrap behavior.
     */
    public static class Builder {

        private ContainerRegistry registry = ContainerRegistry.global();
        private List<ContainerModule> modules;
        private BiConsumer<String, Container> onContainerCreated = (name, container) -> {};
        private BiConsumer<String, RuntimeException> onError = (name, error) -> {
            logger.error("Bootstrap failed for module: {}", name, error);
            throw error;
        };

        /**
         * Registry the containers are registered with. Defaults to the global registry.
         */
        public Builder registry(ContainerRegistry registry) {
            this.registry = Objects.requireNonNull(registry);
            return this;
        }

        /**
         * Use these modules instead of discovering them via {@link ServiceLoader}.
         */
        public Builder modules(List<? extends ContainerModule> modules) {
            this.modules = List.copyOf(modules);
            return this;
        }

        /**
         * Set callback invoked when a module's container is created and configured.
         *
         * @param callback Callback (moduleName, container) → void
         * @return This builder
         */
        public Builder onContainerCreated(BiConsumer<String, Container> callback) {
            this.onContainerCreated = Objects.requireNonNull(callback);
            return this;
        }

        /**
         * Set callback invoked when a module fails. The default logs and rethrows;
         * a callback that returns normally skips the module and continues.
         *
         * @param callback Callback (moduleName, exception) → void
         * @return This builder
         */
        public Builder onError(BiConsumer<String, RuntimeException> callback) {
            this.onError = Objects.requireNonNull(callback);
            return this;
        }

        /**
         * Execute bootstrap process.
         *
         * @return Bootstrap result
         */
        public BootstrapResult bootstrap() {
            logger.info("Starting inject bootstrap...");

            List<ContainerModule> toLoad = modules != null ? modules : discover();
            logger.info("Found {} container modules", toLoad.size());

            Map<String, Container> containers = new LinkedHashMap<>();
            try {
                for (ContainerModule module : toLoad) {
                    String name = module.name();
                    Container container = null;
                    try {
                        container = ContainerFactory.builder()
                            .registry(registry)
                            .namespaceScope(module.namespaceScope())
                            .create();
                        module.configure(container);
                        if (containers.putIfAbsent(name, container) != null) {
                            throw new InjectionException("Duplicate module name: " + name);
                        }
                        onContainerCreated.accept(name, container);
                        logger.debug("Module '{}' configured {} (scope: {})", name, container, module.namespaceScope());
                    } catch (RuntimeException e) {
                        if (container != null && !containers.containsValue(container)) {
                            container.close();
                        }
                        onError.accept(name, e);
                    }
                }
            } catch (RuntimeException e) {
                new BootstrapResult(containers).close();
                throw e;
            }

            logger.info("Bootstrap complete: {} containers", containers.size());
            return new BootstrapResult(containers);
        }

        private List<ContainerModule> discover() {
            List<ContainerModule> discovered = new ArrayList<>();
            for (ContainerModule module : ServiceLoader.load(ContainerModule.class)) {
                discovered.add(module);
            }
            return discovered;
        }
    }

    /**
     * Result of bootstrap process.
     * <p>
     * Owns the created containers. Implements {@link AutoCloseable} to close them in
     * reverse creation order, which also unregisters them.
     */
    public static class BootstrapResult implements AutoCloseable {

        private final Map<String, Container> containers;

        BootstrapResult(Map<String, Container> containers) {
            this.containers = Collections.unmodifiableMap(new LinkedHashMap<>(containers));
        }

        /**
         * Get all containers by module name, in creation order.
         *
         * @return Unmodifiable map of module name to container
         */
        public Map<String, Container> getContainers() {
            return containers;
        }

        /**
         * Get the container created for a module.
         *
         * @param moduleName Module name
         * @return Container, if the module was bootstrapped
         */
        public Optional<Container> getContainer(String moduleName) {
            return Optional.ofNullable(containers.get(moduleName));
        }

        @Override
        public void close() {
            List<Container> reversed = new ArrayList<>(containers.values());
            Collections.reverse(reversed);

            RuntimeException failure = null;
            for (Container container : reversed) {
                try {
                    container.close();
                } catch (RuntimeException e) {
                    logger.warn("Failed to close {}", container, e);
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
            logger.info("Closed {} bootstrapped containers", reversed.size());
            if (failure != null) {
                throw failure;
            }
        }
    }
}
