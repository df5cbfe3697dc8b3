package io.fullerstack.inject.spi;

import io.fullerstack.inject.Container;

/**
 * Service Provider Interface for applications to contribute containers at bootstrap.
 * <p>
 * Each module becomes one container, bound to the module's namespace scope, and is
 * asked to populate it with registrations.
 * <p>
 * <strong>Contract:</strong>
 * <ul>
 *   <li>Framework calls {@link #namespaceScope()} to decide where the container is bound</li>
 *   <li>Framework creates the container and calls {@link #configure(Container)} once</li>
 *   <li>Framework closes the container when the bootstrap result is closed</li>
 * </ul>
 * <p>
 * <strong>Example Implementation:</strong>
 * <pre>
 * public class UiModule implements ContainerModule {
 *   &#64;Override
 *   public String namespaceScope() {
 *     return "App.UI";
 *   }
 *
 *   &#64;Override
 *   public void configure(Container container) {
 *     container.registerSingletonLazy(Renderer.class, () -&gt; new GlRenderer());
 *     container.registerTransient(Widget.class, c -&gt; new Widget(c.resolve(Renderer.class)));
 *   }
 * }
 * </pre>
 * <p>
 * <strong>Registration:</strong>
 * Create file: {@code META-INF/services/io.fullerstack.inject.spi.ContainerModule}
 * <pre>
 * com.example.UiModule
 * </pre>
 *
 * @see java.util.ServiceLoader
 * @see io.fullerstack.inject.bootstrap.InjectBootstrap
 */
public interface ContainerModule {

  /**
   * Namespace scope the module's container is bound to.
   *
   * @return dot-delimited namespace, or null for an unscoped container
   */
  String namespaceScope();

  /**
   * Populate the module's container.
   *
   * @param container freshly created, already registered container
   */
  void configure(Container container);

  /**
   * Name used in logs. Defaults to the implementation class name.
   */
  default String name() {
    return getClass().getSimpleName();
  }
}
