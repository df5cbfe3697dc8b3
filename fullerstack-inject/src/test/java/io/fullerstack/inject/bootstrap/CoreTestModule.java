package io.fullerstack.inject.bootstrap;

import io.fullerstack.inject.Container;
import io.fullerstack.inject.spi.ContainerModule;
import io.fullerstack.inject.testkit.TestServices.SimpleTestService;
import io.fullerstack.inject.testkit.TestServices.TestService;

/**
 * Discovered through META-INF/services; binds the application root.
 */
public class CoreTestModule implements ContainerModule {

  @Override
  public String namespaceScope() {
    return "App";
  }

  @Override
  public void configure(Container container) {
    container.registerSingletonLazy(TestService.class, () -> new SimpleTestService("core"));
  }
}
