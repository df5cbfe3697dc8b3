package io.fullerstack.inject.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.ResourceBundle;

/**
 * Namespace-aware configuration backed by a ResourceBundle (zero dependencies).
 *
 * <p>Reads {@code inject.properties} from the classpath. Lookups for a namespace
 * scope fall back along the same chain the registry resolves containers by:
 * <ol>
 *   <li>{@code {namespace}.{key}} (e.g. {@code App.UI.container.detect-cycles})</li>
 *   <li>{@code {parent namespace}.{key}} for every ancestor (e.g. {@code App.container.detect-cycles})</li>
 *   <li>{@code {key}} (global default)</li>
 * </ol>
 *
 * <p><strong>Example Property File:</strong>
 * <pre>
 * # inject.properties
 * container.dispose-registered=true
 * container.detect-cycles=false
 *
 * # cycle detection for everything under App.UI
 * App.UI.container.detect-cycles=true
 * </pre>
 *
 * <p><strong>System Property Overrides:</strong>
 * <p>System properties take precedence over the property file at every level:
 * <pre>
 * java -Dcontainer.detect-cycles=true -jar app.jar
 * </pre>
 */
public class InjectConfig {

  /** Whether containers close the AutoCloseable instances they produce. */
  public static final String DISPOSE_REGISTERED = "container.dispose-registered";

  /** Whether containers raise on re-entrant resolution of a type. */
  public static final String DETECT_CYCLES = "container.detect-cycles";

  private static final String BUNDLE = "inject";

  private final ResourceBundle bundle;
  private final List<String> prefixes;
  private final String context;  // For debugging/logging

  private InjectConfig(ResourceBundle bundle, List<String> prefixes, String context) {
    this.bundle = bundle;
    this.prefixes = prefixes;
    this.context = context;
  }

  /**
   * Get global configuration (inject.properties).
   *
   * @return Global configuration
   * @throws ConfigurationException if inject.properties is not on the classpath
   */
  public static InjectConfig global() {
    return new InjectConfig(loadBundle(), List.of(), "global");
  }

  /**
   * Get configuration for a namespace scope.
   *
   * @param namespaceScope dot-delimited namespace (e.g. "App.UI.Widgets")
   * @return Namespace-specific configuration
   */
  public static InjectConfig forScope(String namespaceScope) {
    Objects.requireNonNull(namespaceScope, "namespaceScope cannot be null");
    if (namespaceScope.isBlank()) {
      throw new IllegalArgumentException("namespaceScope cannot be blank");
    }

    // Most specific first: App.UI.Widgets, App.UI, App
    List<String> prefixes = new ArrayList<>();
    String current = namespaceScope;
    while (true) {
      prefixes.add(current + ".");
      int lastDot = current.lastIndexOf('.');
      if (lastDot < 0) {
        break;
      }
      current = current.substring(0, lastDot);
    }
    return new InjectConfig(loadBundle(), Collections.unmodifiableList(prefixes), "scope:" + namespaceScope);
  }

  private static ResourceBundle loadBundle() {
    try {
      return ResourceBundle.getBundle(BUNDLE, Locale.ROOT);
    } catch (MissingResourceException e) {
      throw new ConfigurationException("Missing " + BUNDLE + ".properties on the classpath", e);
    }
  }

  // =========================================================================
  // Type-safe getters with system property override support
  // =========================================================================

  /**
   * Get string value.
   *
   * <p>Checks each scope level from most to least specific; at every level system
   * properties win over the bundle.
   *
   * @param key Property key
   * @return Property value
   * @throws ConfigurationException if key not found
   */
  public String getString(String key) {
    String value = lookup(key);
    if (value == null) {
      throw new ConfigurationException("Missing config key '" + key + "' in context: " + context);
    }
    return value;
  }

  /**
   * Get string value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return Property value or default
   */
  public String getString(String key, String defaultValue) {
    String value = lookup(key);
    return value != null ? value : defaultValue;
  }

  private String lookup(String key) {
    Objects.requireNonNull(key, "key cannot be null");
    for (String prefix : prefixes) {
      String value = lookupExact(prefix + key);
      if (value != null) {
        return value;
      }
    }
    return lookupExact(key);
  }

  private String lookupExact(String key) {
    String sysProp = System.getProperty(key);
    if (sysProp != null) {
      return sysProp;
    }
    return bundle.containsKey(key) ? bundle.getString(key) : null;
  }

  /**
   * Get boolean value.
   *
   * @param key Property key
   * @return Property value as boolean
   * @throws ConfigurationException if key not found
   */
  public boolean getBoolean(String key) {
    return Boolean.parseBoolean(getString(key).trim());
  }

  /**
   * Get boolean value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return Property value as boolean or default
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    String value = getString(key, null);
    return value != null ? Boolean.parseBoolean(value.trim()) : defaultValue;
  }

  /**
   * Get configuration context (for debugging).
   *
   * @return Context description (e.g., "global", "scope:App.UI")
   */
  public String context() {
    return context;
  }

  @Override
  public String toString() {
    return "InjectConfig[context=" + context + "]";
  }
}
