package io.fullerstack.inject.config;

import io.fullerstack.inject.InjectionException;

/**
 * A configuration key is missing or holds a value of the wrong format.
 */
public class ConfigurationException extends InjectionException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
