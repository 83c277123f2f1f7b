package com.example.vparam.validation;

import java.util.Objects;

/**
 * Raised when a field specification cannot be executed at all: an unknown type or filter, a
 * selector nobody can serve, a malformed sort column list. Unlike value errors this aborts the
 * whole validation call.
 */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(Objects.requireNonNull(message, "message"));
  }

  public ConfigurationException(String message, Throwable cause) {
    super(Objects.requireNonNull(message, "message"), cause);
  }

  public static ConfigurationException unknownType(String type) {
    return new ConfigurationException(String.format("Type \"%s\" is not defined", type));
  }

  public static ConfigurationException unknownFilter(String filter) {
    return new ConfigurationException(String.format("Filter \"%s\" is not defined", filter));
  }
}
