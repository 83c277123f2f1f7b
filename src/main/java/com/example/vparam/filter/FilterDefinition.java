package com.example.vparam.filter;

import java.util.Objects;

/** A named {@link Filter}; declare one as a bean to register it at startup. */
public record FilterDefinition(String name, Filter filter) {

  public FilterDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(filter, "filter");
  }

  public static FilterDefinition of(String name, Filter filter) {
    return new FilterDefinition(name, filter);
  }
}
