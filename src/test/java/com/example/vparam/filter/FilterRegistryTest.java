package com.example.vparam.filter;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FilterRegistryTest {

  @Test
  void builtinsAreRegistered() {
    FilterRegistry registry = new FilterRegistry();
    BuiltinFilters.registerAll(registry);

    assertThat(registry.names()).containsExactly("in", "max", "min", "range", "regexp", "size");
  }

  @Test
  void lastWriteWins() {
    FilterRegistry registry = new FilterRegistry();
    registry.set("same", (value, argument) -> "first");
    registry.set("same", (value, argument) -> value.equals(argument) ? null : "Invalid");

    Filter filter = registry.get("same").orElseThrow().filter();

    assertThat(filter.apply("a", "a")).isNull();
    assertThat(filter.apply("a", "b")).isEqualTo("Invalid");
  }

  @Test
  void unknownNameIsEmpty() {
    assertThat(new FilterRegistry().get("nope")).isEmpty();
    assertThat(new FilterRegistry().get(null)).isEmpty();
  }
}
