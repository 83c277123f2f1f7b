package com.example.vparam.filter;

import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-wide filter catalogue. Entries are read by every validation call; writes are expected
 * during startup or between requests and the last write for a name wins.
 */
@Slf4j
public class FilterRegistry {

  private final Map<String, FilterDefinition> filters = new ConcurrentHashMap<>();

  public Optional<FilterDefinition> get(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(filters.get(name));
  }

  public FilterDefinition set(FilterDefinition definition) {
    FilterDefinition previous = filters.put(definition.name(), definition);
    if (previous != null && previous != definition) {
      log.info("Overriding filter '{}'", definition.name());
    }
    return definition;
  }

  public FilterDefinition set(String name, Filter filter) {
    return set(FilterDefinition.of(name, filter));
  }

  public boolean contains(String name) {
    return filters.containsKey(name);
  }

  public SortedSet<String> names() {
    return new TreeSet<>(filters.keySet());
  }
}
