package com.example.vparam.type;

import com.example.vparam.validation.ConfigurationException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-wide type catalogue. There is no removal; {@link #set} overwrites, which changes the
 * behaviour of every later validation that names the type.
 */
@Slf4j
public class TypeRegistry {

  private final Map<String, TypeDefinition> types = new ConcurrentHashMap<>();

  public Optional<TypeDefinition> get(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(types.get(name));
  }

  public TypeDefinition require(String name) {
    return get(name).orElseThrow(() -> ConfigurationException.unknownType(name));
  }

  public TypeDefinition set(TypeDefinition definition) {
    Objects.requireNonNull(definition.getName(), "type name");
    TypeDefinition previous = types.put(definition.getName(), definition);
    if (previous != null && previous != definition) {
      log.info("Overriding type '{}'", definition.getName());
    }
    return definition;
  }

  /** Registers {@code definition} under {@code name}, whatever name it was built with. */
  public TypeDefinition set(String name, TypeDefinition definition) {
    return set(definition.toBuilder().name(name).build());
  }

  /** Makes {@code alias} resolve to the current definition of {@code name}. */
  public TypeDefinition alias(String alias, String name) {
    return set(alias, require(name));
  }

  public boolean contains(String name) {
    return types.containsKey(name);
  }

  public SortedSet<String> names() {
    return new TreeSet<>(types.keySet());
  }
}
