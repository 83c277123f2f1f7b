package com.example.vparam.config;

import com.example.vparam.filter.BuiltinFilters;
import com.example.vparam.filter.FilterDefinition;
import com.example.vparam.filter.FilterRegistry;
import com.example.vparam.type.BuiltinTypes;
import com.example.vparam.type.TypeDefinition;
import com.example.vparam.type.TypeRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registries with the stock types and filters, followed by every {@link TypeDefinition} and
 * {@link FilterDefinition} bean in the context so applications can add or replace entries.
 */
@Slf4j
@Configuration
public class VparamConfig {

  @Bean
  public Clock vparamClock() {
    return Clock.systemDefaultZone();
  }

  @Bean
  public TypeRegistry typeRegistry(VparamProperties props, Clock clock, ObjectMapper objectMapper,
      ObjectProvider<TypeDefinition> extraTypes) {
    TypeRegistry registry = new TypeRegistry();
    BuiltinTypes.registerAll(registry, props, clock, objectMapper);
    extraTypes.orderedStream().forEach(registry::set);
    log.info("Registered {} types", registry.names().size());
    return registry;
  }

  @Bean
  public FilterRegistry filterRegistry(ObjectProvider<FilterDefinition> extraFilters) {
    FilterRegistry registry = new FilterRegistry();
    BuiltinFilters.registerAll(registry);
    extraFilters.orderedStream().forEach(registry::set);
    log.info("Registered {} filters", registry.names().size());
    return registry;
  }
}
