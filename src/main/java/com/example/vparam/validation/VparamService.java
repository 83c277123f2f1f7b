package com.example.vparam.validation;

import com.example.vparam.config.VparamProperties;
import com.example.vparam.filter.Filter;
import com.example.vparam.filter.FilterDefinition;
import com.example.vparam.filter.FilterRegistry;
import com.example.vparam.source.DocumentExtractor;
import com.example.vparam.source.ParamSource;
import com.example.vparam.spec.FieldSpec;
import com.example.vparam.spec.FieldSpecResolver;
import com.example.vparam.spec.FieldSpecs;
import com.example.vparam.spec.ResolvedField;
import com.example.vparam.type.TypeDefinition;
import com.example.vparam.type.TypeRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for validating request parameters against field specs.
 *
 * <pre>
 *   ValidationContext ctx = vparam.newContext(source);
 *   Map&lt;String, Object&gt; params = vparam.validateMany(ctx, FieldSpecs.builder()
 *       .field("id", "int")
 *       .field("tags", "~@str")
 *       .build());
 *   if (ctx.hasErrors()) { ... }
 * </pre>
 *
 * All specs of a call are resolved before any field is processed, so a {@link
 * ConfigurationException} leaves no partial output and leaves the context's errors untouched.
 * Otherwise every call starts from an empty error set: errors describe the latest call only.
 */
@Slf4j
@Service
public class VparamService {

  private final TypeRegistry types;
  private final FilterRegistry filters;
  private final VparamProperties props;
  private final FieldSpecResolver resolver;
  private final FieldProcessor processor;
  private final SortHelper sortHelper;

  public VparamService(TypeRegistry types, FilterRegistry filters, VparamProperties props,
      List<DocumentExtractor> extractors) {
    this.types = types;
    this.filters = filters;
    this.props = props;
    this.resolver = new FieldSpecResolver(types, filters, props);
    this.processor = new FieldProcessor(extractors);
    this.sortHelper = new SortHelper(props);
  }

  public ValidationContext newContext(ParamSource source) {
    return new ValidationContext(source);
  }

  public Map<String, Object> validateMany(ValidationContext context, FieldSpecs specs) {
    List<ResolvedField> fields = new ArrayList<>(specs.getFields().size());
    specs.getFields().forEach((name, spec) -> {
      if (spec != null && spec.getSkip() != null && spec.getSkip().getAsBoolean()) {
        log.debug("Field '{}' skipped", name);
        return;
      }
      ResolvedField field = resolver.resolve(name, spec, specs.getOptional(), specs.getSkipundef());
      if (field.getSelector() != null && !processor.supports(field.getSelector().kind())) {
        throw new ConfigurationException(
            "No extractor registered for selector " + field.getSelector().kind() + " of field \"" + name + "\"");
      }
      fields.add(field);
    });

    context.getErrors().reset();
    Map<String, Object> result = new LinkedHashMap<>();
    for (ResolvedField field : fields) {
      processor.process(context, field, result);
    }
    return Collections.unmodifiableMap(result);
  }

  public Object validateOne(ValidationContext context, String name, FieldSpec spec) {
    if (name == null) {
      throw new ConfigurationException("Parameter name required");
    }
    if (spec == null) {
      throw new ConfigurationException("Parameter type or definition required");
    }
    return validateMany(context, FieldSpecs.builder().field(name, spec).build()).get(name);
  }

  public Object validateOne(ValidationContext context, String name, String type) {
    if (type == null) {
      throw new ConfigurationException("Parameter type or definition required");
    }
    return validateOne(context, name, FieldSpec.of(type));
  }

  /**
   * Like {@link #validateMany} with the paging fields in front. The paging fields replace caller
   * fields of the same name.
   */
  public Map<String, Object> validateSorted(ValidationContext context, List<String> columns, FieldSpecs specs) {
    Map<String, FieldSpec> sortFields = sortHelper.sortFields(columns);
    FieldSpecs.Builder merged = FieldSpecs.builder()
        .optional(specs.getOptional())
        .skipundef(specs.getSkipundef())
        .fields(sortFields);
    specs.getFields().forEach((name, spec) -> {
      if (!sortFields.containsKey(name)) {
        merged.field(name, spec);
      }
    });
    return validateMany(context, merged.build());
  }

  public Optional<TypeDefinition> type(String name) {
    return types.get(name);
  }

  public TypeDefinition type(String name, TypeDefinition definition) {
    return types.set(name, definition);
  }

  public Optional<FilterDefinition> filter(String name) {
    return filters.get(name);
  }

  public FilterDefinition filter(String name, Filter filter) {
    return filters.set(name, filter);
  }

  public SortedSet<String> typeNames() {
    return types.names();
  }

  public SortedSet<String> filterNames() {
    return filters.names();
  }

  /**
   * CSS classes for a field's input element: the configured error class plus {@code extra} when
   * the field has an error, otherwise an empty string.
   */
  public String errorClass(ValidationContext context, String name, String... extra) {
    if (context.errorFor(name).isEmpty()) {
      return "";
    }
    List<String> classes = new ArrayList<>();
    if (props.getErrorClass() != null && !props.getErrorClass().isEmpty()) {
      classes.add(props.getErrorClass());
    }
    Collections.addAll(classes, extra);
    return String.join(" ", classes);
  }

  /**
   * The raw input for redisplaying a form: {@code defaultValue} when nothing was sent, the value
   * when one was, the list of values when several were.
   */
  public Object rawValue(ValidationContext context, String name, Object defaultValue) {
    List<String> values = context.getSource().values(name);
    if (values.isEmpty()) {
      return defaultValue;
    }
    return values.size() == 1 ? values.get(0) : Collections.unmodifiableList(new ArrayList<>(values));
  }
}
