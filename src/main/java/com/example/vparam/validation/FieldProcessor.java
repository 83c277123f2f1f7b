package com.example.vparam.validation;

import com.example.vparam.source.DocumentExtractor;
import com.example.vparam.source.Selector;
import com.example.vparam.source.SelectorKind;
import com.example.vparam.spec.BoundFilter;
import com.example.vparam.spec.ResolvedField;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one resolved field through fetch, pre, valid, default, post and filters, recording value
 * errors in the context and writing the output into the result map.
 *
 * <p>For every raw element:
 *
 * <ol>
 *   <li>a defined raw value goes through {@code pre};
 *   <li>{@code valid} judges the intermediate value; on failure the output is the default;
 *   <li>an undefined raw value always outputs the default;
 *   <li>{@code post} shapes the output, default included;
 *   <li>filters check the post-shaped output in declaration order, the first failure replacing the
 *       output with the default.
 * </ol>
 *
 * An element reports at most one error. A failure is kept silent when the field has a default,
 * or when it is optional and the raw element was undefined or blank.
 */
@Slf4j
public class FieldProcessor {

  static final String EMPTY_ARRAY = "Empty array";

  private final Map<SelectorKind, DocumentExtractor> extractors = new EnumMap<>(SelectorKind.class);

  public FieldProcessor(List<DocumentExtractor> extractors) {
    List<DocumentExtractor> safeExtractors = extractors == null ? List.of() : extractors;
    safeExtractors.stream()
        .filter(Objects::nonNull)
        .forEach(extractor -> this.extractors.put(extractor.kind(), extractor));
  }

  public boolean supports(SelectorKind kind) {
    return extractors.containsKey(kind);
  }

  public void process(ValidationContext context, ResolvedField field, Map<String, Object> result) {
    String name = field.getName();
    List<String> raws = new ArrayList<>(fetch(context, field));
    boolean array = field.isArray() || raws.size() > 1;
    if (raws.isEmpty() && !array) {
      raws.add(null);
    }

    context.getErrors().clear(name);

    List<Object> outputs = new ArrayList<>(raws.size());
    for (int index = 0; index < raws.size(); index++) {
      Object out = processElement(context, field, array, index, raws.get(index));
      if (out != null || !field.isSkipundef()) {
        outputs.add(out);
      }
    }

    if (array && !field.isOptional() && raws.isEmpty()) {
      context.getErrors().record(name, true, ValidationError.builder()
          .message(EMPTY_ARRAY)
          .stage(ValidationStage.EMPTY_ARRAY)
          .build());
    }

    if (array) {
      result.put(name, Collections.unmodifiableList(outputs));
    } else if (!outputs.isEmpty()) {
      result.put(name, outputs.get(0));
    }

    log.debug("Field '{}': {} raw value(s), array={}, error={}",
        name, raws.size(), array, context.errorFor(name).orElse("none"));
  }

  List<String> fetch(ValidationContext context, ResolvedField field) {
    Selector selector = field.getSelector();
    if (selector == null) {
      return context.getSource().values(field.getName());
    }
    DocumentExtractor extractor = extractors.get(selector.kind());
    if (extractor == null) {
      throw new ConfigurationException(
          "No extractor registered for selector " + selector.kind() + " of field \"" + field.getName() + "\"");
    }
    return context.document(selector.kind(), extractor::parse)
        .map(document -> extractor.select(document, selector.path()))
        .orElse(List.of());
  }

  private Object processElement(
      ValidationContext context, ResolvedField field, boolean array, int index, String raw) {
    Object value = raw;
    if (raw != null && field.getPre() != null) {
      value = field.getPre().apply(raw);
    }

    boolean failed = false;
    if (field.getValid() != null) {
      String message = field.getValid().validate(value);
      if (message != null) {
        failed = true;
        report(context, field, array, index, raw, value, message, null);
      }
    }

    Object out = raw == null || failed ? field.getDefaultValue() : value;
    if (field.getPost() != null) {
      out = field.getPost().apply(out);
    }
    if (failed) {
      return out;
    }

    for (BoundFilter filter : field.getFilters()) {
      String message = filter.apply(out);
      if (message != null) {
        report(context, field, array, index, raw, out, message, filter.name());
        return field.getDefaultValue();
      }
    }
    return out;
  }

  private void report(ValidationContext context, ResolvedField field, boolean array, int index,
      String raw, Object intermediate, String message, String filter) {
    if (field.getDefaultValue() != null) {
      return;
    }
    if (field.isOptional() && (raw == null || raw.isBlank())) {
      return;
    }
    context.getErrors().record(field.getName(), array, ValidationError.builder()
        .index(array ? index : null)
        .original(raw)
        .intermediate(intermediate)
        .message(message)
        .stage(filter == null ? ValidationStage.VALID : ValidationStage.FILTER)
        .filter(filter)
        .build());
  }
}
