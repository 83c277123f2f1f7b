package com.example.vparam.validation;

import com.example.vparam.source.ParamSource;
import com.example.vparam.source.SelectorKind;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Per-request validation state: where raw values come from, the errors recorded so far and the
 * structured documents already parsed from the body. One instance serves one logical request and
 * must not be shared between requests.
 */
public class ValidationContext {

  private final ParamSource source;
  private final ErrorAccumulator errors = new ErrorAccumulator();
  private final Map<SelectorKind, Optional<Object>> documents = new EnumMap<>(SelectorKind.class);

  public ValidationContext(ParamSource source) {
    this.source = Objects.requireNonNull(source, "source");
  }

  public ParamSource getSource() {
    return source;
  }

  public ErrorAccumulator getErrors() {
    return errors;
  }

  /**
   * Returns the body parsed for {@code kind}, invoking {@code parser} on the first request only.
   * An unparseable body is remembered as absent.
   */
  public Optional<Object> document(SelectorKind kind, Function<String, Object> parser) {
    return documents.computeIfAbsent(kind, k -> Optional.ofNullable(parser.apply(source.body())));
  }

  public Optional<String> errorFor(String name) {
    return errors.errorFor(name);
  }

  public Optional<String> errorFor(String name, int index) {
    return errors.errorFor(name, index);
  }

  public Map<String, List<ValidationError>> allErrors() {
    return errors.all();
  }

  public int errorCount() {
    return errors.count();
  }

  /** Failing elements of an array field; 0 or 1 for a scalar field. */
  public int errorCount(String name) {
    return errors.count(name);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /** Marks a field as invalid from application code, e.g. after a uniqueness check. */
  public void recordError(String name, String message) {
    errors.record(name, false, ValidationError.builder()
        .message(Objects.requireNonNull(message, "message"))
        .stage(ValidationStage.MANUAL)
        .build());
  }

  /** Drops recorded errors and parsed documents so the context can serve a fresh request. */
  public void reset() {
    errors.reset();
    documents.clear();
  }
}
