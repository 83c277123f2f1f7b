package com.example.vparam.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Collects value errors per field for one {@link ValidationContext}. Array-shaped fields keep a
 * list of records (at most one per failing index); scalar fields keep a single record that later
 * records overwrite.
 */
public class ErrorAccumulator {

  private final Map<String, FieldErrors> errors = new LinkedHashMap<>();

  public void record(String field, boolean arrayShaped, ValidationError error) {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(error, "error");
    FieldErrors existing = errors.get(field);
    if (arrayShaped) {
      if (existing == null || !existing.array) {
        existing = new FieldErrors(true);
        errors.put(field, existing);
      }
      existing.records.add(error);
    } else {
      FieldErrors single = new FieldErrors(false);
      single.records.add(error);
      errors.put(field, single);
    }
  }

  /** Forgets earlier records of a field that is about to be validated again. */
  public void clear(String field) {
    errors.remove(field);
  }

  public void reset() {
    errors.clear();
  }

  /** Number of fields with at least one error. */
  public int count() {
    return errors.size();
  }

  public boolean isEmpty() {
    return errors.isEmpty();
  }

  /**
   * All errors by field. Scalar fields map to a one-element list whose record carries no index.
   */
  public Map<String, List<ValidationError>> all() {
    Map<String, List<ValidationError>> out = new LinkedHashMap<>();
    errors.forEach((field, fieldErrors) ->
        out.put(field, Collections.unmodifiableList(new ArrayList<>(fieldErrors.records))));
    return Collections.unmodifiableMap(out);
  }

  /**
   * Number of error records of one field: failing elements for an array field, 0 or 1 for a
   * scalar field.
   */
  public int count(String field) {
    FieldErrors fieldErrors = errors.get(field);
    return fieldErrors == null ? 0 : fieldErrors.records.size();
  }

  /**
   * Message of the field's error, or of its first recorded element error for arrays. Use {@link
   * #count(String)} for the number of failing elements.
   */
  public Optional<String> errorFor(String field) {
    FieldErrors fieldErrors = errors.get(field);
    if (fieldErrors == null || fieldErrors.records.isEmpty()) {
      return Optional.empty();
    }
    return Optional.ofNullable(fieldErrors.records.get(0).getMessage());
  }

  /** Message recorded for one array element; scalar fields ignore the index. */
  public Optional<String> errorFor(String field, int index) {
    FieldErrors fieldErrors = errors.get(field);
    if (fieldErrors == null) {
      return Optional.empty();
    }
    if (!fieldErrors.array) {
      return errorFor(field);
    }
    return fieldErrors.records.stream()
        .filter(e -> e.getIndex() != null && e.getIndex() == index)
        .findFirst()
        .map(ValidationError::getMessage);
  }

  private static final class FieldErrors {
    private final boolean array;
    private final List<ValidationError> records = new ArrayList<>();

    private FieldErrors(boolean array) {
      this.array = array;
    }
  }
}
