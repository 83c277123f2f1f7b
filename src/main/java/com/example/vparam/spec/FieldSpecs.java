package com.example.vparam.spec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The fields of one validateMany call, plus call-wide defaults for {@code optional} and
 * {@code skipundef} that apply to fields which do not set them.
 */
public final class FieldSpecs {

  private final Map<String, FieldSpec> fields;
  private final Boolean optional;
  private final Boolean skipundef;

  private FieldSpecs(Map<String, FieldSpec> fields, Boolean optional, Boolean skipundef) {
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    this.optional = optional;
    this.skipundef = skipundef;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static FieldSpecs of(Map<String, FieldSpec> fields) {
    return builder().fields(fields).build();
  }

  public Map<String, FieldSpec> getFields() {
    return fields;
  }

  public Boolean getOptional() {
    return optional;
  }

  public Boolean getSkipundef() {
    return skipundef;
  }

  public static final class Builder {
    private final Map<String, FieldSpec> fields = new LinkedHashMap<>();
    private Boolean optional;
    private Boolean skipundef;

    public Builder field(String name, FieldSpec spec) {
      fields.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(spec, "spec"));
      return this;
    }

    /** Shorthand for a field that only names its type. */
    public Builder field(String name, String type) {
      return field(name, FieldSpec.of(type));
    }

    public Builder fields(Map<String, FieldSpec> specs) {
      specs.forEach(this::field);
      return this;
    }

    public Builder optional(Boolean optional) {
      this.optional = optional;
      return this;
    }

    public Builder skipundef(Boolean skipundef) {
      this.skipundef = skipundef;
      return this;
    }

    public FieldSpecs build() {
      return new FieldSpecs(fields, optional, skipundef);
    }
  }
}
