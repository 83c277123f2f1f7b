package com.example.vparam.request;

import com.example.vparam.spec.FieldSpec;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * JSON form of a field spec. Functions cannot travel over the wire, so only the type, flags,
 * default, selector and filter arguments are supported.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class FieldDescriptor {
  private String type;

  @JsonProperty("default")
  private Object defaultValue;

  private Boolean optional;
  private Boolean array;
  private Boolean skipundef;

  private String jpath;
  private String xpath;
  private String cpath;

  /** Filter name to argument, e.g. {@code {"range": [1, 10], "regexp": "^a"}}. */
  @Builder.Default
  private Map<String, Object> filters = new LinkedHashMap<>();

  public FieldSpec toSpec() {
    FieldSpec.FieldSpecBuilder spec = FieldSpec.builder()
        .type(type)
        .defaultValue(defaultValue)
        .optional(optional)
        .array(array)
        .skipundef(skipundef);
    if (jpath != null) {
      spec.jpath(jpath);
    } else if (xpath != null) {
      spec.xpath(xpath);
    } else if (cpath != null) {
      spec.cpath(cpath);
    }
    if (filters != null) {
      spec.filters(filters);
    }
    return spec.build();
  }
}
