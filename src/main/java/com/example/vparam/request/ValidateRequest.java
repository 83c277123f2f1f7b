package com.example.vparam.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class ValidateRequest {
  /** Flat parameters, every name mapped to the values sent under it. */
  @Builder.Default
  private Map<String, List<String>> params = new LinkedHashMap<>();

  /** Raw body for jpath/xpath/cpath fields. */
  private String body;

  @NotEmpty @Valid
  private Map<String, FieldDescriptor> fields;

  private Boolean optional;
  private Boolean skipundef;

  /** When present the paging fields are added and order-by indexes map onto these columns. */
  private List<String> sort;
}
