package com.example.vparam.response;

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
public class ValidateResponse {
  private Map<String, Object> values;
  private Map<String, List<ErrorView>> errors;
  private int errorCount;

  /** Set instead of values when the field specs themselves are unusable. */
  private List<String> problems;
}
