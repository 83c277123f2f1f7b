package com.example.vparam.validation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * One recorded failure. {@code index} is set only for array elements; {@code original} is the raw
 * input as received and {@code intermediate} the value after the pre-filter.
 */
@Value
@Builder
@AllArgsConstructor
public class ValidationError {
  Integer index;
  String original;
  Object intermediate;
  String message;
  ValidationStage stage;
  /** Name of the failing filter when {@link #stage} is {@link ValidationStage#FILTER}. */
  String filter;
}
