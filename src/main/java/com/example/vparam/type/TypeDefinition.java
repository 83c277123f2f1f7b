package com.example.vparam.type;

import com.example.vparam.validation.Validator;
import java.util.function.UnaryOperator;
import lombok.Builder;
import lombok.Value;

/**
 * Behaviour bundle behind a type name. Every stage is optional: {@code pre} turns the raw string
 * into an intermediate value, {@code valid} judges it, {@code post} shapes the final output.
 * Declare one as a bean to register it at startup.
 */
@Value
@Builder(toBuilder = true)
public class TypeDefinition {
  String name;
  UnaryOperator<Object> pre;
  Validator valid;
  UnaryOperator<Object> post;
  /** Used when the field spec has no default of its own. */
  Object defaultValue;
}
