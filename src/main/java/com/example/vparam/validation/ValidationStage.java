package com.example.vparam.validation;

/** Identifies where in the field pipeline an error was raised. */
public enum ValidationStage {
  /** The type (or field) validator rejected the pre-filtered value. */
  VALID,
  /** An extra filter such as {@code min} or {@code regexp} rejected the post-filtered value. */
  FILTER,
  /** A required array field received no values at all. */
  EMPTY_ARRAY,
  /** Recorded by the caller through {@link ValidationContext#recordError(String, String)}. */
  MANUAL
}
