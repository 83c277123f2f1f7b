package com.example.vparam.validation;

/**
 * Checks a pre-filtered value. Returns {@code null} when the value is acceptable, otherwise a
 * human readable error message.
 */
@FunctionalInterface
public interface Validator {

  String validate(Object value);
}
