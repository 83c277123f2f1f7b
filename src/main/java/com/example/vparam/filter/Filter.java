package com.example.vparam.filter;

/**
 * Extra constraint applied to a field's post-filtered value. Returns {@code null} when the value
 * passes, otherwise the error message. {@code argument} is whatever the field spec attached to
 * the filter name: a scalar, a pair or a list.
 */
@FunctionalInterface
public interface Filter {

  String apply(Object value, Object argument);
}
