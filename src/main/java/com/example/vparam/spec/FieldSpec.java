package com.example.vparam.spec;

import com.example.vparam.filter.BuiltinFilters;
import com.example.vparam.source.Selector;
import com.example.vparam.validation.Validator;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * How one named input is fetched, coerced and checked. Every attribute is optional: unset stages
 * come from the named type, unset flags from the enclosing {@link FieldSpecs} or the
 * configuration.
 *
 * <pre>
 *   FieldSpec.of("?int")
 *   FieldSpec.builder().type("str").size(1, 64).defaultValue("guest").build()
 *   FieldSpec.regexp("^(abc|cde)$")
 * </pre>
 */
@Value
@Builder(toBuilder = true)
public class FieldSpec {

  /** Type name, possibly wrapped in shortcut markers such as {@code @int} or {@code optional[str]}. */
  String type;
  UnaryOperator<Object> pre;
  Validator valid;
  UnaryOperator<Object> post;
  Object defaultValue;
  Boolean optional;
  Boolean array;
  Boolean skipundef;
  /** Evaluated per call; {@code true} leaves the field out entirely. */
  BooleanSupplier skip;
  Selector selector;
  /** Filter name to argument, applied in insertion order. */
  @Singular("filter")
  Map<String, Object> filters;

  public static FieldSpec of(String type) {
    return FieldSpec.builder().type(type).build();
  }

  /** A field with no type that only has to match {@code pattern}. */
  public static FieldSpec regexp(String pattern) {
    return regexp(Pattern.compile(pattern));
  }

  public static FieldSpec regexp(Pattern pattern) {
    return FieldSpec.builder().regexp(pattern).build();
  }

  /** A field with no type whose value is handed to {@code post} as is. */
  public static FieldSpec post(UnaryOperator<Object> post) {
    return FieldSpec.builder().post(post).build();
  }

  /** A field with no type that has to be one of {@code values}. */
  public static FieldSpec in(List<?> values) {
    return FieldSpec.builder().in(values).build();
  }

  public static FieldSpec in(Object... values) {
    return in(Arrays.asList(values));
  }

  public static class FieldSpecBuilder {

    public FieldSpecBuilder min(Number minimum) {
      return filter(BuiltinFilters.MIN, minimum);
    }

    public FieldSpecBuilder max(Number maximum) {
      return filter(BuiltinFilters.MAX, maximum);
    }

    public FieldSpecBuilder range(Number minimum, Number maximum) {
      return filter(BuiltinFilters.RANGE, Arrays.asList(minimum, maximum));
    }

    public FieldSpecBuilder regexp(Pattern pattern) {
      return filter(BuiltinFilters.REGEXP, pattern);
    }

    public FieldSpecBuilder regexp(String pattern) {
      return regexp(Pattern.compile(pattern));
    }

    public FieldSpecBuilder in(List<?> values) {
      return filter(BuiltinFilters.IN, values);
    }

    public FieldSpecBuilder size(int minimum, int maximum) {
      return filter(BuiltinFilters.SIZE, Arrays.asList(minimum, maximum));
    }

    public FieldSpecBuilder jpath(String pointer) {
      return selector(Selector.jpath(pointer));
    }

    public FieldSpecBuilder xpath(String expression) {
      return selector(Selector.xpath(expression));
    }

    public FieldSpecBuilder cpath(String css) {
      return selector(Selector.cpath(css));
    }
  }
}
