package com.example.vparam.filter;

import com.example.vparam.type.Numbers;
import com.example.vparam.util.TextUtils;
import com.example.vparam.validation.ConfigurationException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/** The stock filters: min, max, range, regexp, in and size. */
public final class BuiltinFilters {

  public static final String MIN = "min";
  public static final String MAX = "max";
  public static final String RANGE = "range";
  public static final String REGEXP = "regexp";
  public static final String IN = "in";
  public static final String SIZE = "size";

  private BuiltinFilters() {}

  public static void registerAll(FilterRegistry registry) {
    registry.set(MIN, BuiltinFilters::min);
    registry.set(MAX, BuiltinFilters::max);
    registry.set(RANGE, BuiltinFilters::range);
    registry.set(REGEXP, BuiltinFilters::regexp);
    registry.set(IN, BuiltinFilters::in);
    registry.set(SIZE, BuiltinFilters::size);
  }

  static String min(Object value, Object minimum) {
    String numeric = Numbers.checkNumeric(value);
    if (numeric != null) return numeric;
    if (Numbers.toDecimal(value).compareTo(bound(MIN, minimum)) < 0) {
      return "Value should not be less than " + minimum;
    }
    return null;
  }

  static String max(Object value, Object maximum) {
    String numeric = Numbers.checkNumeric(value);
    if (numeric != null) return numeric;
    if (Numbers.toDecimal(value).compareTo(bound(MAX, maximum)) > 0) {
      return "Value should not be greater than " + maximum;
    }
    return null;
  }

  static String range(Object value, Object bounds) {
    List<?> pair = pair(RANGE, bounds);
    String min = min(value, pair.get(0));
    if (min != null) return min;
    return max(value, pair.get(1));
  }

  static String regexp(Object value, Object pattern) {
    if (value == null) return "Value not defined";
    Pattern compiled;
    if (pattern instanceof Pattern p) {
      compiled = p;
    } else if (pattern instanceof String s) {
      compiled = Pattern.compile(s);
    } else {
      throw new ConfigurationException("Filter \"regexp\" expects a pattern, got " + pattern);
    }
    return compiled.matcher(value.toString()).find() ? null : "Wrong format";
  }

  static String in(Object value, Object allowed) {
    Collection<?> candidates = collection(IN, allowed);
    if (value == null) return "Value not defined";
    String actual = value.toString();
    for (Object candidate : candidates) {
      if (candidate != null && actual.equals(candidate.toString())) {
        return null;
      }
    }
    return "Wrong value";
  }

  static String size(Object value, Object bounds) {
    List<?> pair = pair(SIZE, bounds);
    if (value == null) return "Value is not defined";
    if (TextUtils.isEmpty(value)) return "Value is not set";
    int length = TextUtils.length(value);
    if (length < bound(SIZE, pair.get(0)).intValue()) {
      return "Value should not be shorter than " + pair.get(0);
    }
    if (length > bound(SIZE, pair.get(1)).intValue()) {
      return "Value should not be longer than " + pair.get(1);
    }
    return null;
  }

  private static BigDecimal bound(String filter, Object argument) {
    BigDecimal bound = Numbers.toDecimal(argument);
    if (bound == null) {
      throw new ConfigurationException(
          String.format("Filter \"%s\" expects a numeric bound, got %s", filter, argument));
    }
    return bound;
  }

  private static List<?> pair(String filter, Object argument) {
    Collection<?> items = collection(filter, argument);
    if (items.size() != 2) {
      throw new ConfigurationException(
          String.format("Filter \"%s\" expects [min, max], got %s", filter, items));
    }
    return new ArrayList<>(items);
  }

  private static Collection<?> collection(String filter, Object argument) {
    if (argument instanceof Collection<?> c) return c;
    if (argument instanceof Object[] array) return Arrays.asList(array);
    throw new ConfigurationException(
        String.format("Filter \"%s\" expects a list, got %s", filter, argument));
  }
}
