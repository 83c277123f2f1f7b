package com.example.vparam.type;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Integer, decimal, money, percent and coordinate parsing and checks. */
public final class Numbers {

  private static final Pattern INT_TOKEN = Pattern.compile("[-+]?\\d+");
  private static final Pattern NUMBER_TOKEN = Pattern.compile("[-+]?\\d+(?:\\.\\d*)?");
  private static final Pattern NUMERIC = Pattern.compile("^[-+]?\\d+(?:\\.\\d*)?$");
  private static final Pattern MONEY_FRACTION = Pattern.compile("\\.\\d{0,2}$");

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private Numbers() {}

  /** First signed integer token found anywhere in the input, e.g. {@code "abc-12x"} gives "-12". */
  public static String parseInt(Object raw) {
    return firstMatch(INT_TOKEN, raw);
  }

  /** First signed decimal token found anywhere in the input. */
  public static String parseNumber(Object raw) {
    return firstMatch(NUMBER_TOKEN, raw);
  }

  public static String checkInt(Object value) {
    if (value == null) return "Value is not defined";
    String s = value.toString();
    if (s.isEmpty()) return "Value is not set";
    try {
      Integer.parseInt(s.startsWith("+") ? s.substring(1) : s);
    } catch (NumberFormatException ex) {
      return "Value is out of range";
    }
    return null;
  }

  public static String checkNumeric(Object value) {
    if (value == null) return "Value is not defined";
    if (value instanceof Number) return null;
    String s = value.toString();
    if (s.isEmpty()) return "Value is not set";
    if (!NUMERIC.matcher(s).matches()) return "Wrong format";
    return null;
  }

  public static String checkMoney(Object value) {
    String numeric = checkNumeric(value);
    if (numeric != null) return numeric;
    String s = value.toString();
    if (s.contains(".") && !MONEY_FRACTION.matcher(s).find()) return "Invalid fractional part";
    return null;
  }

  public static String checkPercent(Object value) {
    String numeric = checkNumeric(value);
    if (numeric != null) return numeric;
    BigDecimal d = toDecimal(value);
    if (d.signum() < 0) return "Value must be greater than 0";
    if (d.compareTo(HUNDRED) > 0) return "Value must be less than 100";
    return null;
  }

  public static String checkLon(Object value) {
    return checkDegrees(value, 180);
  }

  public static String checkLat(Object value) {
    return checkDegrees(value, 90);
  }

  private static String checkDegrees(Object value, int limit) {
    if (value == null) return "Value not defined";
    String numeric = checkNumeric(value);
    if (numeric != null) return numeric;
    BigDecimal d = toDecimal(value);
    if (d.compareTo(BigDecimal.valueOf(-limit)) < 0) {
      return "Value should not be less than -" + limit + "°";
    }
    if (d.compareTo(BigDecimal.valueOf(limit)) > 0) {
      return "Value should not be greater than " + limit + "°";
    }
    return null;
  }

  /**
   * Numeric view of a value: numbers as they are, strings in plain decimal notation, anything else
   * {@code null}.
   */
  public static BigDecimal toDecimal(Object value) {
    if (value == null) return null;
    if (value instanceof BigDecimal d) return d;
    if (value instanceof Number n) return new BigDecimal(n.toString());
    String s = value.toString();
    if (!NUMERIC.matcher(s).matches()) return null;
    if (s.startsWith("+")) s = s.substring(1);
    if (s.endsWith(".")) s = s.substring(0, s.length() - 1);
    return new BigDecimal(s);
  }

  /** Integer view of a value; {@code null} when it is not a plain integer within range. */
  public static Integer toInteger(Object value) {
    if (value == null) return null;
    if (value instanceof Integer i) return i;
    String s = value.toString();
    try {
      return Integer.valueOf(s.startsWith("+") ? s.substring(1) : s);
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  public static Double toDouble(Object value) {
    BigDecimal d = toDecimal(value);
    return d == null ? null : d.doubleValue();
  }

  private static String firstMatch(Pattern pattern, Object raw) {
    if (raw == null) return null;
    Matcher m = pattern.matcher(raw.toString());
    return m.find() ? m.group() : null;
  }
}
