package com.example.vparam.util;

public final class TextUtils {

  private TextUtils() {}

  /** Strips leading and trailing whitespace, keeping {@code null} as {@code null}. */
  public static String trim(String value) {
    return value == null ? null : value.strip();
  }

  public static String trim(Object value) {
    return value == null ? null : trim(value.toString());
  }

  public static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  public static boolean isEmpty(Object value) {
    return value == null || value.toString().isEmpty();
  }

  /** Number of user-perceived characters: code points, not UTF-16 units. */
  public static int length(Object value) {
    String s = value.toString();
    return s.codePointCount(0, s.length());
  }
}
