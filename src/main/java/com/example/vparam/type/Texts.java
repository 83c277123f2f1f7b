package com.example.vparam.type;

import java.util.regex.Pattern;

/** Checks for the plain text types. */
public final class Texts {

  private static final Pattern DIGIT = Pattern.compile("\\d");
  private static final Pattern NON_DIGIT = Pattern.compile("\\D");

  private Texts() {}

  public static String checkStr(Object value) {
    return value == null ? "Value is not defined" : null;
  }

  public static String checkPassword(Object value, int minLength) {
    if (value == null) return "Value is not defined";
    String s = value.toString();
    if (s.codePointCount(0, s.length()) < minLength) {
      return "The length should be greater than " + minLength;
    }
    if (!DIGIT.matcher(s).find() || !NON_DIGIT.matcher(s).find()) {
      return "Value must contain characters and digits";
    }
    return null;
  }
}
