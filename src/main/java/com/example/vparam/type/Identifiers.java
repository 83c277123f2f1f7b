package com.example.vparam.type;

import java.util.Locale;
import java.util.regex.Pattern;

/** UUID, ISIN and the Russian INN/KPP registration numbers. */
public final class Identifiers {

  private static final Pattern UUID = Pattern.compile(
      "^[0-9a-f]{8}-?[0-9a-f]{4}-?[0-9a-f]{4}-?[0-9a-f]{4}-?[0-9a-f]{12}$",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern ISIN = Pattern.compile("^[A-Z0-9]+$");
  private static final Pattern ISIN_NOISE = Pattern.compile("[^a-zA-Z0-9]");
  private static final Pattern INN = Pattern.compile("^(?:\\d{10}|\\d{12})$");
  private static final Pattern KPP = Pattern.compile("^\\d{9}$");

  private static final int[] INN10 = {2, 4, 10, 3, 5, 9, 4, 6, 8};
  private static final int[] INN12_FIRST = {7, 2, 4, 10, 3, 5, 9, 4, 6, 8};
  private static final int[] INN12_SECOND = {3, 7, 2, 4, 10, 3, 5, 9, 4, 6, 8};

  private Identifiers() {}

  public static String checkUuid(Object value) {
    if (value == null) return "Value is not defined";
    String s = value.toString();
    if (s.isEmpty()) return "Value is not set";
    return UUID.matcher(s).matches() ? null : "Wrong format";
  }

  /** Drops everything but letters and digits and upper-cases the rest. */
  public static String parseIsin(Object raw) {
    if (raw == null) return null;
    return ISIN_NOISE.matcher(raw.toString()).replaceAll("").toUpperCase(Locale.ROOT);
  }

  /** Luhn check over the code with letters expanded to 10..35. */
  public static String checkIsin(Object value) {
    if (value == null) return "Value not defined";
    String s = value.toString();
    if (s.isEmpty()) return "Value not set";
    if (!ISIN.matcher(s).matches()) return "Wrong format";

    StringBuilder digits = new StringBuilder();
    for (char c : s.toCharArray()) {
      if (Character.isLetter(c)) {
        digits.append(c - 'A' + 10);
      } else {
        digits.append(c);
      }
    }
    int crc = 0;
    for (int i = 0; i < digits.length(); i++) {
      int digit = digits.charAt(digits.length() - 1 - i) - '0';
      if (i % 2 == 1) digit *= 2;
      if (digit > 9) digit -= 9;
      crc += digit;
    }
    return crc % 10 == 0 ? null : "Checksum error";
  }

  public static String checkInn(Object value) {
    if (value == null) return "Value not defined";
    String s = value.toString();
    if (s.isEmpty()) return "Value not set";
    if (!INN.matcher(s).matches()) return "Wrong format";

    if (s.length() == 10) {
      return digit(s, 9) == control(s, INN10) ? null : "Checksum error";
    }
    if (digit(s, 10) == control(s, INN12_FIRST) && digit(s, 11) == control(s, INN12_SECOND)) {
      return null;
    }
    return "Checksum error";
  }

  public static String checkKpp(Object value) {
    if (value == null) return "Value not defined";
    String s = value.toString();
    if (s.isEmpty()) return "Value not set";
    return KPP.matcher(s).matches() ? null : "Wrong format";
  }

  private static int control(String s, int[] weights) {
    int sum = 0;
    for (int i = 0; i < weights.length; i++) {
      sum += weights[i] * digit(s, i);
    }
    return sum % 11 % 10;
  }

  private static int digit(String s, int index) {
    return s.charAt(index) - '0';
  }
}
