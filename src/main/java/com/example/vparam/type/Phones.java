package com.example.vparam.type;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Phone normalization to {@code +DIGITS[p|w EXTENSION]}. A dot or comma becomes a wait marker,
 * short numbers get the configured region and country prefixes.
 */
public final class Phones {

  private static final Pattern SPLIT = Pattern.compile("^(\\d+)([wp])?(\\d+)?$", Pattern.CASE_INSENSITIVE);
  private static final Pattern PLUS_DIGIT = Pattern.compile("^\\+\\d");
  private static final Pattern MIN_DIGITS = Pattern.compile("^\\+\\d{11}");
  private static final Pattern MAX_DIGITS = Pattern.compile("^\\+\\d{11,16}(?:\\D|$)");
  private static final Pattern FULL = Pattern.compile("^\\+\\d{11,16}(?:[pw]\\d+)?$");

  private Phones() {}

  public static String parse(Object raw, String country, String region) {
    if (raw == null) return null;
    String s = raw.toString();
    if (s.isEmpty()) return null;

    s = s.replaceAll("[.,]", "w")
        .replaceAll("(?i)[^0-9pw]", "")
        .replaceAll("(?i)w{2,}", "w")
        .replaceAll("(?i)p{2,}", "p");

    Matcher m = SPLIT.matcher(s);
    if (!m.matches()) return null;
    String phone = m.group(1);
    if (region != null && !region.isEmpty() && phone.length() < 11) phone = region + phone;
    if (country != null && !country.isEmpty() && phone.length() < 11) phone = country + phone;
    if (phone.length() < 10) return null;

    StringBuilder out = new StringBuilder("+").append(phone);
    if (m.group(2) != null) out.append(m.group(2).toLowerCase(Locale.ROOT));
    if (m.group(3) != null) out.append(m.group(3));
    return out.toString();
  }

  public static String check(Object value) {
    if (value == null) return "Value not defined";
    String s = value.toString();
    if (s.isEmpty()) return "Value is not set";
    if (!PLUS_DIGIT.matcher(s).find()) return "The number should be in the format +...";
    if (!MIN_DIGITS.matcher(s).find()) return "The number must be a minimum of 11 digits";
    if (!MAX_DIGITS.matcher(s).find()) return "The number should be no more than 16 digits";
    if (!FULL.matcher(s).matches()) return "Wrong format";
    return null;
  }
}
