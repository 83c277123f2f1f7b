package com.example.vparam.type;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.regex.Pattern;

/** Email and URL handling. */
public final class Internet {

  // Local part and a dotted domain; quoted local parts and IP literals are not accepted.
  private static final Pattern EMAIL = Pattern.compile(
      "^[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]+(?:\\.[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]+)*"
          + "@(?:[A-Za-z0-9](?:[A-Za-z0-9-]*[A-Za-z0-9])?\\.)+[A-Za-z0-9](?:[A-Za-z0-9-]*[A-Za-z0-9])?$");

  private Internet() {}

  public static String checkEmail(Object value) {
    if (value == null) return "Value not defined";
    String s = value.toString();
    if (s.isEmpty()) return "Value is not set";
    return EMAIL.matcher(s).matches() ? null : "Wrong format";
  }

  /** Parses a URL; text that is not a URI at all yields {@code null}. */
  public static URI parseUrl(Object raw) {
    if (raw == null) return null;
    try {
      return new URI(raw.toString());
    } catch (URISyntaxException ex) {
      return null;
    }
  }

  public static String checkUrl(Object value) {
    if (value == null) return "Value not defined";
    if (value.toString().isEmpty()) return "Value is not set";
    if (!(value instanceof URI uri)) return "Wrong format";
    if (uri.getScheme() == null) return "Protocol not set";
    if (uri.getHost() == null) return "Host not set";
    return null;
  }
}
