package com.example.vparam.type;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.DigestUtils;

/**
 * A geocoded address, optionally signed by a trusted source. Two input forms are understood:
 *
 * <pre>
 *   Moscow, Red Square : 37.6208 , 55.7539 [5f4dcc3b5aa765d61d8327deb882cf99]
 *   [42, "h", "Moscow, Red Square", 37.6208, 55.7539, "ru", "extra"]
 * </pre>
 *
 * The signature is the hex MD5 of the secret followed by {@link #getFullname()}.
 */
@Slf4j
@Value
@Builder
public class Address {

  private static final Pattern TEXT = Pattern.compile(
      "^(\\s*(\\S.*?)\\s*:\\s*(-?\\d{1,3}(?:\\.\\d+)?)\\s*,\\s*(-?\\d{1,3}(?:\\.\\d+)?)\\s*)"
          + "(?:\\[\\s*(\\w*)\\s*\\])?\\s*$");

  /** Source type whose addresses are trusted without a signature. */
  public static final String TRUSTED_TYPE = "p";

  String address;
  String lon;
  String lat;
  String md5;
  /** The signed part of the input: {@code "ADDRESS : LON , LAT"}. */
  String fullname;
  String id;
  String type;
  String lang;
  /** Either the string {@code "extra"} or a nearby {@link Address}. */
  Object opt;

  public static Address parse(String raw, ObjectMapper mapper) {
    if (raw == null) return null;
    String trimmed = raw.strip();
    if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
      try {
        JsonNode json = mapper.readTree(trimmed);
        if (json.isArray()) {
          return fromJson(json);
        }
      } catch (JsonProcessingException ex) {
        log.warn("Cannot parse address JSON: {}", ex.getOriginalMessage());
      }
      return Address.builder().build();
    }

    Matcher m = TEXT.matcher(raw);
    if (!m.matches()) {
      return Address.builder().build();
    }
    return Address.builder()
        .fullname(m.group(1))
        .address(m.group(2))
        .lon(m.group(3))
        .lat(m.group(4))
        .md5(m.group(5))
        .build();
  }

  private static Address fromJson(JsonNode json) {
    String address = text(json.get(2));
    String lon = text(json.get(3));
    String lat = text(json.get(4));
    JsonNode opt = json.get(6);
    return Address.builder()
        .id(text(json.get(0)))
        .type(text(json.get(1)))
        .address(address)
        .lon(lon)
        .lat(lat)
        .lang(text(json.get(5)))
        .fullname(String.format("%s : %s , %s", orEmpty(address), orEmpty(lon), orEmpty(lat)))
        .opt(opt != null && opt.isArray() ? fromJson(opt) : text(opt))
        .build();
  }

  /** Accepts anything when no secret is configured or the source type is trusted. */
  public boolean check(String secret) {
    if (secret == null || secret.isEmpty()) return true;
    if (TRUSTED_TYPE.equals(type)) return true;
    if (md5 == null) return false;
    String expected = DigestUtils.md5DigestAsHex(
        (secret + fullname).getBytes(StandardCharsets.UTF_8));
    return md5.equals(expected);
  }

  public boolean isExtra() {
    return "extra".equals(opt);
  }

  public boolean isNear() {
    return opt instanceof Address;
  }

  public Double longitude() {
    return Numbers.toDouble(lon);
  }

  public Double latitude() {
    return Numbers.toDouble(lat);
  }

  public static String validate(Object value, String secret) {
    if (value == null) return "Value not defined";
    if (!(value instanceof Address address)) return "Wrong format";
    if (address.getAddress() == null || address.getAddress().isEmpty()) return "Wrong format";
    String lon = Numbers.checkLon(address.getLon());
    if (lon != null) return lon;
    String lat = Numbers.checkLat(address.getLat());
    if (lat != null) return lat;
    return address.check(secret) ? null : "Unknown source";
  }

  private static String text(JsonNode node) {
    return node == null || node.isNull() ? null : node.asText();
  }

  private static String orEmpty(String s) {
    return s == null ? "" : s;
  }
}
