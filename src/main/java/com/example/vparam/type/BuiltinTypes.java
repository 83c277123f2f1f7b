package com.example.vparam.type;

import com.example.vparam.config.VparamProperties;
import com.example.vparam.util.TextUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/** The stock type catalogue. */
@Slf4j
public final class BuiltinTypes {

  private static final Pattern FALSE = Pattern.compile("^(?:0|no|false|fail)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern TRUE = Pattern.compile("^(?:1|yes|true|ok)$", Pattern.CASE_INSENSITIVE);

  private BuiltinTypes() {}

  public static void registerAll(
      TypeRegistry registry, VparamProperties props, Clock clock, ObjectMapper mapper) {
    DateParser dates = new DateParser(clock, props.zone());

    // numbers
    registry.set(TypeDefinition.builder().name("int")
        .pre(Numbers::parseInt)
        .valid(Numbers::checkInt)
        .post(Numbers::toInteger)
        .build());
    registry.set(TypeDefinition.builder().name("numeric")
        .pre(Numbers::parseNumber)
        .valid(Numbers::checkNumeric)
        .post(Numbers::toDecimal)
        .build());
    registry.alias("number", "numeric");
    registry.set(TypeDefinition.builder().name("money")
        .pre(Numbers::parseNumber)
        .valid(Numbers::checkMoney)
        .post(Numbers::toDecimal)
        .build());
    registry.set(TypeDefinition.builder().name("percent")
        .pre(Numbers::parseNumber)
        .valid(Numbers::checkPercent)
        .post(Numbers::toDecimal)
        .build());
    registry.set(TypeDefinition.builder().name("lon")
        .pre(Numbers::parseNumber)
        .valid(Numbers::checkLon)
        .post(Numbers::toDouble)
        .build());
    registry.set(TypeDefinition.builder().name("lat")
        .pre(Numbers::parseNumber)
        .valid(Numbers::checkLat)
        .post(Numbers::toDouble)
        .build());

    // text
    registry.set(TypeDefinition.builder().name("str")
        .pre(TextUtils::trim)
        .valid(Texts::checkStr)
        .build());
    registry.set(TypeDefinition.builder().name("text")
        .valid(Texts::checkStr)
        .build());
    int passwordMin = props.getPasswordMin();
    registry.set(TypeDefinition.builder().name("password")
        .valid(v -> Texts.checkPassword(v, passwordMin))
        .build());
    registry.set(TypeDefinition.builder().name("uuid")
        .pre(TextUtils::trim)
        .valid(Identifiers::checkUuid)
        .post(v -> v == null ? null : v.toString().toLowerCase(Locale.ROOT))
        .build());

    // dates
    registry.set(dateType("date", dates, props.getDateFormat()));
    registry.set(dateType("time", dates, props.getTimeFormat()));
    registry.set(dateType("datetime", dates, props.getDatetimeFormat()));

    registry.set(TypeDefinition.builder().name("bool")
        .pre(v -> parseBool(TextUtils.trim(v)))
        .valid(v -> v == null || v instanceof Boolean ? null : "Wrong format")
        .build());

    // internet
    registry.set(TypeDefinition.builder().name("email")
        .pre(TextUtils::trim)
        .valid(Internet::checkEmail)
        .build());
    registry.set(TypeDefinition.builder().name("url")
        .pre(v -> Internet.parseUrl(TextUtils.trim(v)))
        .valid(Internet::checkUrl)
        .build());
    String country = props.getPhoneCountry();
    String region = props.getPhoneRegion();
    registry.set(TypeDefinition.builder().name("phone")
        .pre(v -> Phones.parse(TextUtils.trim(v), country, region))
        .valid(Phones::check)
        .build());

    // structures
    registry.set(TypeDefinition.builder().name("json")
        .pre(v -> parseJson(v, mapper))
        .valid(v -> v == null ? "Wrong format" : null)
        .build());
    String secret = props.getAddressSecret();
    registry.set(TypeDefinition.builder().name("address")
        .pre(v -> v == null ? null : Address.parse(v.toString(), mapper))
        .valid(v -> Address.validate(v, secret))
        .build());

    // identifiers
    registry.set(TypeDefinition.builder().name("isin")
        .pre(Identifiers::parseIsin)
        .valid(Identifiers::checkIsin)
        .build());
    registry.set(TypeDefinition.builder().name("inn")
        .pre(TextUtils::trim)
        .valid(Identifiers::checkInn)
        .build());
    registry.set(TypeDefinition.builder().name("kpp")
        .pre(TextUtils::trim)
        .valid(Identifiers::checkKpp)
        .build());
  }

  /**
   * Empty input is {@code false}. An unknown token is returned as it is so that the validator can
   * reject it; a missing value (an unchecked checkbox) never reaches here and passes as the default.
   */
  static Object parseBool(Object raw) {
    if (raw == null) return null;
    String s = raw.toString();
    if (s.isEmpty() || FALSE.matcher(s).matches()) return Boolean.FALSE;
    if (TRUE.matcher(s).matches()) return Boolean.TRUE;
    return s;
  }

  static Object parseJson(Object raw, ObjectMapper mapper) {
    if (raw == null || raw.toString().isEmpty()) return null;
    try {
      return mapper.readTree(raw.toString());
    } catch (JsonProcessingException ex) {
      log.warn("Cannot parse JSON value: {}", ex.getOriginalMessage());
      return null;
    }
  }

  private static TypeDefinition dateType(String name, DateParser dates, String format) {
    DateTimeFormatter formatter =
        format == null || format.isBlank() ? null : DateTimeFormatter.ofPattern(format);
    UnaryOperator<Object> post = v -> {
      if (formatter != null && v instanceof ZonedDateTime dt) {
        return formatter.format(dt);
      }
      return v;
    };
    return TypeDefinition.builder().name(name)
        .pre(v -> dates.parse(TextUtils.trim(v)))
        .valid(v -> v == null ? "Value is not defined" : null)
        .post(post)
        .build();
  }
}
