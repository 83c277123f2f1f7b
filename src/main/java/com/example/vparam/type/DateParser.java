package com.example.vparam.type;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Parses the loose date input accepted by the date, time and datetime types:
 *
 * <ul>
 *   <li>epoch seconds, e.g. {@code 1420070400};
 *   <li>an offset from now {@code [+-][DAYS ][HOURS:]MINUTES[:SECONDS]}, e.g. {@code +15},
 *       {@code -8 3:15:44};
 *   <li>{@code DD.MM.YYYY[ time]}, with short years completed from the current year;
 *   <li>a bare {@code HH:MM[:SS]}, taken as today;
 *   <li>ISO-like {@code YYYY-MM-DD[( |T)HH:MM[:SS[.fraction]][ ][offset]]} and RFC 1123.
 * </ul>
 *
 * Results are always expressed in the configured zone.
 */
@Slf4j
public class DateParser {

  private static final Pattern EPOCH = Pattern.compile("^\\d+$");
  private static final Pattern RELATIVE = Pattern.compile(
      "^([+-])\\s*(?:(\\d+)\\s+)?(?:(\\d+):)??(\\d+)(?::(\\d+))?$");
  private static final Pattern RUSSIAN = Pattern.compile("^(\\d{1,2})\\.(\\d{1,2})\\.(\\d{1,4})(.*)$");
  private static final Pattern TIME_ONLY = Pattern.compile("^\\d{2}:");

  private static final DateTimeFormatter ISO_LIKE = new DateTimeFormatterBuilder()
      .parseCaseInsensitive()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .optionalStart()
        .optionalStart().appendLiteral('T').optionalEnd()
        .optionalStart().appendLiteral(' ').optionalEnd()
        .appendPattern("HH:mm")
        .optionalStart().appendPattern(":ss").optionalEnd()
        .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
        .optionalStart().appendLiteral(' ').optionalEnd()
        .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
        .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
      .optionalEnd()
      .toFormatter();

  private static final List<DateTimeFormatter> FORMATS =
      List.of(ISO_LIKE, DateTimeFormatter.RFC_1123_DATE_TIME);

  private final Clock clock;
  private final ZoneId zone;

  public DateParser(Clock clock, ZoneId zone) {
    this.clock = clock;
    this.zone = zone;
  }

  public ZoneId getZone() {
    return zone;
  }

  /** Returns the parsed moment, or {@code null} when the input is blank or not understood. */
  public ZonedDateTime parse(Object raw) {
    if (raw == null) return null;
    String s = raw.toString().strip();
    if (s.isEmpty()) return null;

    if (EPOCH.matcher(s).matches()) {
      try {
        return Instant.ofEpochSecond(Long.parseLong(s)).atZone(zone);
      } catch (NumberFormatException | DateTimeException ex) {
        return null;
      }
    }
    if (s.startsWith("+") || s.startsWith("-")) {
      return relative(s);
    }

    Matcher ru = RUSSIAN.matcher(s);
    if (ru.matches()) {
      String year = ru.group(3);
      String current = String.valueOf(now().getYear());
      if (year.length() < current.length()) {
        year = current.substring(0, current.length() - year.length()) + year;
      }
      s = String.format("%s-%02d-%02d%s",
          year, Integer.parseInt(ru.group(2)), Integer.parseInt(ru.group(1)), ru.group(4));
    }
    if (TIME_ONLY.matcher(s).find()) {
      s = now().toLocalDate() + " " + s;
    }
    return absolute(s);
  }

  private ZonedDateTime relative(String s) {
    Matcher m = RELATIVE.matcher(s);
    if (!m.matches()) return null;
    long sign = "+".equals(m.group(1)) ? 1 : -1;
    try {
      ZonedDateTime dt = now();
      if (m.group(2) != null) dt = dt.plusDays(sign * Long.parseLong(m.group(2)));
      if (m.group(3) != null) dt = dt.plusHours(sign * Long.parseLong(m.group(3)));
      dt = dt.plusMinutes(sign * Long.parseLong(m.group(4)));
      if (m.group(5) != null) dt = dt.plusSeconds(sign * Long.parseLong(m.group(5)));
      return dt;
    } catch (NumberFormatException | DateTimeException | ArithmeticException ex) {
      log.debug("Relative date '{}' is out of range", s);
      return null;
    }
  }

  private ZonedDateTime absolute(String s) {
    for (DateTimeFormatter format : FORMATS) {
      try {
        TemporalAccessor parsed =
            format.parseBest(s, ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
        if (parsed instanceof ZonedDateTime zoned) return zoned.withZoneSameInstant(zone);
        if (parsed instanceof LocalDateTime local) return local.atZone(zone);
        return ((LocalDate) parsed).atStartOfDay(zone);
      } catch (DateTimeParseException ex) {
        log.trace("'{}' does not match {}", s, format);
      }
    }
    return null;
  }

  private ZonedDateTime now() {
    return ZonedDateTime.now(clock).withZoneSameInstant(zone);
  }
}
