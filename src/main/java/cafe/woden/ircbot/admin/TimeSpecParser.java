package cafe.woden.ircbot.admin;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns chat time strings into a delay in seconds from now.
 *
 * <p>Understood forms, each optionally led by {@code for}, {@code in}, {@code until},
 * {@code after} or {@code at}:
 *
 * <ul>
 *   <li>a bare number of seconds: {@code 90}
 *   <li>durations, compact or spelled out and chainable: {@code 10m}, {@code 2h30m},
 *       {@code 1 day and 3 hours}, {@code an hour}, {@code 3 weeks}
 *   <li>clock times, next occurrence: {@code 18:30}, {@code 6pm}, {@code 6:15 am}, {@code noon},
 *       {@code midnight}
 *   <li>{@code tomorrow}
 * </ul>
 *
 * Results are never below one second.
 */
public final class TimeSpecParser {
  static final String NOT_UNDERSTOOD = "I don't understand when you want me to do that";

  private static final Pattern LEAD = Pattern.compile("^(?:for|in|until|after|at)\\s+");
  private static final Pattern NUMBER = Pattern.compile("^\\d+(?:\\.\\d+)?$");
  private static final Pattern CLOCK =
      Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)?$");
  private static final Pattern DURATION_PART =
      Pattern.compile(
          "(\\d+(?:\\.\\d+)?|an?|one)\\s*"
              + "(seconds?|secs?|s|months?|minutes?|mins?|m|hours?|hrs?|h"
              + "|days?|d|weeks?|wks?|w|years?|y)");
  private static final Pattern SEPARATOR = Pattern.compile("(?:\\s*,\\s*|\\s+and\\s+|\\s+)");

  private TimeSpecParser() {}

  public static double parseSeconds(String spec, Instant now) {
    return parseSeconds(spec, ZonedDateTime.ofInstant(now, ZoneId.systemDefault()));
  }

  public static double parseSeconds(String spec, ZonedDateTime now) {
    Objects.requireNonNull(now, "now");
    String s = Objects.toString(spec, "").trim().toLowerCase(Locale.ROOT);
    s = LEAD.matcher(s).replaceFirst("").trim();
    if (s.isEmpty()) throw new TimeSpecParseException(spec);

    if (NUMBER.matcher(s).matches()) {
      return clamp(Double.parseDouble(s));
    }

    switch (s) {
      case "tomorrow":
        return clamp(86_400);
      case "noon":
        return untilNext(now, LocalTime.NOON);
      case "midnight":
        return untilNext(now, LocalTime.MIDNIGHT);
      default:
        break;
    }

    Matcher clock = CLOCK.matcher(s);
    if (clock.matches() && (clock.group(2) != null || clock.group(3) != null)) {
      int hour = Integer.parseInt(clock.group(1));
      int minute = clock.group(2) == null ? 0 : Integer.parseInt(clock.group(2));
      String ampm = clock.group(3);
      if (ampm != null) {
        if (hour < 1 || hour > 12) throw new TimeSpecParseException(spec);
        hour = hour % 12 + ("pm".equals(ampm) ? 12 : 0);
      }
      if (hour > 23 || minute > 59) throw new TimeSpecParseException(spec);
      return untilNext(now, LocalTime.of(hour, minute));
    }

    double total = parseDuration(s);
    if (total < 0) throw new TimeSpecParseException(spec);
    return clamp(total);
  }

  /** Sum of all duration parts, or -1 if any of the text is not a duration part. */
  private static double parseDuration(String s) {
    Matcher part = DURATION_PART.matcher(s);
    Matcher sep = SEPARATOR.matcher(s);
    int pos = 0;
    double total = 0;
    boolean any = false;
    while (pos < s.length()) {
      if (any) {
        sep.region(pos, s.length());
        if (sep.lookingAt()) pos = sep.end();
      }
      part.region(pos, s.length());
      if (!part.lookingAt()) return -1;
      total += amount(part.group(1)) * unitSeconds(part.group(2));
      pos = part.end();
      any = true;
    }
    return any ? total : -1;
  }

  private static double amount(String text) {
    return switch (text) {
      case "a", "an", "one" -> 1;
      default -> Double.parseDouble(text);
    };
  }

  private static long unitSeconds(String unit) {
    if (unit.startsWith("mo")) return 30L * 86_400;
    if (unit.startsWith("mi") || unit.equals("m")) return 60;
    if (unit.startsWith("s")) return 1;
    if (unit.startsWith("h")) return 3_600;
    if (unit.startsWith("d")) return 86_400;
    if (unit.startsWith("w")) return 7L * 86_400;
    return 365L * 86_400;
  }

  private static double untilNext(ZonedDateTime now, LocalTime at) {
    ZonedDateTime target = now.with(at);
    if (!target.isAfter(now)) target = target.plusDays(1);
    return clamp((target.toInstant().toEpochMilli() - now.toInstant().toEpochMilli()) / 1000.0);
  }

  private static double clamp(double seconds) {
    return Math.max(1, seconds);
  }
}
