package com.fourkites.webhook.scheduler.timer;

import static com.cronutils.model.CronType.UNIX;

import com.cronutils.model.Cron;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.parser.CronParser;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates and normalizes crontab and interval definition strings.
 *
 * <p>Crontab strings use the UNIX 5-field layout {@code minute hour day-of-month month
 * day-of-week} and are checked with the cron-utils UNIX definition. {@code ?} in the day fields
 * reads as {@code *}. Interval strings are {@code <integer> <period>}, e.g. {@code 1 minutes}.
 */
public final class TimerSpecParser {
  private TimerSpecParser() {}

  private static final int CRON_FIELDS = 5;

  private static final CronParser UNIX_PARSER =
      new CronParser(CronDefinitionBuilder.instanceDefinitionFor(UNIX));

  private static final Pattern OUT_OF_RANGE =
      Pattern.compile("Value (-?\\d+) not in range \\[(-?\\d+), (-?\\d+)\\]");

  private static final Pattern PARSE_PREFIX = Pattern.compile("^Failed to parse '.*?'\\. ");

  private static final Map<String, String> MACROS =
      Map.of(
          "@yearly", "0 0 1 1 *",
          "@annually", "0 0 1 1 *",
          "@monthly", "0 0 1 * *",
          "@weekly", "0 0 * * 0",
          "@daily", "0 0 * * *",
          "@midnight", "0 0 * * *",
          "@hourly", "0 * * * *");

  /**
   * Parses a crontab string.
   *
   * @param value the crontab string, e.g. {@code 25 * * * *} or {@code @hourly}
   * @return the crontab fields as written, macros expanded
   * @throws TimerSpecException if the string has the wrong shape or a value is out of range
   */
  public static CrontabSpec parseCrontab(String value) throws TimerSpecException {
    if (value == null || value.isBlank()) {
      throw TimerSpecException.crontab(value, "empty crontab string");
    }
    String expression = value.trim();
    if (expression.startsWith("@")) {
      String expanded = MACROS.get(expression.toLowerCase(Locale.ROOT));
      if (expanded == null) {
        throw TimerSpecException.crontab(value, "unknown crontab macro: '" + expression + "'");
      }
      expression = expanded;
    }

    String[] fields = expression.split("\\s+");
    compile(value, fields);
    return new CrontabSpec(fields[0], fields[1], fields[4], fields[2], fields[3]);
  }

  /**
   * Builds the cron-utils model of a stored 5-field expression.
   *
   * @param expression fields in {@code minute hour day-of-month month day-of-week} order
   * @throws TimerSpecException if the expression is not valid UNIX cron
   */
  public static Cron toCron(String expression) throws TimerSpecException {
    if (expression == null || expression.isBlank()) {
      throw TimerSpecException.crontab(expression, "empty crontab string");
    }
    return compile(expression, expression.trim().split("\\s+"));
  }

  private static Cron compile(String value, String[] fields) throws TimerSpecException {
    if (fields.length != CRON_FIELDS) {
      throw TimerSpecException.crontab(
          value,
          "improper number of cron entries specified; got "
              + fields.length
              + " need "
              + CRON_FIELDS);
    }

    String normalized =
        String.join(
            " ",
            fields[0],
            fields[1],
            questionMarkAsAny(fields[2]),
            fields[3],
            questionMarkAsAny(fields[4]))
            .toUpperCase(Locale.ROOT);
    try {
      Cron cron = UNIX_PARSER.parse(normalized);
      cron.validate();
      return cron;
    } catch (RuntimeException e) {
      throw TimerSpecException.crontab(value, reasonFor(e));
    }
  }

  private static String questionMarkAsAny(String field) {
    return "?".equals(field) ? "*" : field;
  }

  /** Rewrites cron-utils range errors in the {@code item value V out of range} form. */
  private static String reasonFor(RuntimeException e) {
    String message = e.getMessage() == null ? "invalid expression" : e.getMessage();
    Matcher range = OUT_OF_RANGE.matcher(message);
    if (range.find()) {
      return "item value "
          + range.group(1)
          + " out of range ["
          + range.group(2)
          + ", "
          + range.group(3)
          + "]";
    }
    return "improper item specification: " + PARSE_PREFIX.matcher(message).replaceFirst("");
  }

  /**
   * Parses an interval string.
   *
   * @param value the interval string, e.g. {@code 1 minutes}
   * @return the normalized interval
   * @throws TimerSpecException if the string is not an integer followed by an accepted period
   */
  public static IntervalSpec parseInterval(String value) throws TimerSpecException {
    String[] tokens = value == null ? new String[0] : value.trim().split("\\s+");
    if (tokens.length != 2) {
      throw invalidInterval(value);
    }

    int every;
    try {
      every = Integer.parseInt(tokens[0]);
    } catch (NumberFormatException e) {
      throw invalidInterval(value);
    }

    IntervalPeriod period = IntervalPeriod.fromValue(tokens[1]);
    if (period == null) {
      throw TimerSpecException.interval(
          value,
          value
              + " is not a valid period. Accepted: "
              + IntervalPeriod.ACCEPTED
              + " e.g. 1 minutes");
    }
    return new IntervalSpec(every, period);
  }

  private static TimerSpecException invalidInterval(String value) {
    return TimerSpecException.interval(
        value,
        value
            + " is not a valid interval string: integer and period (from: "
            + IntervalPeriod.ACCEPTED
            + ") e.g. 1 minutes");
  }
}
