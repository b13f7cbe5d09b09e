package com.fourkites.webhook.scheduler.timer;

/** Thrown when a crontab or interval definition string cannot be normalized into a timer. */
public final class TimerSpecException extends Exception {

  /** The rejected definition string. */
  private final String value;

  /** The bare parser reason, without the value prefix. */
  private final String reason;

  private TimerSpecException(String message, String value, String reason) {
    super(message);
    this.value = value;
    this.reason = reason;
  }

  /**
   * Creates an error for a crontab string.
   *
   * @param value the rejected crontab string
   * @param reason why the string was rejected, e.g. {@code item value 99 out of range [0, 59]}
   * @return a new exception whose message reads {@code <value> is not a valid crontab string:
   *     <reason>}
   */
  public static TimerSpecException crontab(String value, String reason) {
    return new TimerSpecException(
        value + " is not a valid crontab string: " + reason, value, reason);
  }

  /**
   * Creates an error for an interval string.
   *
   * @param value the rejected interval string
   * @param message the complete user-facing message
   * @return a new exception carrying the message as-is
   */
  public static TimerSpecException interval(String value, String message) {
    return new TimerSpecException(message, value, message);
  }

  public String value() {
    return value;
  }

  public String reason() {
    return reason;
  }
}
