package com.fourkites.webhook.scheduler.dispatcher;

/**
 * Outcome of one webhook delivery, after retries.
 *
 * @param success true when the endpoint answered 2xx
 * @param attempts number of HTTP calls made
 * @param statusCode last HTTP status seen, or null when no response was received
 * @param reason short failure description, null on success
 * @param transientFailure true when the last failure was retryable but attempts ran out
 */
public record DeliveryResult(
    boolean success, int attempts, Integer statusCode, String reason, boolean transientFailure) {

  public static DeliveryResult delivered(int attempts, int statusCode) {
    return new DeliveryResult(true, attempts, statusCode, null, false);
  }

  public static DeliveryResult failed(
      int attempts, Integer statusCode, String reason, boolean transientFailure) {
    return new DeliveryResult(false, attempts, statusCode, reason, transientFailure);
  }
}
