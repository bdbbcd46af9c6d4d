package io.campaign;

import java.util.Objects;

/**
 * Error reported by a failed send.
 *
 * @param code              provider or transport error code (e.g. {@code ETIMEDOUT}, {@code RECIPIENT_NOT_FOUND})
 * @param message           human-readable detail, may be {@code null}
 * @param httpStatus        HTTP status of the provider response, {@code null} when there was none
 * @param retryAfterSeconds provider-supplied minimum wait before retrying, {@code null} when absent
 */
public record SendError(String code, String message, Integer httpStatus, Long retryAfterSeconds) {

  public SendError {
    Objects.requireNonNull(code, "code must not be null");
    if (retryAfterSeconds != null && retryAfterSeconds < 0) {
      throw new IllegalArgumentException("retryAfterSeconds must not be negative");
    }
  }

  public static SendError of(String code, String message) {
    return new SendError(code, message, null, null);
  }

  public static SendError http(int httpStatus, String code, String message) {
    return new SendError(code, message, httpStatus, null);
  }

  public static SendError rateLimited(String message, long retryAfterSeconds) {
    return new SendError("RATE_LIMITED", message, 429, retryAfterSeconds);
  }

  /** Short description used for logs and error columns. */
  public String describe() {
    StringBuilder sb = new StringBuilder(code);
    if (httpStatus != null) {
      sb.append(" (HTTP ").append(httpStatus).append(')');
    }
    if (message != null && !message.isEmpty()) {
      sb.append(": ").append(message);
    }
    return sb.toString();
  }
}
