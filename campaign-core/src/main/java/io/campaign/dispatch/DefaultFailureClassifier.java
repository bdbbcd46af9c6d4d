package io.campaign.dispatch;

import io.campaign.SendError;
import io.campaign.model.DeliveryStatus;
import io.campaign.model.ErrorClass;

import java.util.Locale;
import java.util.Set;

/**
 * Classifies send errors by HTTP status, error code and message.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>HTTP 429, code {@code RATE_LIMITED}/{@code TOO_MANY_REQUESTS} or a "too many requests"
 *       message: {@link ErrorClass#RATE_LIMITED}</li>
 *   <li>Known recipient or content codes ({@code RECIPIENT_NOT_FOUND}, {@code RECIPIENT_BLOCKED},
 *       {@code CONTENT_REJECTED}, ...): {@link ErrorClass#PERMANENT}</li>
 *   <li>Network codes ({@code ETIMEDOUT}, {@code ECONNRESET}, {@code ENOTFOUND}, ...):
 *       {@link ErrorClass#TRANSIENT}</li>
 *   <li>HTTP 5xx: transient; any other HTTP 4xx: permanent</li>
 *   <li>Provider messages saying the recipient blocked the sender, was deactivated or the chat
 *       does not exist: permanent</li>
 *   <li>Anything else: transient</li>
 * </ol>
 */
public final class DefaultFailureClassifier implements FailureClassifier {
  private static final Set<String> RATE_LIMITED_CODES = Set.of("RATE_LIMITED", "TOO_MANY_REQUESTS");
  private static final Set<String> BLOCKED_CODES = Set.of("RECIPIENT_BLOCKED", "RECIPIENT_DEACTIVATED");
  private static final Set<String> PERMANENT_CODES = Set.of(
      "RECIPIENT_BLOCKED", "RECIPIENT_DEACTIVATED", "RECIPIENT_NOT_FOUND", "CHAT_NOT_FOUND",
      "CONTENT_REJECTED", "INVALID_CONTENT", "UNAUTHORIZED");
  private static final Set<String> TRANSIENT_CODES = Set.of(
      "ETIMEDOUT", "ECONNRESET", "ECONNREFUSED", "ENOTFOUND", "EAI_AGAIN", "TIMEOUT",
      "NETWORK_ERROR", "SERVICE_UNAVAILABLE", "SEND_EXCEPTION");

  @Override
  public ErrorClass classify(SendError error) {
    String code = normalizedCode(error);
    String message = normalizedMessage(error);
    Integer status = error.httpStatus();

    if ((status != null && status == 429) || RATE_LIMITED_CODES.contains(code)
        || message.contains("too many requests")) {
      return ErrorClass.RATE_LIMITED;
    }
    if (PERMANENT_CODES.contains(code)) {
      return ErrorClass.PERMANENT;
    }
    if (TRANSIENT_CODES.contains(code)) {
      return ErrorClass.TRANSIENT;
    }
    if (status != null) {
      if (status >= 500) {
        return ErrorClass.TRANSIENT;
      }
      if (status >= 400) {
        return ErrorClass.PERMANENT;
      }
    }
    if (refusedByRecipient(message) || message.contains("chat not found")) {
      return ErrorClass.PERMANENT;
    }
    return ErrorClass.TRANSIENT;
  }

  @Override
  public DeliveryStatus terminalStatus(SendError error) {
    Integer status = error.httpStatus();
    if (BLOCKED_CODES.contains(normalizedCode(error)) || (status != null && status == 403)
        || refusedByRecipient(normalizedMessage(error))) {
      return DeliveryStatus.BLOCKED;
    }
    return DeliveryStatus.FAILED;
  }

  private static boolean refusedByRecipient(String message) {
    return message.contains("blocked by the user") || message.contains("bot was blocked")
        || message.contains("user is deactivated");
  }

  private static String normalizedCode(SendError error) {
    return error.code().trim().toUpperCase(Locale.ROOT);
  }

  private static String normalizedMessage(SendError error) {
    return error.message() == null ? "" : error.message().toLowerCase(Locale.ROOT);
  }
}
