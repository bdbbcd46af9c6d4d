package io.campaign;

import java.util.Objects;

/**
 * Result returned by {@link SendCollaborator#send(String, String)}.
 *
 * <ul>
 *   <li>{@link Success}: the transport accepted the message.</li>
 *   <li>{@link Failure}: the transport rejected it; {@link Failure#error()} carries the
 *       code, optional HTTP status and optional retry-after hint used for classification.</li>
 * </ul>
 */
public sealed interface SendOutcome permits SendOutcome.Success, SendOutcome.Failure {

  /**
   * Singleton indicating a successful send.
   */
  Success SUCCESS = new Success();

  static Success success() {
    return SUCCESS;
  }

  static Failure failure(SendError error) {
    return new Failure(error);
  }

  static Failure failure(String code, String message) {
    return new Failure(SendError.of(code, message));
  }

  default boolean isSuccess() {
    return this instanceof Success;
  }

  /**
   * Send accepted by the transport.
   */
  record Success() implements SendOutcome {
  }

  /**
   * Send rejected by the transport.
   *
   * @param error what went wrong (must not be null)
   */
  record Failure(SendError error) implements SendOutcome {
    public Failure {
      Objects.requireNonNull(error, "error must not be null");
    }
  }
}
