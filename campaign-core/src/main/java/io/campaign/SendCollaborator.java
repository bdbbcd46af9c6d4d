package io.campaign;

/**
 * Transport that delivers one campaign payload to one recipient.
 *
 * <p>Implementations wrap whatever channel the product uses (chat API, push, email, social
 * post). The engine only depends on this contract.
 *
 * <h2>Error Handling</h2>
 * <p>Failures are normally reported by returning {@link SendOutcome#failure}. A collaborator
 * may also throw:
 * <ul>
 *   <li>{@link RetryAfterException}: treated as a rate-limited failure carrying the exception's
 *       delay as a retry-after hint</li>
 *   <li>any other exception: treated as a transient failure (for example a broken connection)</li>
 * </ul>
 * A failure for one recipient never stops delivery to the remaining recipients of the batch.
 *
 * <h2>Idempotency</h2>
 * <p>A send may be retried after transient failures, so the same payload can reach the
 * transport more than once for one recipient.
 */
@FunctionalInterface
public interface SendCollaborator {

  /**
   * Sends the content to the recipient.
   *
   * @param recipientId the recipient to address
   * @param content     the payload to deliver
   * @return the outcome of the send (never {@code null})
   * @throws Exception if the transport fails in a way it does not report as an outcome
   */
  SendOutcome send(String recipientId, String content) throws Exception;
}
