package io.campaign.dispatch;

import io.campaign.RetryAfterException;
import io.campaign.SendCollaborator;
import io.campaign.SendError;
import io.campaign.SendOutcome;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Invokes the {@link SendCollaborator} and turns every way it can fail into a classified
 * {@link SendResult}. Never throws for a failed send.
 */
final class Sender {
  private static final Logger logger = Logger.getLogger(Sender.class.getName());

  private final SendCollaborator collaborator;
  private final FailureClassifier classifier;

  Sender(SendCollaborator collaborator, FailureClassifier classifier) {
    this.collaborator = Objects.requireNonNull(collaborator, "sendCollaborator");
    this.classifier = Objects.requireNonNull(classifier, "failureClassifier");
  }

  FailureClassifier classifier() {
    return classifier;
  }

  SendResult send(String recipientId, String content) {
    SendError error;
    try {
      SendOutcome outcome = collaborator.send(recipientId, content);
      if (outcome instanceof SendOutcome.Failure failure) {
        error = failure.error();
      } else if (outcome == null) {
        error = SendError.of("SEND_EXCEPTION", "Send collaborator returned no outcome");
      } else {
        return SendResult.SUCCESS;
      }
    } catch (RetryAfterException e) {
      error = new SendError("RATE_LIMITED", e.getMessage(), 429, e.retryAfterSeconds());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      error = SendError.of("SEND_EXCEPTION", "Interrupted while sending");
    } catch (Exception e) {
      logger.log(Level.FINE, "Send to recipientId=" + recipientId + " threw", e);
      error = SendError.of("SEND_EXCEPTION", e.toString());
    }
    return new SendResult(error, classifier.classify(error));
  }
}
