package io.campaign.dispatch;

import io.campaign.SendError;
import io.campaign.model.DeliveryStatus;
import io.campaign.model.ErrorClass;

/**
 * Decides how a failed send is handled.
 *
 * @see DefaultFailureClassifier
 */
public interface FailureClassifier {

  /**
   * Classifies a send error as permanent, transient or rate-limited.
   */
  ErrorClass classify(SendError error);

  /**
   * Delivery status recorded when the error ends the delivery: {@link DeliveryStatus#BLOCKED}
   * when the recipient refuses messages, otherwise {@link DeliveryStatus#FAILED}.
   */
  DeliveryStatus terminalStatus(SendError error);
}
