package io.campaign.dispatch;

import io.campaign.SendError;
import io.campaign.model.ErrorClass;

/**
 * Outcome of one send as seen by the engine.
 *
 * @param error      {@code null} on success
 * @param errorClass {@code null} on success
 */
record SendResult(SendError error, ErrorClass errorClass) {
  static final SendResult SUCCESS = new SendResult(null, null);

  boolean isSuccess() {
    return error == null;
  }
}
