package dev.granary.gateway;

import org.jspecify.annotations.Nullable;

/**
 * What the gateway did with a webhook body: either answered a subscription validation handshake
 * or processed data events.
 *
 * @param validationCode code to echo back, set only for a handshake
 * @param result counters, empty for a handshake
 */
public record BatchOutcome(@Nullable String validationCode, GatewayBatchResult result) {

  public boolean isValidation() {
    return validationCode != null;
  }

  static BatchOutcome validation(String code) {
    return new BatchOutcome(code, GatewayBatchResult.empty());
  }

  static BatchOutcome processed(GatewayBatchResult result) {
    return new BatchOutcome(null, result);
  }
}
