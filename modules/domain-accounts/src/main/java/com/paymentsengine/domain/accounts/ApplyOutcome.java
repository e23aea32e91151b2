package com.paymentsengine.domain.accounts;

/** Result of applying one event to an account. Everything but {@link #APPLIED} is a no-op. */
public enum ApplyOutcome {
  APPLIED("applied"),
  IGNORED_ACCOUNT_LOCKED("account_locked"),
  IGNORED_INSUFFICIENT_FUNDS("insufficient_funds"),
  IGNORED_UNKNOWN_TRANSACTION("unknown_transaction"),
  IGNORED_INVALID_TRANSITION("invalid_transition");

  private final String metricTag;

  ApplyOutcome(String metricTag) {
    this.metricTag = metricTag;
  }

  public String metricTag() {
    return metricTag;
  }

  public boolean isApplied() {
    return this == APPLIED;
  }
}
