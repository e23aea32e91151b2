package com.paymentsengine.domain.events;

import java.util.Optional;

public enum EventType {
  DEPOSIT("deposit", true),
  WITHDRAWAL("withdrawal", true),
  DISPUTE("dispute", false),
  RESOLVE("resolve", false),
  CHARGEBACK("chargeback", false);

  private final String wireName;
  private final boolean requiresAmount;

  EventType(String wireName, boolean requiresAmount) {
    this.wireName = wireName;
    this.requiresAmount = requiresAmount;
  }

  public String wireName() {
    return wireName;
  }

  /** Deposits and withdrawals carry an amount and allocate a new transaction id. */
  public boolean requiresAmount() {
    return requiresAmount;
  }

  public static Optional<EventType> fromWireName(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (EventType type : values()) {
      if (type.wireName.equals(value)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
