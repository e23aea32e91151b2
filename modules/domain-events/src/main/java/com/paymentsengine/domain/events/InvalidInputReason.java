package com.paymentsengine.domain.events;

public enum InvalidInputReason {
  INVALID_HEADER("invalid header"),
  UNKNOWN_FIELD("field outside the type, client, tx, amount schema"),
  MALFORMED_RECORD("record could not be read"),
  MISSING_TYPE("type is required"),
  UNKNOWN_TYPE("unknown transaction type"),
  MISSING_CLIENT("client is required"),
  INVALID_CLIENT_ID("client must be an integer between 0 and 65535"),
  MISSING_TX("tx is required"),
  INVALID_TX_ID("tx must be an integer between 0 and 4294967295"),
  MISSING_AMOUNT("amount required for deposit and withdrawal"),
  INVALID_AMOUNT("invalid amount"),
  ZERO_AMOUNT("amount must be greater than zero"),
  UNEXPECTED_AMOUNT("amount not allowed for dispute, resolve, or chargeback"),
  DUPLICATE_TRANSACTION("reused transaction id");

  private final String description;

  InvalidInputReason(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
