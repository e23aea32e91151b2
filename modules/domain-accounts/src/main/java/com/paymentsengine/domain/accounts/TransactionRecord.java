package com.paymentsengine.domain.accounts;

import java.util.Objects;

/**
 * Accepted deposit or withdrawal kept for the rest of the run so that it can be disputed.
 * The amount and identity never change; each dispute step produces a new record.
 */
public record TransactionRecord(
    TxId txId, ClientId clientId, Amount amount, TransactionKind kind, DisputeStatus status) {

  public TransactionRecord {
    Objects.requireNonNull(txId, "txId must not be null");
    Objects.requireNonNull(clientId, "clientId must not be null");
    Objects.requireNonNull(amount, "amount must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(status, "status must not be null");
    if (!amount.isPositive()) {
      throw new LedgerDomainException("amount must be > 0");
    }
  }

  public static TransactionRecord accepted(
      TxId txId, ClientId clientId, Amount amount, TransactionKind kind) {
    return new TransactionRecord(txId, clientId, amount, kind, DisputeStatus.ACTIVE);
  }

  public TransactionRecord transitionTo(DisputeStatus toStatus) {
    DisputeStateMachine.validateTransition(status, toStatus);
    return new TransactionRecord(txId, clientId, amount, kind, toStatus);
  }
}
