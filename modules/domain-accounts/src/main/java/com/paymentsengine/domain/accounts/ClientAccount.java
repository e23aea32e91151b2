package com.paymentsengine.domain.accounts;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Balances and transaction ledger of one client.
 *
 * <p>Not thread-safe: an account is owned by exactly one shard and only mutated by that shard's
 * worker. Partner errors (unknown transaction, wrong dispute state, insufficient funds, locked
 * account) leave the account untouched and are reported through {@link ApplyOutcome}; only
 * malformed input and arithmetic overflow throw.
 *
 * <p>Invariants after every call: {@code held >= 0} and {@code total == available + held}.
 * A chargeback locks the account for the rest of the run.
 */
public final class ClientAccount {
  private final ClientId clientId;
  private final Map<TxId, TransactionRecord> ledger = new HashMap<>();
  private Amount available = Amount.ZERO;
  private Amount held = Amount.ZERO;
  private boolean locked;

  public ClientAccount(ClientId clientId) {
    this.clientId = Objects.requireNonNull(clientId, "clientId must not be null");
  }

  public ApplyOutcome deposit(TxId txId, Amount amount) {
    requirePositive(amount);
    if (locked) {
      return ApplyOutcome.IGNORED_ACCOUNT_LOCKED;
    }
    rejectDuplicate(txId);

    Amount nextAvailable = available.plus(amount);
    // total is derived on read, it has to stay representable too
    nextAvailable.plus(held);
    ledger.put(txId, TransactionRecord.accepted(txId, clientId, amount, TransactionKind.DEPOSIT));
    available = nextAvailable;
    return ApplyOutcome.APPLIED;
  }

  public ApplyOutcome withdraw(TxId txId, Amount amount) {
    requirePositive(amount);
    if (locked) {
      return ApplyOutcome.IGNORED_ACCOUNT_LOCKED;
    }
    rejectDuplicate(txId);
    if (available.compareTo(amount) < 0) {
      return ApplyOutcome.IGNORED_INSUFFICIENT_FUNDS;
    }

    Amount nextAvailable = available.minus(amount);
    ledger.put(
        txId, TransactionRecord.accepted(txId, clientId, amount, TransactionKind.WITHDRAWAL));
    available = nextAvailable;
    return ApplyOutcome.APPLIED;
  }

  /**
   * Moves the disputed amount from available to held. Available may become negative when the
   * funds were already withdrawn before the dispute arrived.
   */
  public ApplyOutcome dispute(TxId txId) {
    if (locked) {
      return ApplyOutcome.IGNORED_ACCOUNT_LOCKED;
    }
    TransactionRecord record = ledger.get(txId);
    if (record == null) {
      return ApplyOutcome.IGNORED_UNKNOWN_TRANSACTION;
    }
    if (!DisputeStateMachine.canTransition(record.status(), DisputeStatus.DISPUTED)) {
      return ApplyOutcome.IGNORED_INVALID_TRANSITION;
    }

    Amount nextAvailable = available.minus(record.amount());
    Amount nextHeld = held.plus(record.amount());
    ledger.put(txId, record.transitionTo(DisputeStatus.DISPUTED));
    available = nextAvailable;
    held = nextHeld;
    return ApplyOutcome.APPLIED;
  }

  public ApplyOutcome resolve(TxId txId) {
    if (locked) {
      return ApplyOutcome.IGNORED_ACCOUNT_LOCKED;
    }
    TransactionRecord record = ledger.get(txId);
    if (record == null) {
      return ApplyOutcome.IGNORED_UNKNOWN_TRANSACTION;
    }
    if (!DisputeStateMachine.canTransition(record.status(), DisputeStatus.ACTIVE)) {
      return ApplyOutcome.IGNORED_INVALID_TRANSITION;
    }

    Amount nextHeld = held.minus(record.amount());
    Amount nextAvailable = available.plus(record.amount());
    ledger.put(txId, record.transitionTo(DisputeStatus.ACTIVE));
    held = nextHeld;
    available = nextAvailable;
    return ApplyOutcome.APPLIED;
  }

  public ApplyOutcome chargeback(TxId txId) {
    if (locked) {
      return ApplyOutcome.IGNORED_ACCOUNT_LOCKED;
    }
    TransactionRecord record = ledger.get(txId);
    if (record == null) {
      return ApplyOutcome.IGNORED_UNKNOWN_TRANSACTION;
    }
    if (!DisputeStateMachine.canTransition(record.status(), DisputeStatus.CHARGED_BACK)) {
      return ApplyOutcome.IGNORED_INVALID_TRANSITION;
    }

    Amount nextHeld = held.minus(record.amount());
    ledger.put(txId, record.transitionTo(DisputeStatus.CHARGED_BACK));
    held = nextHeld;
    locked = true;
    return ApplyOutcome.APPLIED;
  }

  public ClientId clientId() {
    return clientId;
  }

  public Amount available() {
    return available;
  }

  public Amount held() {
    return held;
  }

  public Amount total() {
    return available.plus(held);
  }

  public boolean isLocked() {
    return locked;
  }

  public Optional<TransactionRecord> transaction(TxId txId) {
    return Optional.ofNullable(ledger.get(txId));
  }

  public int transactionCount() {
    return ledger.size();
  }

  public AccountBalance balance() {
    return new AccountBalance(clientId, available, held, total(), locked);
  }

  private void rejectDuplicate(TxId txId) {
    Objects.requireNonNull(txId, "txId must not be null");
    if (ledger.containsKey(txId)) {
      throw new DuplicateTransactionException(clientId, txId);
    }
  }

  private static void requirePositive(Amount amount) {
    if (amount == null || !amount.isPositive()) {
      throw new LedgerDomainException("amount must be > 0");
    }
  }
}
