package com.paymentsengine.engine.shard;

import com.paymentsengine.domain.accounts.ApplyOutcome;
import com.paymentsengine.domain.accounts.ClientAccount;
import com.paymentsengine.domain.accounts.ClientId;
import com.paymentsengine.domain.events.EventType;
import com.paymentsengine.domain.events.PaymentEvent;
import com.paymentsengine.engine.observability.EngineTelemetry;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accounts of every client with {@code clientId mod shardCount == shardId}. Only the shard's
 * own worker thread calls {@link #apply(PaymentEvent)}, so the accounts need no locking.
 */
public class AccountShard {
  private final int shardId;
  private final int shardCount;
  private final EngineTelemetry telemetry;
  // first-seen order, kept for unsorted exports
  private final Map<ClientId, ClientAccount> accounts = new LinkedHashMap<>();

  public AccountShard(int shardId, int shardCount, EngineTelemetry telemetry) {
    if (shardCount < 1 || shardId < 0 || shardId >= shardCount) {
      throw new IllegalArgumentException(
          "shardId " + shardId + " out of range for shardCount " + shardCount);
    }
    this.shardId = shardId;
    this.shardCount = shardCount;
    this.telemetry = telemetry;
  }

  public ApplyOutcome apply(PaymentEvent event) {
    ClientId clientId = event.clientId();
    if (clientId.shardIndex(shardCount) != shardId) {
      throw new IllegalStateException(
          "Client " + clientId + " routed to shard " + shardId + " of " + shardCount);
    }

    ApplyOutcome outcome;
    if (event.type().requiresAmount()) {
      ClientAccount account = accounts.computeIfAbsent(clientId, ClientAccount::new);
      outcome =
          event.type() == EventType.DEPOSIT
              ? account.deposit(event.txId(), event.amount())
              : account.withdraw(event.txId(), event.amount());
    } else {
      // a dispute step for a client we never saw is a partner error and creates no account
      ClientAccount account = accounts.get(clientId);
      outcome =
          account == null
              ? ApplyOutcome.IGNORED_UNKNOWN_TRANSACTION
              : applyDisputeStep(account, event);
    }

    telemetry.onEventApplied(shardId, event.type(), outcome);
    return outcome;
  }

  public int shardId() {
    return shardId;
  }

  public Collection<ClientAccount> accounts() {
    return Collections.unmodifiableCollection(accounts.values());
  }

  public int size() {
    return accounts.size();
  }

  private static ApplyOutcome applyDisputeStep(ClientAccount account, PaymentEvent event) {
    if (event.type() == EventType.DISPUTE) {
      return account.dispute(event.txId());
    }
    if (event.type() == EventType.RESOLVE) {
      return account.resolve(event.txId());
    }
    return account.chargeback(event.txId());
  }
}
