package com.paymentsengine.domain.events;

import com.paymentsengine.domain.accounts.Amount;
import com.paymentsengine.domain.accounts.ClientId;
import com.paymentsengine.domain.accounts.TxId;
import java.util.Objects;

/** A validated event. {@code amount} is set for deposits and withdrawals only. */
public record PaymentEvent(EventType type, ClientId clientId, TxId txId, Amount amount) {
  public PaymentEvent {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(clientId, "clientId must not be null");
    Objects.requireNonNull(txId, "txId must not be null");
    if (type.requiresAmount()) {
      if (amount == null || !amount.isPositive()) {
        throw new IllegalArgumentException(type.wireName() + " amount must be > 0");
      }
    } else if (amount != null) {
      throw new IllegalArgumentException(type.wireName() + " must not carry an amount");
    }
  }

  public static PaymentEvent deposit(ClientId clientId, TxId txId, Amount amount) {
    return new PaymentEvent(EventType.DEPOSIT, clientId, txId, amount);
  }

  public static PaymentEvent withdrawal(ClientId clientId, TxId txId, Amount amount) {
    return new PaymentEvent(EventType.WITHDRAWAL, clientId, txId, amount);
  }

  public static PaymentEvent dispute(ClientId clientId, TxId txId) {
    return new PaymentEvent(EventType.DISPUTE, clientId, txId, null);
  }

  public static PaymentEvent resolve(ClientId clientId, TxId txId) {
    return new PaymentEvent(EventType.RESOLVE, clientId, txId, null);
  }

  public static PaymentEvent chargeback(ClientId clientId, TxId txId) {
    return new PaymentEvent(EventType.CHARGEBACK, clientId, txId, null);
  }
}
