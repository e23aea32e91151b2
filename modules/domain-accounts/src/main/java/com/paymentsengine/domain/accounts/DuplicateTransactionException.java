package com.paymentsengine.domain.accounts;

public class DuplicateTransactionException extends LedgerDomainException {
  private final ClientId clientId;
  private final TxId txId;

  public DuplicateTransactionException(ClientId clientId, TxId txId) {
    super(String.format("Duplicate transaction %s for client %s", txId, clientId));
    this.clientId = clientId;
    this.txId = txId;
  }

  public ClientId clientId() {
    return clientId;
  }

  public TxId txId() {
    return txId;
  }
}
