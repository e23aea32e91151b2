package com.paymentsengine.engine.snapshot;

import com.paymentsengine.domain.accounts.AccountBalance;
import com.paymentsengine.domain.accounts.ClientId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record BalanceSnapshot(List<AccountBalance> balances) {
  public BalanceSnapshot {
    Objects.requireNonNull(balances, "balances must not be null");
    balances = List.copyOf(balances);
  }

  public int size() {
    return balances.size();
  }

  public Optional<AccountBalance> find(ClientId clientId) {
    return balances.stream().filter(balance -> balance.clientId().equals(clientId)).findFirst();
  }
}
