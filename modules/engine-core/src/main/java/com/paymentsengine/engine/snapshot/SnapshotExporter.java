package com.paymentsengine.engine.snapshot;

import com.paymentsengine.domain.accounts.AccountBalance;
import com.paymentsengine.domain.accounts.ClientAccount;
import com.paymentsengine.domain.accounts.ClientId;
import com.paymentsengine.engine.shard.AccountShard;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects final balances from finished shards. Must only see shards whose worker has stopped.
 *
 * <p>Unsorted exports go shard by shard, and within one shard in the order its clients were
 * first seen.
 */
public class SnapshotExporter {
  public BalanceSnapshot export(Collection<AccountShard> shards, boolean sorted) {
    Map<ClientId, AccountBalance> balances = new LinkedHashMap<>();
    for (AccountShard shard : shards) {
      for (ClientAccount account : shard.accounts()) {
        AccountBalance previous = balances.putIfAbsent(account.clientId(), account.balance());
        if (previous != null) {
          throw new IllegalStateException(
              "Client " + account.clientId() + " is owned by more than one shard");
        }
      }
    }

    List<AccountBalance> result = new ArrayList<>(balances.values());
    if (sorted) {
      result.sort(Comparator.comparing(AccountBalance::clientId));
    }
    return new BalanceSnapshot(result);
  }
}
