package com.paymentsengine.cli.io;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.paymentsengine.domain.accounts.AccountBalance;

@JsonPropertyOrder({"client", "available", "held", "total", "locked"})
record BalanceCsvRow(int client, String available, String held, String total, boolean locked) {
  static BalanceCsvRow from(AccountBalance balance) {
    return new BalanceCsvRow(
        balance.clientId().value(),
        balance.available().toPlainString(),
        balance.held().toPlainString(),
        balance.total().toPlainString(),
        balance.locked());
  }
}
