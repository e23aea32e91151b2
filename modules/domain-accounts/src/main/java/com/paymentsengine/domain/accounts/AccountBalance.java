package com.paymentsengine.domain.accounts;

import java.util.Objects;

public record AccountBalance(
    ClientId clientId, Amount available, Amount held, Amount total, boolean locked) {

  public AccountBalance {
    Objects.requireNonNull(clientId, "clientId must not be null");
    Objects.requireNonNull(available, "available must not be null");
    Objects.requireNonNull(held, "held must not be null");
    Objects.requireNonNull(total, "total must not be null");
    if (held.isNegative()) {
      throw new LedgerDomainException("held must be >= 0");
    }
    if (!total.equals(available.plus(held))) {
      throw new LedgerDomainException("total must equal available + held");
    }
  }
}
