package com.paymentsengine.domain.accounts;

public enum TransactionKind {
  DEPOSIT,
  WITHDRAWAL
}
