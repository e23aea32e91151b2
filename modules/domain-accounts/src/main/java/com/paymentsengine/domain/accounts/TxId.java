package com.paymentsengine.domain.accounts;

public record TxId(long value) {
  public static final long MAX_VALUE = 0xFFFF_FFFFL;

  public TxId {
    if (value < 0L || value > MAX_VALUE) {
      throw new IllegalArgumentException("tx id must be between 0 and " + MAX_VALUE);
    }
  }

  public static TxId of(long value) {
    return new TxId(value);
  }

  @Override
  public String toString() {
    return Long.toString(value);
  }
}
