package com.paymentsengine.domain.accounts;

public record ClientId(int value) implements Comparable<ClientId> {
  public static final int MAX_VALUE = 0xFFFF;

  public ClientId {
    if (value < 0 || value > MAX_VALUE) {
      throw new IllegalArgumentException("client id must be between 0 and " + MAX_VALUE);
    }
  }

  public static ClientId of(int value) {
    return new ClientId(value);
  }

  public int shardIndex(int shardCount) {
    if (shardCount < 1) {
      throw new IllegalArgumentException("shardCount must be >= 1");
    }
    return value % shardCount;
  }

  @Override
  public int compareTo(ClientId other) {
    return Integer.compare(value, other.value);
  }

  @Override
  public String toString() {
    return Integer.toString(value);
  }
}
