package com.paymentsengine.engine;

import java.time.Duration;
import java.util.Objects;

public record RunStatistics(long eventsRead, int shardCount, int accounts, Duration elapsed) {
  public RunStatistics {
    Objects.requireNonNull(elapsed, "elapsed must not be null");
  }
}
