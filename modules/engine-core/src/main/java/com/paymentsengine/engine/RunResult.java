package com.paymentsengine.engine;

import com.paymentsengine.engine.snapshot.BalanceSnapshot;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one run: either the complete balance snapshot or the fatal condition that aborted
 * the run. An aborted run never exposes balances.
 */
public final class RunResult {
  private final BalanceSnapshot snapshot;
  private final RuntimeException failure;
  private final RunStatistics statistics;

  private RunResult(BalanceSnapshot snapshot, RuntimeException failure, RunStatistics statistics) {
    this.snapshot = snapshot;
    this.failure = failure;
    this.statistics = Objects.requireNonNull(statistics, "statistics must not be null");
  }

  public static RunResult completed(BalanceSnapshot snapshot, RunStatistics statistics) {
    return new RunResult(
        Objects.requireNonNull(snapshot, "snapshot must not be null"), null, statistics);
  }

  public static RunResult aborted(RuntimeException failure, RunStatistics statistics) {
    return new RunResult(
        null, Objects.requireNonNull(failure, "failure must not be null"), statistics);
  }

  public boolean isCompleted() {
    return failure == null;
  }

  public BalanceSnapshot snapshot() {
    if (!isCompleted()) {
      throw new IllegalStateException("Run was aborted, no balances available", failure);
    }
    return snapshot;
  }

  public Optional<RuntimeException> failure() {
    return Optional.ofNullable(failure);
  }

  public RunStatistics statistics() {
    return statistics;
  }
}
