package com.paymentsengine.engine.shard;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/** First fatal condition of a run, shared by the dispatcher and all shard workers. */
public final class FailureSignal {
  private final AtomicReference<RuntimeException> failure = new AtomicReference<>();

  /** Records {@code error} unless another failure was raised first. */
  public boolean raise(RuntimeException error) {
    return failure.compareAndSet(null, error);
  }

  public boolean isRaised() {
    return failure.get() != null;
  }

  public Optional<RuntimeException> failure() {
    return Optional.ofNullable(failure.get());
  }
}
