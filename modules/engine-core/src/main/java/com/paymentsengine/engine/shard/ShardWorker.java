package com.paymentsengine.engine.shard;

import com.paymentsengine.domain.accounts.ClientId;
import com.paymentsengine.domain.accounts.TxId;
import com.paymentsengine.domain.events.PaymentEvent;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * Drains one shard's queue in arrival order on a dedicated thread. Stops at the end-of-stream
 * marker, or as soon as any participant of the run has raised a failure.
 */
public class ShardWorker implements Callable<AccountShard> {
  // compared by identity, never applied
  private static final PaymentEvent END_OF_STREAM = PaymentEvent.dispute(ClientId.of(0), TxId.of(0));

  private final AccountShard shard;
  private final BlockingQueue<PaymentEvent> queue;
  private final FailureSignal failureSignal;
  private final long pollIntervalMs;

  public ShardWorker(
      AccountShard shard, int queueCapacity, FailureSignal failureSignal, long pollIntervalMs) {
    this.shard = shard;
    this.queue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
    this.failureSignal = failureSignal;
    this.pollIntervalMs = Math.max(1L, pollIntervalMs);
  }

  /**
   * Hands an event to this worker, waiting while the queue is full. Returns {@code false}
   * without enqueuing once the run has failed.
   */
  public boolean submit(PaymentEvent event) throws InterruptedException {
    while (!failureSignal.isRaised()) {
      if (queue.offer(event, pollIntervalMs, TimeUnit.MILLISECONDS)) {
        return true;
      }
    }
    return false;
  }

  public boolean finish() throws InterruptedException {
    return submit(END_OF_STREAM);
  }

  @Override
  public AccountShard call() throws InterruptedException {
    while (!failureSignal.isRaised()) {
      PaymentEvent event = queue.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
      if (event == null) {
        continue;
      }
      if (event == END_OF_STREAM) {
        return shard;
      }
      try {
        shard.apply(event);
      } catch (RuntimeException ex) {
        failureSignal.raise(ex);
        throw ex;
      } catch (Error error) {
        failureSignal.raise(
            new IllegalStateException("Shard " + shard.shardId() + " worker failed", error));
        throw error;
      }
    }
    return shard;
  }
}
