package com.paymentsengine.engine;

import com.paymentsengine.domain.accounts.TxId;
import com.paymentsengine.domain.events.EventValidator;
import com.paymentsengine.domain.events.InvalidInputException;
import com.paymentsengine.domain.events.InvalidInputReason;
import com.paymentsengine.domain.events.PaymentEvent;
import com.paymentsengine.domain.events.RawPaymentRecord;
import com.paymentsengine.engine.config.EngineProperties;
import com.paymentsengine.engine.observability.EngineTelemetry;
import com.paymentsengine.engine.shard.AccountShard;
import com.paymentsengine.engine.shard.FailureSignal;
import com.paymentsengine.engine.shard.ShardWorker;
import com.paymentsengine.engine.snapshot.BalanceSnapshot;
import com.paymentsengine.engine.snapshot.SnapshotExporter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one batch: validates each record on the calling thread, routes it to the worker owning
 * its client and, once the input is exhausted, exports the balances of all shards.
 *
 * <p>Events of one client always go to the same queue in input order, so per-client order is
 * preserved while different shards progress independently. The first fatal condition (reader,
 * validator, duplicate transaction id, or any shard) stops the dispatcher and every worker and
 * the run yields no balances.
 */
public class EventDispatcher {
  private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

  private final EngineProperties properties;
  private final EventValidator validator;
  private final SnapshotExporter exporter;
  private final EngineTelemetry telemetry;

  public EventDispatcher(
      EngineProperties properties,
      EventValidator validator,
      SnapshotExporter exporter,
      EngineTelemetry telemetry) {
    this.properties = properties;
    this.validator = validator;
    this.exporter = exporter;
    this.telemetry = telemetry;
  }

  public RunResult run(Iterator<RawPaymentRecord> records) {
    long started = System.nanoTime();
    int shardCount = properties.effectiveShardCount();
    FailureSignal failureSignal = new FailureSignal();
    List<ShardWorker> workers = new ArrayList<>(shardCount);
    for (int shardId = 0; shardId < shardCount; shardId++) {
      workers.add(
          new ShardWorker(
              new AccountShard(shardId, shardCount, telemetry),
              properties.effectiveQueueCapacity(),
              failureSignal,
              properties.effectiveEnqueuePollMs()));
    }

    ExecutorService executor = Executors.newFixedThreadPool(shardCount, new ShardThreadFactory());
    long eventsRead = 0L;
    BalanceSnapshot snapshot = null;
    try {
      List<Future<AccountShard>> futures = new ArrayList<>(shardCount);
      for (ShardWorker worker : workers) {
        futures.add(executor.submit(worker));
      }

      Set<TxId> allocatedTxIds = new HashSet<>();
      while (!failureSignal.isRaised() && records.hasNext()) {
        RawPaymentRecord record = records.next();
        eventsRead++;
        PaymentEvent event = validator.validate(record);
        if (event.type().requiresAmount() && !allocatedTxIds.add(event.txId())) {
          throw new InvalidInputException(
              InvalidInputReason.DUPLICATE_TRANSACTION,
              record.lineNumber(),
              "tx " + event.txId());
        }
        workers.get(event.clientId().shardIndex(shardCount)).submit(event);
      }

      if (!failureSignal.isRaised()) {
        for (ShardWorker worker : workers) {
          worker.finish();
        }
        List<AccountShard> finishedShards = awaitShards(futures, failureSignal);
        if (!failureSignal.isRaised()) {
          snapshot = exporter.export(finishedShards, properties.isSortedOutput());
        }
      }
    } catch (RuntimeException ex) {
      failureSignal.raise(ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      failureSignal.raise(new IllegalStateException("Run interrupted", ex));
    } finally {
      executor.shutdownNow();
    }

    Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
    if (failureSignal.isRaised()) {
      RuntimeException failure = failureSignal.failure().orElseThrow();
      RunStatistics statistics = new RunStatistics(eventsRead, shardCount, 0, elapsed);
      log.info(
          "Run aborted events_read={} shards={} error={}",
          eventsRead,
          shardCount,
          failure.getMessage());
      telemetry.onRunAborted(statistics, failure);
      return RunResult.aborted(failure, statistics);
    }

    RunStatistics statistics = new RunStatistics(eventsRead, shardCount, snapshot.size(), elapsed);
    log.info(
        "Run completed events_read={} shards={} accounts={} elapsed_ms={}",
        eventsRead,
        shardCount,
        snapshot.size(),
        elapsed.toMillis());
    telemetry.onRunCompleted(statistics);
    return RunResult.completed(snapshot, statistics);
  }

  private static List<AccountShard> awaitShards(
      List<Future<AccountShard>> futures, FailureSignal failureSignal)
      throws InterruptedException {
    List<AccountShard> shards = new ArrayList<>(futures.size());
    for (Future<AccountShard> future : futures) {
      try {
        shards.add(future.get());
      } catch (ExecutionException ex) {
        Throwable cause = ex.getCause();
        failureSignal.raise(
            cause instanceof RuntimeException
                ? (RuntimeException) cause
                : new IllegalStateException("Shard worker failed", cause));
      }
    }
    return shards;
  }

  private static final class ShardThreadFactory implements ThreadFactory {
    private final AtomicInteger sequence = new AtomicInteger();

    @Override
    public Thread newThread(Runnable runnable) {
      Thread thread = new Thread(runnable, "shard-worker-" + sequence.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    }
  }
}
