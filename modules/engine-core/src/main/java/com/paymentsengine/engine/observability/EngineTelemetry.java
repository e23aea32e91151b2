package com.paymentsengine.engine.observability;

import com.paymentsengine.domain.accounts.ApplyOutcome;
import com.paymentsengine.domain.events.EventType;
import com.paymentsengine.engine.RunStatistics;

/** Called from shard worker threads as well as the dispatcher; implementations must be thread-safe. */
public interface EngineTelemetry {
  void onEventApplied(int shardId, EventType eventType, ApplyOutcome outcome);

  void onRunCompleted(RunStatistics statistics);

  void onRunAborted(RunStatistics statistics, Throwable error);
}
