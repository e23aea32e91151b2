package com.paymentsengine.engine.observability;

import com.paymentsengine.domain.accounts.ApplyOutcome;
import com.paymentsengine.domain.events.EventType;
import com.paymentsengine.engine.RunStatistics;

public class NoOpEngineTelemetry implements EngineTelemetry {
  @Override
  public void onEventApplied(int shardId, EventType eventType, ApplyOutcome outcome) {}

  @Override
  public void onRunCompleted(RunStatistics statistics) {}

  @Override
  public void onRunAborted(RunStatistics statistics, Throwable error) {}
}
