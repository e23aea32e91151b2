package com.paymentsengine.engine.observability;

import com.paymentsengine.domain.accounts.ApplyOutcome;
import com.paymentsengine.domain.events.EventType;
import com.paymentsengine.engine.RunStatistics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

public class MicrometerEngineTelemetry implements EngineTelemetry {
  private final MeterRegistry meterRegistry;

  public MicrometerEngineTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onEventApplied(int shardId, EventType eventType, ApplyOutcome outcome) {
    Counter.builder("engine.events.total")
        .description("Events applied to client accounts by outcome")
        .tag("event_type", eventType == null ? "unknown" : eventType.wireName())
        .tag("outcome", outcome == null ? "unknown" : outcome.metricTag())
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onRunCompleted(RunStatistics statistics) {
    Counter.builder("engine.run.total")
        .description("Engine runs by outcome")
        .tag("outcome", "completed")
        .register(meterRegistry)
        .increment();

    Timer.builder("engine.run.duration")
        .description("Wall-clock duration of an engine run")
        .tag("outcome", "completed")
        .register(meterRegistry)
        .record(statistics.elapsed());
  }

  @Override
  public void onRunAborted(RunStatistics statistics, Throwable error) {
    Counter.builder("engine.run.total")
        .description("Engine runs by outcome")
        .tag("outcome", "aborted")
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();

    Timer.builder("engine.run.duration")
        .description("Wall-clock duration of an engine run")
        .tag("outcome", "aborted")
        .register(meterRegistry)
        .record(statistics.elapsed());
  }

  private static String safeError(Throwable error) {
    if (error == null) {
      return "none";
    }
    return error.getClass().getSimpleName();
  }
}
