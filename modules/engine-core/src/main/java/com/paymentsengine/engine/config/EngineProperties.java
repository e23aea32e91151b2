package com.paymentsengine.engine.config;

import com.paymentsengine.domain.accounts.ClientId;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "engine")
public class EngineProperties {
  // 0 means one shard per available processor
  private int shardCount = 0;
  private int queueCapacity = 100_000;
  private long enqueuePollMs = 50L;
  private boolean sortedOutput = true;

  public int getShardCount() {
    return shardCount;
  }

  public void setShardCount(int shardCount) {
    this.shardCount = shardCount;
  }

  public int getQueueCapacity() {
    return queueCapacity;
  }

  public void setQueueCapacity(int queueCapacity) {
    this.queueCapacity = queueCapacity;
  }

  public long getEnqueuePollMs() {
    return enqueuePollMs;
  }

  public void setEnqueuePollMs(long enqueuePollMs) {
    this.enqueuePollMs = enqueuePollMs;
  }

  public boolean isSortedOutput() {
    return sortedOutput;
  }

  public void setSortedOutput(boolean sortedOutput) {
    this.sortedOutput = sortedOutput;
  }

  /** More shards than client ids would leave workers that can never receive an event. */
  public int effectiveShardCount() {
    int requested =
        shardCount > 0 ? shardCount : Runtime.getRuntime().availableProcessors();
    return Math.max(1, Math.min(requested, ClientId.MAX_VALUE + 1));
  }

  public int effectiveQueueCapacity() {
    return Math.max(1, queueCapacity);
  }

  public long effectiveEnqueuePollMs() {
    return Math.max(1L, enqueuePollMs);
  }
}
