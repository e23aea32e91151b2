package com.paymentsengine.engine.config;

import com.paymentsengine.domain.events.EventValidator;
import com.paymentsengine.engine.EventDispatcher;
import com.paymentsengine.engine.observability.EngineTelemetry;
import com.paymentsengine.engine.observability.MicrometerEngineTelemetry;
import com.paymentsengine.engine.observability.NoOpEngineTelemetry;
import com.paymentsengine.engine.snapshot.SnapshotExporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineAutoConfiguration {
  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(EngineTelemetry.class)
  public EngineTelemetry micrometerEngineTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerEngineTelemetry(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(EngineTelemetry.class)
  public EngineTelemetry noOpEngineTelemetry() {
    return new NoOpEngineTelemetry();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventValidator eventValidator() {
    return new EventValidator();
  }

  @Bean
  @ConditionalOnMissingBean
  public SnapshotExporter snapshotExporter() {
    return new SnapshotExporter();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventDispatcher eventDispatcher(
      EngineProperties properties,
      EventValidator eventValidator,
      SnapshotExporter snapshotExporter,
      EngineTelemetry engineTelemetry) {
    return new EventDispatcher(properties, eventValidator, snapshotExporter, engineTelemetry);
  }
}
