package com.paymentsengine.cli.config;

import com.paymentsengine.cli.io.BalanceCsvWriter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PaymentsCliConfiguration {

  // no actuator here, nothing else contributes a registry
  @Bean
  @ConditionalOnMissingBean(MeterRegistry.class)
  public SimpleMeterRegistry paymentsMeterRegistry() {
    return new SimpleMeterRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public BalanceCsvWriter balanceCsvWriter() {
    return new BalanceCsvWriter();
  }
}
