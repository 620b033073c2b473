package org.budgetanalyzer.finance.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Main configuration class for the Finance Service.
 *
 * <p>Note: ObjectMapper is auto-configured by Spring Boot using spring.jackson.* properties in
 * application.yml.
 */
@Configuration
@EnableConfigurationProperties(FinanceServiceProperties.class)
public class FinanceServiceConfig {

  /**
   * Clock used to determine the current month for dashboards and budgets.
   *
   * @return UTC system clock
   */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
