package org.budgetanalyzer.finance;

import org.junit.jupiter.api.Test;

import org.budgetanalyzer.finance.base.AbstractIntegrationTest;

/**
 * Smoke test to verify the application context loads with PostgreSQL and Redis containers.
 *
 * <p>This covers bean wiring, Flyway migrations and configuration property binding.
 */
class FinanceServiceApplicationTests extends AbstractIntegrationTest {

  @Test
  void contextLoads() {
    // If this test passes, the context loaded with all infrastructure components
  }
}
