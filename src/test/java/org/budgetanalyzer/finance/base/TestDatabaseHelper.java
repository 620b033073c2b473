package org.budgetanalyzer.finance.base;

import org.springframework.boot.test.context.TestComponent;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Database cleanup for integration tests.
 *
 * <p>Removes user records and exchange rates. Currency metadata seeded by Flyway is kept.
 */
@TestComponent
public class TestDatabaseHelper {

  private final JdbcTemplate jdbcTemplate;

  public TestDatabaseHelper(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  public void cleanupAllTables() {
    jdbcTemplate.execute("DELETE FROM financial_goals");
    jdbcTemplate.execute("DELETE FROM budgets");
    jdbcTemplate.execute("DELETE FROM debts");
    jdbcTemplate.execute("DELETE FROM investments");
    jdbcTemplate.execute("DELETE FROM accounts");
    jdbcTemplate.execute("DELETE FROM expenses");
    jdbcTemplate.execute("DELETE FROM incomes");
    jdbcTemplate.execute("DELETE FROM profiles");
    jdbcTemplate.execute("DELETE FROM exchange_rates");
  }

  public void setCurrencyActive(String code, boolean active) {
    jdbcTemplate.update("UPDATE currencies SET is_active = ? WHERE code = ?", active, code);
  }
}
