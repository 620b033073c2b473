package org.budgetanalyzer.finance.engine;

import java.time.LocalDate;
import java.util.UUID;

import org.budgetanalyzer.finance.domain.Money;

/**
 * Spending of one monthly budget against its limit, in the base reporting currency.
 *
 * @param budgetId budget identifier
 * @param category budget category slug
 * @param periodStartDate period start as stored
 * @param periodEnd last day of the budget month, {@code null} when the start is malformed
 * @param limit stored limit, native and reporting
 * @param actual sum of matching expenses
 * @param remaining limit minus actual, negative when overspent
 * @param progressPercent share of the limit spent, within [0, 100]
 * @param malformed whether the period start could not be parsed
 */
public record BudgetActual(
    UUID budgetId,
    String category,
    String periodStartDate,
    LocalDate periodEnd,
    Money limit,
    double actual,
    double remaining,
    double progressPercent,
    boolean malformed) {

  public double limitReporting() {
    return limit != null ? limit.reportingOrZero() : 0.0;
  }

  public String categoryDisplayName() {
    return BudgetCategory.displayName(category);
  }
}
