package org.budgetanalyzer.finance.service.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.budgetanalyzer.finance.engine.BudgetSummary;

/**
 * Budgets of one month with their actuals.
 *
 * @param userId user identifier
 * @param periodStart first day of the month
 * @param periodEnd last day of the month
 * @param baseCurrency currency of the raw figures
 * @param displayCurrency currency of the rendered figures
 * @param budgets budgets with actuals
 * @param summary month totals in the base currency
 * @param rendered month totals in the display currency
 */
public record BudgetOverview(
    UUID userId,
    LocalDate periodStart,
    LocalDate periodEnd,
    String baseCurrency,
    String displayCurrency,
    List<BudgetActualView> budgets,
    BudgetSummary summary,
    BudgetSummaryView rendered) {}
