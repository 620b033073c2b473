package org.budgetanalyzer.finance.service.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.budgetanalyzer.finance.engine.FinancialSummary;

/**
 * Everything the dashboard shows for one user.
 *
 * @param userId user identifier
 * @param fullName user's display name
 * @param baseCurrency currency of the raw figures
 * @param displayCurrency currency of the rendered figures
 * @param from first day of the income and spending range
 * @param to last day of the income and spending range
 * @param rateDate date of the rates used for rendering
 * @param summary totals in the base currency
 * @param rendered totals in the display currency
 * @param budgetQuickView current month budgets closest to their limits
 * @param spendingByCategory spending in the range grouped by category
 * @param incomeBySource income in the range grouped by source
 * @param investmentAllocation current investment value grouped by type
 */
public record DashboardView(
    UUID userId,
    String fullName,
    String baseCurrency,
    String displayCurrency,
    LocalDate from,
    LocalDate to,
    LocalDate rateDate,
    FinancialSummary summary,
    FinancialSummaryView rendered,
    List<BudgetActualView> budgetQuickView,
    List<CategoryTotalView> spendingByCategory,
    List<CategoryTotalView> incomeBySource,
    List<CategoryTotalView> investmentAllocation) {}
