package org.budgetanalyzer.finance.api.response;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.finance.service.dto.DashboardView;

/** Response DTO for a user's dashboard. */
@Schema(description = "Dashboard totals, budget quick view and breakdowns")
public record DashboardResponse(
    UUID userId,
    String fullName,
    @Schema(description = "Currency of base amounts", example = "USD") String baseCurrency,
    @Schema(description = "Currency of rendered amounts", example = "EUR") String displayCurrency,
    @Schema(description = "First day of the income and spending range") LocalDate from,
    @Schema(description = "Last day of the income and spending range") LocalDate to,
    @Schema(description = "Date of the exchange rates used for rendering") LocalDate rateDate,
    FigureResponse totalIncome,
    FigureResponse totalSpending,
    FigureResponse netSavings,
    FigureResponse totalAccountBalance,
    FigureResponse totalInvestmentValue,
    FigureResponse totalOutstandingDebt,
    FigureResponse netWorth,
    @Schema(description = "Current month budgets closest to their limits")
        List<BudgetActualResponse> budgetQuickView,
    @Schema(description = "Spending in the range by category, largest first")
        List<CategoryTotalResponse> spendingByCategory,
    @Schema(description = "Income in the range by source, largest first")
        List<CategoryTotalResponse> incomeBySource,
    @Schema(description = "Current investment value by type, largest first")
        List<CategoryTotalResponse> investmentAllocation) {

  public static DashboardResponse from(DashboardView view) {
    var summary = view.summary();
    var rendered = view.rendered();
    return new DashboardResponse(
        view.userId(),
        view.fullName(),
        view.baseCurrency(),
        view.displayCurrency(),
        view.from(),
        view.to(),
        view.rateDate(),
        FigureResponse.of(summary.totalIncome(), rendered.totalIncome()),
        FigureResponse.of(summary.totalSpending(), rendered.totalSpending()),
        FigureResponse.of(summary.netSavings(), rendered.netSavings()),
        FigureResponse.of(summary.totalAccountBalance(), rendered.totalAccountBalance()),
        FigureResponse.of(summary.totalInvestmentValue(), rendered.totalInvestmentValue()),
        FigureResponse.of(summary.totalOutstandingDebt(), rendered.totalOutstandingDebt()),
        FigureResponse.of(summary.netWorth(), rendered.netWorth()),
        view.budgetQuickView().stream().map(BudgetActualResponse::from).toList(),
        view.spendingByCategory().stream().map(CategoryTotalResponse::from).toList(),
        view.incomeBySource().stream().map(CategoryTotalResponse::from).toList(),
        view.investmentAllocation().stream().map(CategoryTotalResponse::from).toList());
  }
}
