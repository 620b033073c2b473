package org.budgetanalyzer.finance.api.response;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.finance.service.dto.BudgetOverview;

/** Response DTO for the budgets of one month. */
@Schema(description = "Monthly budgets with actuals and month totals")
public record BudgetOverviewResponse(
    UUID userId,
    @Schema(example = "2024-05-01") LocalDate periodStart,
    @Schema(example = "2024-05-31") LocalDate periodEnd,
    @Schema(example = "USD") String baseCurrency,
    @Schema(example = "EUR") String displayCurrency,
    List<BudgetActualResponse> budgets,
    FigureResponse totalLimit,
    FigureResponse totalActual,
    FigureResponse monthIncome,
    @Schema(description = "Month income when positive, otherwise the total limit")
        FigureResponse incomeConsidered,
    FigureResponse remainingFromIncome,
    @Schema(description = "Total actual as a share of income considered", example = "48.2")
        double percentOfIncomeSpent) {

  public static BudgetOverviewResponse from(BudgetOverview overview) {
    var summary = overview.summary();
    var rendered = overview.rendered();
    return new BudgetOverviewResponse(
        overview.userId(),
        overview.periodStart(),
        overview.periodEnd(),
        overview.baseCurrency(),
        overview.displayCurrency(),
        overview.budgets().stream().map(BudgetActualResponse::from).toList(),
        FigureResponse.of(summary.totalLimit(), rendered.totalLimit()),
        FigureResponse.of(summary.totalActual(), rendered.totalActual()),
        FigureResponse.of(summary.monthIncome(), rendered.monthIncome()),
        FigureResponse.of(summary.incomeConsidered(), rendered.incomeConsidered()),
        FigureResponse.of(summary.remainingFromIncome(), rendered.remainingFromIncome()),
        summary.percentOfIncomeSpent());
  }
}
