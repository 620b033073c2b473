package org.budgetanalyzer.finance.api.response;

import java.time.LocalDate;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.finance.service.FinanceServiceError;
import org.budgetanalyzer.finance.service.dto.BudgetActualView;

/** Response DTO for a budget with its actual spending. */
@Schema(description = "Monthly budget with actual spending")
public record BudgetActualResponse(
    UUID budgetId,
    @Schema(description = "Category slug", example = "food_and_drink") String category,
    @Schema(description = "Category title", example = "Food And Drink") String categoryName,
    @Schema(description = "Period start as stored", example = "2024-05-01") String periodStartDate,
    @Schema(description = "Last day of the period, absent when the start is malformed")
        LocalDate periodEnd,
    FigureResponse limit,
    @Schema(description = "Limit as entered, in its own currency") AmountResponse nativeLimit,
    FigureResponse spent,
    FigureResponse remaining,
    @Schema(description = "Share of the limit spent, from 0 to 100", example = "62.5")
        double progressPercent,
    @Schema(description = "Whether the period start could not be parsed", example = "false")
        boolean malformed,
    @JsonInclude(JsonInclude.Include.NON_NULL)
        @Schema(description = "Error code for a malformed budget", example = "MALFORMED_RECORD")
        String errorCode) {

  public static BudgetActualResponse from(BudgetActualView view) {
    var actual = view.actual();
    return new BudgetActualResponse(
        actual.budgetId(),
        actual.category(),
        actual.categoryDisplayName(),
        actual.periodStartDate(),
        actual.periodEnd(),
        FigureResponse.of(actual.limitReporting(), view.limit()),
        AmountResponse.from(view.nativeLimit()),
        FigureResponse.of(actual.actual(), view.spent()),
        FigureResponse.of(actual.remaining(), view.remaining()),
        actual.progressPercent(),
        actual.malformed(),
        actual.malformed() ? FinanceServiceError.MALFORMED_RECORD.name() : null);
  }
}
