package org.budgetanalyzer.finance.api.response;

import java.time.LocalDate;
import java.util.UUID;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.finance.service.dto.GoalView;

/** Response DTO for a financial goal. */
@Schema(description = "Financial goal with savings progress")
public record GoalResponse(
    UUID goalId,
    @Schema(example = "Emergency fund") String name,
    @Schema(example = "active") String status,
    LocalDate targetDate,
    @Schema(description = "Goal currency", example = "EUR") String currency,
    AmountResponse target,
    AmountResponse saved,
    AmountResponse remaining,
    @Schema(description = "Share of the target saved, from 0 to 100", example = "40.0")
        double progressPercent) {

  public static GoalResponse from(GoalView view) {
    var progress = view.progress();
    var currency = progress.target() != null ? progress.target().getNativeCurrencyCode() : null;
    return new GoalResponse(
        progress.goalId(),
        progress.name(),
        progress.status(),
        progress.targetDate(),
        currency,
        AmountResponse.from(view.target()),
        AmountResponse.from(view.saved()),
        AmountResponse.from(view.remaining()),
        progress.progressPercent());
  }
}
