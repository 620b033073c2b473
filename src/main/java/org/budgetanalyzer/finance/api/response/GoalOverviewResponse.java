package org.budgetanalyzer.finance.api.response;

import java.util.List;
import java.util.UUID;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.finance.service.dto.GoalOverview;

/** Response DTO for a user's financial goals. */
@Schema(description = "Financial goals of a user")
public record GoalOverviewResponse(
    UUID userId, @Schema(example = "EUR") String displayCurrency, List<GoalResponse> goals) {

  public static GoalOverviewResponse from(GoalOverview overview) {
    return new GoalOverviewResponse(
        overview.userId(),
        overview.displayCurrency(),
        overview.goals().stream().map(GoalResponse::from).toList());
  }
}
