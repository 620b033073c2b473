package org.budgetanalyzer.finance.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.finance.service.dto.CategoryTotalView;

/** Response DTO for one entry of a dashboard breakdown. */
@Schema(description = "Breakdown entry with its total")
public record CategoryTotalResponse(
    @Schema(description = "Group label", example = "Food And Drink") String name,
    FigureResponse total) {

  public static CategoryTotalResponse from(CategoryTotalView view) {
    return new CategoryTotalResponse(
        view.total().name(), FigureResponse.of(view.total().amount(), view.rendered()));
  }
}
