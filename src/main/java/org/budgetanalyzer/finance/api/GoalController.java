package org.budgetanalyzer.finance.api;

import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.budgetanalyzer.finance.api.response.GoalOverviewResponse;
import org.budgetanalyzer.finance.service.GoalService;

@Tag(name = "Goals Handler", description = "Endpoints for financial goals")
@RestController
@RequestMapping(path = "/v1/users/{userId}/goals")
public class GoalController {

  private static final Logger log = LoggerFactory.getLogger(GoalController.class);

  private final GoalService goalService;

  public GoalController(GoalService goalService) {
    this.goalService = goalService;
  }

  @Operation(summary = "Get goals", description = "Get financial goals with savings progress")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = GoalOverviewResponse.class))),
        @ApiResponse(responseCode = "404", description = "User not found"),
        @ApiResponse(responseCode = "503", description = "Reference data unavailable")
      })
  @GetMapping(path = "", produces = "application/json")
  public GoalOverviewResponse getGoals(
      @Parameter(description = "User identifier") @PathVariable UUID userId) {
    log.info("Received getGoals request - userId: {}", userId);

    return GoalOverviewResponse.from(goalService.getGoals(userId));
  }
}
