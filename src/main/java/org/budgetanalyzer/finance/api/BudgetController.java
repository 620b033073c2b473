package org.budgetanalyzer.finance.api;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.budgetanalyzer.finance.api.response.BudgetOverviewResponse;
import org.budgetanalyzer.finance.service.BudgetService;

@Tag(name = "Budgets Handler", description = "Endpoints for monthly budgets")
@RestController
@RequestMapping(path = "/v1/users/{userId}/budgets")
public class BudgetController {

  private static final Logger log = LoggerFactory.getLogger(BudgetController.class);

  private final BudgetService budgetService;

  public BudgetController(BudgetService budgetService) {
    this.budgetService = budgetService;
  }

  @Operation(
      summary = "Get budgets",
      description = "Get the budgets of one month with actual spending and month totals")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = BudgetOverviewResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(responseCode = "404", description = "User not found"),
        @ApiResponse(
            responseCode = "422",
            description = "Business validation failed",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class),
                    examples = {
                      @ExampleObject(
                          name = "Invalid Period Start",
                          summary = "Period start is not the first day of a month",
                          value =
                              """
                      {
                        "type": "APPLICATION_ERROR",
                        "message": "Budget period must start on the first day of a month: 2024-05-15",
                        "code": "INVALID_PERIOD_START"
                      }
                      """)
                    })),
        @ApiResponse(responseCode = "503", description = "Reference data unavailable")
      })
  @GetMapping(path = "", produces = "application/json")
  public BudgetOverviewResponse getBudgets(
      @Parameter(description = "User identifier") @PathVariable UUID userId,
      @Parameter(
              description = "First day of the month in ISO format, defaults to the current month",
              example = "2024-05-01")
          @RequestParam
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          Optional<LocalDate> periodStart) {
    log.info(
        "Received getBudgets request - userId: {}, periodStart: {}",
        userId,
        periodStart.orElse(null));

    return BudgetOverviewResponse.from(budgetService.getBudgets(userId, periodStart.orElse(null)));
  }
}
