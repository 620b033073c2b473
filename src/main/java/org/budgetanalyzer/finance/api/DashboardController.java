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

import org.budgetanalyzer.finance.api.response.DashboardResponse;
import org.budgetanalyzer.finance.service.DashboardService;

@Tag(name = "Dashboard Handler", description = "Endpoints for dashboard totals")
@RestController
@RequestMapping(path = "/v1/users/{userId}/dashboard")
public class DashboardController {

  private static final Logger log = LoggerFactory.getLogger(DashboardController.class);

  private final DashboardService dashboardService;

  public DashboardController(DashboardService dashboardService) {
    this.dashboardService = dashboardService;
  }

  @Operation(
      summary = "Get dashboard",
      description =
          "Get income, spending, net savings and net worth of a user in the user's display"
              + " currency, with the current month's budget quick view")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = DashboardResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(
            responseCode = "404",
            description = "User not found",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class))),
        @ApiResponse(
            responseCode = "503",
            description = "Reference data or a record store unavailable",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class),
                    examples = {
                      @ExampleObject(
                          name = "Currency Metadata Unavailable",
                          summary = "No currency metadata exists",
                          value =
                              """
                      {
                        "type": "SERVICE_UNAVAILABLE",
                        "message": "Currency metadata is unavailable",
                        "code": "CURRENCY_METADATA_UNAVAILABLE"
                      }
                      """),
                      @ExampleObject(
                          name = "Record Store Unavailable",
                          summary = "A record read failed",
                          value =
                              """
                      {
                        "type": "SERVICE_UNAVAILABLE",
                        "message": "Failed to read expenses",
                        "code": "TRANSPORT_FAILURE"
                      }
                      """)
                    }))
      })
  @GetMapping(path = "", produces = "application/json")
  public DashboardResponse getDashboard(
      @Parameter(description = "User identifier") @PathVariable UUID userId,
      @Parameter(description = "Range start in ISO format, defaults to the month start")
          @RequestParam
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          Optional<LocalDate> from,
      @Parameter(description = "Range end in ISO format, defaults to the month end")
          @RequestParam
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          Optional<LocalDate> to) {
    log.info(
        "Received getDashboard request - userId: {}, from: {}, to: {}",
        userId,
        from.orElse(null),
        to.orElse(null));

    var dashboard = dashboardService.getDashboard(userId, from.orElse(null), to.orElse(null));
    return DashboardResponse.from(dashboard);
  }
}
