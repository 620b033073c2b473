package org.budgetanalyzer.finance.api;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

import jakarta.validation.constraints.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.budgetanalyzer.finance.api.response.ConversionResponse;
import org.budgetanalyzer.finance.service.ExchangeRateService;

@Tag(name = "Conversions Handler", description = "Endpoints for converting amounts")
@RestController
@RequestMapping(path = "/v1/conversions")
public class ConversionController {

  private static final Logger log = LoggerFactory.getLogger(ConversionController.class);

  private final ExchangeRateService exchangeRateService;
  private final Clock clock;

  public ConversionController(ExchangeRateService exchangeRateService, Clock clock) {
    this.exchangeRateService = exchangeRateService;
    this.clock = clock;
  }

  @Operation(
      summary = "Convert an amount",
      description =
          "Convert an amount through the base currency and format it for display. A missing rate"
              + " yields the fallback text rather than an error.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ConversionResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(
            responseCode = "503",
            description = "Currency metadata or exchange rates unavailable",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class)))
      })
  @GetMapping(path = "", produces = "application/json")
  public ConversionResponse convert(
      @Parameter(description = "Amount in the source currency", example = "100")
          @RequestParam
          double amount,
      @Parameter(description = "Source currency", example = "USD")
          @RequestParam
          @Pattern(regexp = "[A-Z]{3}")
          String from,
      @Parameter(description = "Target currency", example = "EUR")
          @RequestParam
          @Pattern(regexp = "[A-Z]{3}")
          String to,
      @Parameter(description = "Rate date in ISO format, defaults to today", example = "2024-05-15")
          @RequestParam
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          Optional<LocalDate> date) {
    log.info(
        "Received convert request - amount: {}, from: {}, to: {}, date: {}",
        amount,
        from,
        to,
        date.orElse(null));

    var rateDate = date.orElseGet(() -> LocalDate.now(clock));
    var result = exchangeRateService.convert(amount, from, to, rateDate);

    return ConversionResponse.from(amount, from, to, rateDate, result);
  }
}
