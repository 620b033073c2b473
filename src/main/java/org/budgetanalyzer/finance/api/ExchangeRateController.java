package org.budgetanalyzer.finance.api;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

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
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.budgetanalyzer.finance.api.response.ExchangeRatesResponse;
import org.budgetanalyzer.finance.service.ExchangeRateService;

@Tag(name = "Exchange Rates Handler", description = "Endpoints for querying exchange rates")
@RestController
@RequestMapping(path = "/v1/exchange-rates")
public class ExchangeRateController {

  private static final Logger log = LoggerFactory.getLogger(ExchangeRateController.class);

  private final ExchangeRateService exchangeRateService;

  public ExchangeRateController(ExchangeRateService exchangeRateService) {
    this.exchangeRateService = exchangeRateService;
  }

  @Operation(
      summary = "Get exchange rates",
      description =
          "Get rates from the base currency to the target currencies on a date. Currencies"
              + " without a usable rate are listed as missing instead of failing the request.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ExchangeRatesResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(
            responseCode = "503",
            description = "Exchange rate store unavailable",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class),
                    examples = {
                      @ExampleObject(
                          name = "Exchange Rates Unavailable",
                          summary = "No rate could be resolved because the store failed",
                          value =
                              """
                      {
                        "type": "SERVICE_UNAVAILABLE",
                        "message": "Exchange rates are unavailable for 2024-05-15: timeout",
                        "code": "EXCHANGE_RATES_UNAVAILABLE"
                      }
                      """)
                    }))
      })
  @GetMapping(path = "", produces = "application/json")
  public ExchangeRatesResponse getExchangeRates(
      @Parameter(description = "Rate date in ISO format, defaults to today", example = "2024-05-15")
          @RequestParam
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          Optional<LocalDate> date,
      @Parameter(
              description = "Comma separated target currencies, defaults to all active ones",
              example = "EUR,GBP")
          @RequestParam(required = false)
          List<String> targetCurrencies) {
    log.info(
        "Received getExchangeRates request - date: {}, targetCurrencies: {}",
        date.orElse(null),
        targetCurrencies);

    var requested =
        Optional.ofNullable(targetCurrencies).orElse(List.of()).stream()
            .map(String::trim)
            .filter(code -> !code.isEmpty())
            .map(code -> code.toUpperCase(Locale.ROOT))
            .distinct()
            .toList();

    var result = exchangeRateService.getRates(date.orElse(null), requested);
    var rates = result.rates();
    var missing = requested.stream().filter(code -> !rates.contains(code)).toList();

    return new ExchangeRatesResponse(
        result.date(), exchangeRateService.getBaseCurrency(), rates.asMap(), missing);
  }
}
