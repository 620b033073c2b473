package org.budgetanalyzer.finance.api;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.budgetanalyzer.finance.api.response.CurrencyResponse;
import org.budgetanalyzer.finance.service.CurrencyService;

@Tag(name = "Currencies Handler", description = "Endpoints for currency metadata")
@RestController
@RequestMapping(path = "/v1/currencies")
public class CurrencyController {

  private static final Logger log = LoggerFactory.getLogger(CurrencyController.class);

  private final CurrencyService currencyService;

  public CurrencyController(CurrencyService currencyService) {
    this.currencyService = currencyService;
  }

  @Operation(
      summary = "List currencies",
      description = "List currency display metadata ordered by name")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    array =
                        @ArraySchema(schema = @Schema(implementation = CurrencyResponse.class))))
      })
  @GetMapping(path = "", produces = "application/json")
  public List<CurrencyResponse> getCurrencies(
      @Parameter(description = "Return active currencies only", example = "true")
          @RequestParam(defaultValue = "true")
          boolean activeOnly) {
    log.info("Received getCurrencies request - activeOnly: {}", activeOnly);

    return currencyService.getCurrencies(activeOnly).stream().map(CurrencyResponse::from).toList();
  }
}
