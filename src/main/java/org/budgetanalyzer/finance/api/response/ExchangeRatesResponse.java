package org.budgetanalyzer.finance.api.response;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import io.swagger.v3.oas.annotations.media.Schema;

/** Response DTO for a batch of exchange rates. */
@Schema(description = "Exchange rates from the base currency")
public record ExchangeRatesResponse(
    @Schema(
            description = "Rate date",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2024-05-15")
        LocalDate date,
    @Schema(
            description = "Currency the rates are quoted from",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "USD")
        String baseCurrency,
    @Schema(
            description = "Units of each currency bought by one unit of the base currency",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "{\"USD\": 1.0, \"EUR\": 0.92}")
        Map<String, Double> rates,
    @Schema(
            description = "Requested currencies without a usable rate",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "[\"XXX\"]")
        List<String> missingCurrencies) {}
