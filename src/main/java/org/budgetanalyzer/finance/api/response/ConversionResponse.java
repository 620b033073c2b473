package org.budgetanalyzer.finance.api.response;

import java.time.LocalDate;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.finance.engine.ConversionOutcome;
import org.budgetanalyzer.finance.engine.ConversionResult;

/** Response DTO for a single conversion. */
@Schema(description = "Amount converted between two currencies")
public record ConversionResponse(
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, example = "100.0") double amount,
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, example = "USD") String from,
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, example = "EUR") String to,
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, example = "2024-05-15") LocalDate date,
    @Schema(description = "Converted value, absent for a fallback", example = "92.0")
        Double value,
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, example = "€92.00") String formatted,
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, example = "CONVERTED")
        ConversionOutcome outcome) {

  public static ConversionResponse from(
      double amount, String from, String to, LocalDate date, ConversionResult result) {
    return new ConversionResponse(
        amount, from, to, date, result.value(), result.formatted(), result.outcome());
  }
}
