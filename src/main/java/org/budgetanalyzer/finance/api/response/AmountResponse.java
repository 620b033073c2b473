package org.budgetanalyzer.finance.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.finance.engine.ConversionOutcome;
import org.budgetanalyzer.finance.engine.ConversionResult;

/** An amount rendered in the display currency. */
@Schema(description = "Amount in the display currency")
public record AmountResponse(
    @Schema(description = "Converted value, absent when it could not be computed", example = "92.5")
        Double value,
    @Schema(
            description = "Text to display",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "€92.50")
        String formatted,
    @Schema(
            description = "How the text was produced",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "CONVERTED")
        ConversionOutcome outcome) {

  public static AmountResponse from(ConversionResult result) {
    return new AmountResponse(result.value(), result.formatted(), result.outcome());
  }
}
