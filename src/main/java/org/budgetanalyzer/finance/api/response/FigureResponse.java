package org.budgetanalyzer.finance.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.finance.engine.ConversionResult;

/** An aggregate figure in both the base reporting currency and the display currency. */
@Schema(description = "Figure in the base currency with its display rendering")
public record FigureResponse(
    @Schema(
            description = "Value in the base reporting currency",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "1300.0")
        double baseAmount,
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED) AmountResponse display) {

  public static FigureResponse of(double baseAmount, ConversionResult display) {
    return new FigureResponse(baseAmount, AmountResponse.from(display));
  }
}
