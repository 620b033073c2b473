package org.budgetanalyzer.finance.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.finance.engine.CurrencyInfo;

/** Response DTO for currency metadata. */
@Schema(description = "Currency display metadata")
public record CurrencyResponse(
    @Schema(
            description = "ISO 4217 three-letter currency code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "EUR")
        String code,
    @Schema(
            description = "Display name",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "Euro")
        String name,
    @Schema(description = "Display symbol", example = "€") String symbol,
    @Schema(
            description = "Number of fraction digits rendered",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2")
        int decimalDigits,
    @Schema(
            description = "Whether the currency can be used for new records",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "true")
        boolean active) {

  /**
   * Create a response DTO from currency metadata.
   *
   * @param info the currency metadata
   * @return CurrencyResponse
   */
  public static CurrencyResponse from(CurrencyInfo info) {
    return new CurrencyResponse(
        info.code(), info.name(), info.symbol(), info.decimalDigits(), info.active());
  }
}
