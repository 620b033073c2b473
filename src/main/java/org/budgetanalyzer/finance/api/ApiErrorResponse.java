package org.budgetanalyzer.finance.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;

/** Error body returned by every endpoint. */
@Schema(description = "Error response")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(
    @Schema(
            description = "Error category",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "APPLICATION_ERROR")
        ApiErrorType type,
    @Schema(
            description = "Human readable message",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "Budget period must start on the first day of a month: 2024-05-15")
        String message,
    @Schema(description = "Machine readable error code", example = "INVALID_PERIOD_START")
        String code) {

  public static ApiErrorResponse of(ApiErrorType type, String message) {
    return new ApiErrorResponse(type, message, null);
  }

  public static ApiErrorResponse of(ApiErrorType type, String message, String code) {
    return new ApiErrorResponse(type, message, code);
  }
}
