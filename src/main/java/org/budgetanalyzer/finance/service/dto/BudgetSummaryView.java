package org.budgetanalyzer.finance.service.dto;

import org.budgetanalyzer.finance.engine.ConversionResult;

/** Month budget totals rendered in the display currency. */
public record BudgetSummaryView(
    ConversionResult totalLimit,
    ConversionResult totalActual,
    ConversionResult monthIncome,
    ConversionResult incomeConsidered,
    ConversionResult remainingFromIncome) {}
