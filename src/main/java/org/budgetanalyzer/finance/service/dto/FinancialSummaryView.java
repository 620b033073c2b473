package org.budgetanalyzer.finance.service.dto;

import org.budgetanalyzer.finance.engine.ConversionResult;

/** Dashboard totals rendered in the display currency. */
public record FinancialSummaryView(
    ConversionResult totalIncome,
    ConversionResult totalSpending,
    ConversionResult netSavings,
    ConversionResult totalAccountBalance,
    ConversionResult totalInvestmentValue,
    ConversionResult totalOutstandingDebt,
    ConversionResult netWorth) {}
