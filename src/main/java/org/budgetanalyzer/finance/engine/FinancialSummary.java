package org.budgetanalyzer.finance.engine;

/**
 * Dashboard totals in the base reporting currency.
 *
 * @param totalIncome income within the selected range
 * @param totalSpending expenses within the selected range
 * @param netSavings income minus spending
 * @param totalAccountBalance balances of all accounts
 * @param totalInvestmentValue current value of all investments, unvalued positions count as zero
 * @param totalOutstandingDebt balances of unpaid debts
 * @param netWorth accounts plus investments minus outstanding debt
 */
public record FinancialSummary(
    double totalIncome,
    double totalSpending,
    double netSavings,
    double totalAccountBalance,
    double totalInvestmentValue,
    double totalOutstandingDebt,
    double netWorth) {}
