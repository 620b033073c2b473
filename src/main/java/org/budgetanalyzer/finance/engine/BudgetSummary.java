package org.budgetanalyzer.finance.engine;

/**
 * Month totals over a set of budgets, in the base reporting currency.
 *
 * @param totalLimit sum of budget limits
 * @param totalActual sum of budget actuals
 * @param monthIncome income recorded in the month
 * @param incomeConsidered month income when positive, otherwise the total limit
 * @param remainingFromIncome income considered minus total actual
 * @param percentOfIncomeSpent total actual as a share of income considered, not clamped
 */
public record BudgetSummary(
    double totalLimit,
    double totalActual,
    double monthIncome,
    double incomeConsidered,
    double remainingFromIncome,
    double percentOfIncomeSpent) {}
