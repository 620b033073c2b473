package org.budgetanalyzer.finance.engine;

/**
 * Sum of reporting amounts for one group of records.
 *
 * @param name group label, {@code Uncategorized} for records without one
 * @param amount total in the base reporting currency
 */
public record CategoryTotal(String name, double amount) {}
