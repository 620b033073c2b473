package org.budgetanalyzer.finance.engine;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

import org.springframework.stereotype.Component;

import org.budgetanalyzer.finance.domain.Account;
import org.budgetanalyzer.finance.domain.Debt;
import org.budgetanalyzer.finance.domain.Expense;
import org.budgetanalyzer.finance.domain.Income;
import org.budgetanalyzer.finance.domain.Investment;
import org.budgetanalyzer.finance.domain.MonetaryRecord;

/**
 * Reduces a user's records into dashboard totals.
 *
 * <p>Sums the frozen reporting amounts; no exchange rate is consulted. A {@code null} collection
 * counts as empty. Breakdowns are sorted by amount, largest first.
 */
@Component
public class AggregateCalculator {

  static final String UNCATEGORIZED = "Uncategorized";

  private static final Comparator<CategoryTotal> LARGEST_FIRST =
      Comparator.comparingDouble(CategoryTotal::amount)
          .reversed()
          .thenComparing(CategoryTotal::name);

  public FinancialSummary summarize(
      Collection<Income> incomes,
      Collection<Expense> expenses,
      Collection<Account> accounts,
      Collection<Investment> investments,
      Collection<Debt> debts) {
    var totalIncome = sumReporting(incomes);
    var totalSpending = sumReporting(expenses);
    var totalAccountBalance = sumReporting(accounts);
    var totalInvestmentValue = sumReporting(investments);
    var totalOutstandingDebt = sumReporting(debts, debt -> !debt.isPaid());

    return new FinancialSummary(
        totalIncome,
        totalSpending,
        totalIncome - totalSpending,
        totalAccountBalance,
        totalInvestmentValue,
        totalOutstandingDebt,
        totalAccountBalance + totalInvestmentValue - totalOutstandingDebt);
  }

  /**
   * Groups spending by category title. Slugs differing only in case share a group.
   *
   * @param expenses expenses to group, may be {@code null}
   * @return totals per category
   */
  public List<CategoryTotal> spendingByCategory(Collection<Expense> expenses) {
    return groupReporting(expenses, expense -> BudgetCategory.displayName(expense.getCategory()));
  }

  /**
   * Groups income by source name.
   *
   * @param incomes income records to group, may be {@code null}
   * @return totals per source
   */
  public List<CategoryTotal> incomeBySource(Collection<Income> incomes) {
    return groupReporting(incomes, Income::getSourceName);
  }

  /**
   * Groups current investment value by investment type. Unvalued positions count as zero and types
   * without a positive total are left out.
   *
   * @param investments investments to group, may be {@code null}
   * @return totals per type
   */
  public List<CategoryTotal> investmentAllocation(Collection<Investment> investments) {
    return groupReporting(investments, Investment::getType).stream()
        .filter(total -> total.amount() > 0)
        .toList();
  }

  /**
   * Sums reporting amounts of records.
   *
   * @param records records to sum, may be {@code null}
   * @return the sum, absent amounts counting as zero
   */
  public double sumReporting(Collection<? extends MonetaryRecord> records) {
    return sumReporting(records, record -> true);
  }

  private static <T extends MonetaryRecord> double sumReporting(
      Collection<T> records, Predicate<? super T> filter) {
    if (records == null) {
      return 0.0;
    }

    var sum = 0.0;
    for (var record : records) {
      if (record != null && filter.test(record) && record.getAmount() != null) {
        sum += record.getAmount().reportingOrZero();
      }
    }
    return sum;
  }

  private static <T extends MonetaryRecord> List<CategoryTotal> groupReporting(
      Collection<T> records, Function<? super T, String> label) {
    if (records == null) {
      return List.of();
    }

    var totals = new LinkedHashMap<String, Double>();
    for (var record : records) {
      if (record == null) {
        continue;
      }
      var amount = record.getAmount() != null ? record.getAmount().reportingOrZero() : 0.0;
      totals.merge(labelOrUncategorized(label.apply(record)), amount, Double::sum);
    }

    return totals.entrySet().stream()
        .map(entry -> new CategoryTotal(entry.getKey(), entry.getValue()))
        .sorted(LARGEST_FIRST)
        .toList();
  }

  private static String labelOrUncategorized(String label) {
    return label == null || label.isBlank() ? UNCATEGORIZED : label;
  }
}
