package org.budgetanalyzer.finance.engine;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import org.budgetanalyzer.finance.domain.Budget;
import org.budgetanalyzer.finance.domain.Expense;

/**
 * Computes monthly budget actuals from expenses.
 *
 * <p>All figures use the reporting amounts frozen on the records; no exchange rate is consulted.
 * An expense counts toward a budget when its category equals the budget category ignoring case
 * and its date falls within the budget month, both ends inclusive.
 */
@Component
public class BudgetActualsCalculator {

  private static final Logger log = LoggerFactory.getLogger(BudgetActualsCalculator.class);

  /**
   * Computes the actual spending of each budget.
   *
   * @param budgets budgets to evaluate, may be {@code null}
   * @param expenses candidate expenses, may be {@code null}
   * @return one entry per budget, in input order
   */
  public List<BudgetActual> computeActuals(
      Collection<Budget> budgets, Collection<Expense> expenses) {
    if (budgets == null || budgets.isEmpty()) {
      return List.of();
    }
    var candidates = expenses != null ? expenses : List.<Expense>of();

    var actuals = new ArrayList<BudgetActual>(budgets.size());
    for (var budget : budgets) {
      actuals.add(computeActual(budget, candidates));
    }
    return actuals;
  }

  /**
   * Summarizes budget actuals against the month's income.
   *
   * @param actuals budget actuals of one month
   * @param monthIncome income recorded in the month, reporting currency
   * @return month totals
   */
  public BudgetSummary summarize(Collection<BudgetActual> actuals, double monthIncome) {
    var totalLimit = 0.0;
    var totalActual = 0.0;
    if (actuals != null) {
      for (var actual : actuals) {
        totalLimit += actual.limitReporting();
        totalActual += actual.actual();
      }
    }

    var incomeConsidered = monthIncome > 0 ? monthIncome : totalLimit;
    var remainingFromIncome = incomeConsidered - totalActual;
    var percentOfIncomeSpent = incomeConsidered > 0 ? totalActual / incomeConsidered * 100 : 0.0;

    return new BudgetSummary(
        totalLimit,
        totalActual,
        monthIncome,
        incomeConsidered,
        remainingFromIncome,
        percentOfIncomeSpent);
  }

  /**
   * Selects the budgets closest to or over their limit.
   *
   * @param actuals budget actuals
   * @param limit maximum number of entries
   * @return up to {@code limit} entries by descending progress, ties in input order
   */
  public List<BudgetActual> topByProgress(Collection<BudgetActual> actuals, int limit) {
    if (actuals == null || limit <= 0) {
      return List.of();
    }
    return actuals.stream()
        .sorted(Comparator.comparingDouble(BudgetActual::progressPercent).reversed())
        .limit(limit)
        .toList();
  }

  private BudgetActual computeActual(Budget budget, Collection<Expense> expenses) {
    var limit = budget.getLimit();
    var limitReporting = limit != null ? limit.reportingOrZero() : 0.0;

    LocalDate start;
    try {
      start = parsePeriodStart(budget.getPeriodStartDate());
    } catch (DateTimeParseException e) {
      log.warn(
          "Invalid period start date '{}' for budget: {}, reporting no spending",
          budget.getPeriodStartDate(),
          budget.getId());
      return new BudgetActual(
          budget.getId(),
          budget.getCategory(),
          budget.getPeriodStartDate(),
          null,
          limit,
          0.0,
          limitReporting,
          0.0,
          true);
    }
    var end = start.with(TemporalAdjusters.lastDayOfMonth());

    var category = normalize(budget.getCategory());
    var actual = 0.0;
    for (var expense : expenses) {
      if (matches(expense, category, start, end)) {
        actual += expense.getAmount() != null ? expense.getAmount().reportingOrZero() : 0.0;
      }
    }

    return new BudgetActual(
        budget.getId(),
        budget.getCategory(),
        budget.getPeriodStartDate(),
        end,
        limit,
        actual,
        limitReporting - actual,
        progress(actual, limitReporting),
        false);
  }

  private static LocalDate parsePeriodStart(String periodStartDate) {
    if (periodStartDate == null) {
      throw new DateTimeParseException("Period start date is missing", "", 0);
    }
    return LocalDate.parse(periodStartDate.trim());
  }

  private static boolean matches(Expense expense, String category, LocalDate start, LocalDate end) {
    if (expense == null || expense.getDate() == null || expense.getCategory() == null) {
      return false;
    }
    if (category == null || !category.equals(normalize(expense.getCategory()))) {
      return false;
    }
    var date = expense.getDate();
    return !date.isBefore(start) && !date.isAfter(end);
  }

  static double progress(double actual, double limit) {
    double percent;
    if (limit > 0) {
      percent = actual / limit * 100;
    } else if (actual > 0) {
      percent = 100;
    } else {
      percent = 0;
    }
    return Math.min(100, Math.max(0, percent));
  }

  private static String normalize(String category) {
    return category != null ? category.toLowerCase(Locale.ROOT) : null;
  }
}
