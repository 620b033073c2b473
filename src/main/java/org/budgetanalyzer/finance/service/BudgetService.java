package org.budgetanalyzer.finance.service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import org.budgetanalyzer.finance.engine.AggregateCalculator;
import org.budgetanalyzer.finance.engine.BudgetActualsCalculator;
import org.budgetanalyzer.finance.engine.BudgetSummary;
import org.budgetanalyzer.finance.engine.ConversionContext;
import org.budgetanalyzer.finance.engine.CurrencyConverter;
import org.budgetanalyzer.finance.exception.BusinessException;
import org.budgetanalyzer.finance.exception.ResourceNotFoundException;
import org.budgetanalyzer.finance.repository.BudgetRepository;
import org.budgetanalyzer.finance.repository.ExpenseRepository;
import org.budgetanalyzer.finance.repository.IncomeRepository;
import org.budgetanalyzer.finance.repository.UserProfileRepository;
import org.budgetanalyzer.finance.service.dto.BudgetActualView;
import org.budgetanalyzer.finance.service.dto.BudgetOverview;
import org.budgetanalyzer.finance.service.dto.BudgetSummaryView;

/** Service for monthly budgets and their actual spending. */
@Service
public class BudgetService {

  private static final Logger log = LoggerFactory.getLogger(BudgetService.class);

  private final UserProfileRepository userProfileRepository;
  private final BudgetRepository budgetRepository;
  private final ExpenseRepository expenseRepository;
  private final IncomeRepository incomeRepository;
  private final CurrencyService currencyService;
  private final ConversionContextFactory conversionContextFactory;
  private final BudgetActualsCalculator budgetActualsCalculator;
  private final AggregateCalculator aggregateCalculator;
  private final CurrencyConverter currencyConverter;
  private final ParallelReader parallelReader;
  private final Clock clock;

  public BudgetService(
      UserProfileRepository userProfileRepository,
      BudgetRepository budgetRepository,
      ExpenseRepository expenseRepository,
      IncomeRepository incomeRepository,
      CurrencyService currencyService,
      ConversionContextFactory conversionContextFactory,
      BudgetActualsCalculator budgetActualsCalculator,
      AggregateCalculator aggregateCalculator,
      CurrencyConverter currencyConverter,
      ParallelReader parallelReader,
      Clock clock) {
    this.userProfileRepository = userProfileRepository;
    this.budgetRepository = budgetRepository;
    this.expenseRepository = expenseRepository;
    this.incomeRepository = incomeRepository;
    this.currencyService = currencyService;
    this.conversionContextFactory = conversionContextFactory;
    this.budgetActualsCalculator = budgetActualsCalculator;
    this.aggregateCalculator = aggregateCalculator;
    this.currencyConverter = currencyConverter;
    this.parallelReader = parallelReader;
    this.clock = clock;
  }

  /**
   * Retrieves the budgets of one month with their actual spending.
   *
   * @param userId user identifier
   * @param periodStart first day of the month, {@code null} for the current month
   * @return budgets with actuals and month totals
   * @throws BusinessException if {@code periodStart} is not the first day of a month
   * @throws ResourceNotFoundException if the user does not exist
   */
  public BudgetOverview getBudgets(UUID userId, LocalDate periodStart) {
    var today = LocalDate.now(clock);
    var start = periodStart != null ? periodStart : today.withDayOfMonth(1);
    if (start.getDayOfMonth() != 1) {
      throw new BusinessException(
          "Budget period must start on the first day of a month: " + start,
          FinanceServiceError.INVALID_PERIOD_START.name());
    }
    var end = start.with(TemporalAdjusters.lastDayOfMonth());

    log.info("Retrieving budgets for user: {}, period: {} to {}", userId, start, end);

    var profileRead = parallelReader.start(() -> userProfileRepository.findById(userId));
    var currenciesRead = parallelReader.start(() -> currencyService.getCurrencies(true));
    var budgetsRead =
        parallelReader.start(
            () ->
                budgetRepository.findByUserIdAndPeriodStartDateOrderByCategoryAsc(
                    userId, start.toString()));
    var expensesRead =
        parallelReader.start(
            () -> expenseRepository.findByUserIdAndDateBetweenOrderByDateDesc(userId, start, end));
    var incomesRead =
        parallelReader.start(
            () ->
                incomeRepository.findByUserIdAndStartDateBetweenOrderByStartDateDesc(
                    userId, start, end));

    var profile =
        parallelReader
            .await(profileRead, "user profile")
            .orElseThrow(
                () ->
                    new ResourceNotFoundException(
                        "User not found: " + userId, FinanceServiceError.USER_NOT_FOUND.name()));
    var currencies = parallelReader.await(currenciesRead, "currencies");
    var budgets = parallelReader.await(budgetsRead, "budgets");
    var expenses = parallelReader.await(expensesRead, "expenses");
    var incomes = parallelReader.await(incomesRead, "incomes");

    var context =
        conversionContextFactory.create(today, profile.getPreferredCurrency(), currencies);

    var actuals = budgetActualsCalculator.computeActuals(budgets, expenses);
    var monthIncome = aggregateCalculator.sumReporting(incomes);
    var summary = budgetActualsCalculator.summarize(actuals, monthIncome);

    var views =
        actuals.stream()
            .map(actual -> BudgetActualView.render(actual, currencyConverter, context))
            .toList();

    return new BudgetOverview(
        userId,
        start,
        end,
        context.baseCurrency(),
        context.displayCurrency(),
        views,
        summary,
        render(summary, context));
  }

  private BudgetSummaryView render(BudgetSummary summary, ConversionContext context) {
    var base = context.baseCurrency();
    return new BudgetSummaryView(
        currencyConverter.convert(summary.totalLimit(), base, context),
        currencyConverter.convert(summary.totalActual(), base, context),
        currencyConverter.convert(summary.monthIncome(), base, context),
        currencyConverter.convert(summary.incomeConsidered(), base, context),
        currencyConverter.convert(summary.remainingFromIncome(), base, context));
  }
}
