package org.budgetanalyzer.finance.service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import org.budgetanalyzer.finance.config.FinanceServiceProperties;
import org.budgetanalyzer.finance.engine.AggregateCalculator;
import org.budgetanalyzer.finance.engine.BudgetActualsCalculator;
import org.budgetanalyzer.finance.engine.ConversionContext;
import org.budgetanalyzer.finance.engine.CurrencyConverter;
import org.budgetanalyzer.finance.engine.FinancialSummary;
import org.budgetanalyzer.finance.exception.InvalidRequestException;
import org.budgetanalyzer.finance.exception.ResourceNotFoundException;
import org.budgetanalyzer.finance.repository.AccountRepository;
import org.budgetanalyzer.finance.repository.BudgetRepository;
import org.budgetanalyzer.finance.repository.DebtRepository;
import org.budgetanalyzer.finance.repository.ExpenseRepository;
import org.budgetanalyzer.finance.repository.IncomeRepository;
import org.budgetanalyzer.finance.repository.InvestmentRepository;
import org.budgetanalyzer.finance.repository.UserProfileRepository;
import org.budgetanalyzer.finance.service.dto.BudgetActualView;
import org.budgetanalyzer.finance.service.dto.CategoryTotalView;
import org.budgetanalyzer.finance.service.dto.DashboardView;
import org.budgetanalyzer.finance.service.dto.FinancialSummaryView;

/**
 * Builds a user's dashboard.
 *
 * <p>All store reads are independent and run concurrently; the dashboard is assembled only after
 * every read has completed. Income and spending totals cover the requested range, while the
 * budget quick view always covers the current month. Spending and income breakdowns follow the
 * requested range. Amounts are rendered with today's rates.
 */
@Service
public class DashboardService {

  private static final Logger log = LoggerFactory.getLogger(DashboardService.class);

  static final String BUILD_TIMER = "dashboard.build.duration";

  private final UserProfileRepository userProfileRepository;
  private final IncomeRepository incomeRepository;
  private final ExpenseRepository expenseRepository;
  private final AccountRepository accountRepository;
  private final InvestmentRepository investmentRepository;
  private final DebtRepository debtRepository;
  private final BudgetRepository budgetRepository;
  private final CurrencyService currencyService;
  private final ConversionContextFactory conversionContextFactory;
  private final AggregateCalculator aggregateCalculator;
  private final BudgetActualsCalculator budgetActualsCalculator;
  private final CurrencyConverter currencyConverter;
  private final ParallelReader parallelReader;
  private final MeterRegistry meterRegistry;
  private final FinanceServiceProperties properties;
  private final Clock clock;

  public DashboardService(
      UserProfileRepository userProfileRepository,
      IncomeRepository incomeRepository,
      ExpenseRepository expenseRepository,
      AccountRepository accountRepository,
      InvestmentRepository investmentRepository,
      DebtRepository debtRepository,
      BudgetRepository budgetRepository,
      CurrencyService currencyService,
      ConversionContextFactory conversionContextFactory,
      AggregateCalculator aggregateCalculator,
      BudgetActualsCalculator budgetActualsCalculator,
      CurrencyConverter currencyConverter,
      ParallelReader parallelReader,
      MeterRegistry meterRegistry,
      FinanceServiceProperties properties,
      Clock clock) {
    this.userProfileRepository = userProfileRepository;
    this.incomeRepository = incomeRepository;
    this.expenseRepository = expenseRepository;
    this.accountRepository = accountRepository;
    this.investmentRepository = investmentRepository;
    this.debtRepository = debtRepository;
    this.budgetRepository = budgetRepository;
    this.currencyService = currencyService;
    this.conversionContextFactory = conversionContextFactory;
    this.aggregateCalculator = aggregateCalculator;
    this.budgetActualsCalculator = budgetActualsCalculator;
    this.currencyConverter = currencyConverter;
    this.parallelReader = parallelReader;
    this.meterRegistry = meterRegistry;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Builds the dashboard of a user.
   *
   * @param userId user identifier
   * @param from first day of the range, {@code null} for the first day of the current month
   * @param to last day of the range, {@code null} for the last day of the current month
   * @return the dashboard
   * @throws InvalidRequestException if {@code from} is after {@code to}
   * @throws ResourceNotFoundException if the user does not exist
   */
  public DashboardView getDashboard(UUID userId, LocalDate from, LocalDate to) {
    var today = LocalDate.now(clock);
    var monthStart = today.withDayOfMonth(1);
    var monthEnd = today.with(TemporalAdjusters.lastDayOfMonth());

    var rangeStart = from != null ? from : monthStart;
    var rangeEnd = to != null ? to : monthEnd;
    if (rangeStart.isAfter(rangeEnd)) {
      throw new InvalidRequestException("Start date must be before or equal to end date");
    }

    return Timer.builder(BUILD_TIMER)
        .description("Time to read and aggregate a dashboard")
        .register(meterRegistry)
        .record(() -> build(userId, today, rangeStart, rangeEnd, monthStart, monthEnd));
  }

  private DashboardView build(
      UUID userId,
      LocalDate today,
      LocalDate rangeStart,
      LocalDate rangeEnd,
      LocalDate monthStart,
      LocalDate monthEnd) {
    log.info("Building dashboard for user: {}, range: {} to {}", userId, rangeStart, rangeEnd);

    var profileRead = parallelReader.start(() -> userProfileRepository.findById(userId));
    var currenciesRead = parallelReader.start(() -> currencyService.getCurrencies(true));
    var incomesRead =
        parallelReader.start(
            () ->
                incomeRepository.findByUserIdAndStartDateBetweenOrderByStartDateDesc(
                    userId, rangeStart, rangeEnd));
    var expensesRead =
        parallelReader.start(
            () ->
                expenseRepository.findByUserIdAndDateBetweenOrderByDateDesc(
                    userId, rangeStart, rangeEnd));
    var accountsRead =
        parallelReader.start(() -> accountRepository.findByUserIdOrderByNameAsc(userId));
    var investmentsRead =
        parallelReader.start(() -> investmentRepository.findByUserIdOrderByNameAsc(userId));
    var debtsRead =
        parallelReader.start(() -> debtRepository.findByUserIdOrderByDueDateAsc(userId));
    var budgetsRead =
        parallelReader.start(
            () ->
                budgetRepository.findByUserIdAndPeriodStartDateOrderByCategoryAsc(
                    userId, monthStart.toString()));
    var monthExpensesRead =
        parallelReader.start(
            () ->
                expenseRepository.findByUserIdAndDateBetweenOrderByDateDesc(
                    userId, monthStart, monthEnd));

    var profile =
        parallelReader
            .await(profileRead, "user profile")
            .orElseThrow(
                () ->
                    new ResourceNotFoundException(
                        "User not found: " + userId, FinanceServiceError.USER_NOT_FOUND.name()));
    var currencies = parallelReader.await(currenciesRead, "currencies");
    var incomes = parallelReader.await(incomesRead, "incomes");
    var expenses = parallelReader.await(expensesRead, "expenses");
    var accounts = parallelReader.await(accountsRead, "accounts");
    var investments = parallelReader.await(investmentsRead, "investments");
    var debts = parallelReader.await(debtsRead, "debts");
    var budgets = parallelReader.await(budgetsRead, "budgets");
    var monthExpenses = parallelReader.await(monthExpensesRead, "current month expenses");

    var context =
        conversionContextFactory.create(today, profile.getPreferredCurrency(), currencies);

    var summary = aggregateCalculator.summarize(incomes, expenses, accounts, investments, debts);

    var actuals = budgetActualsCalculator.computeActuals(budgets, monthExpenses);
    var quickView =
        budgetActualsCalculator
            .topByProgress(actuals, properties.getDashboard().getBudgetQuickViewSize())
            .stream()
            .map(actual -> BudgetActualView.render(actual, currencyConverter, context))
            .toList();

    log.debug(
        "Dashboard for user: {} aggregated {} incomes, {} expenses, {} budgets",
        userId,
        incomes.size(),
        expenses.size(),
        budgets.size());

    return new DashboardView(
        userId,
        profile.getFullName(),
        context.baseCurrency(),
        context.displayCurrency(),
        rangeStart,
        rangeEnd,
        today,
        summary,
        render(summary, context),
        quickView,
        CategoryTotalView.renderAll(
            aggregateCalculator.spendingByCategory(expenses), currencyConverter, context),
        CategoryTotalView.renderAll(
            aggregateCalculator.incomeBySource(incomes), currencyConverter, context),
        CategoryTotalView.renderAll(
            aggregateCalculator.investmentAllocation(investments), currencyConverter, context));
  }

  private FinancialSummaryView render(FinancialSummary summary, ConversionContext context) {
    var base = context.baseCurrency();
    return new FinancialSummaryView(
        currencyConverter.convert(summary.totalIncome(), base, context),
        currencyConverter.convert(summary.totalSpending(), base, context),
        currencyConverter.convert(summary.netSavings(), base, context),
        currencyConverter.convert(summary.totalAccountBalance(), base, context),
        currencyConverter.convert(summary.totalInvestmentValue(), base, context),
        currencyConverter.convert(summary.totalOutstandingDebt(), base, context),
        currencyConverter.convert(summary.netWorth(), base, context));
  }
}
