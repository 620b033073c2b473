package org.budgetanalyzer.finance.service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import org.budgetanalyzer.finance.domain.Money;
import org.budgetanalyzer.finance.engine.ConversionContext;
import org.budgetanalyzer.finance.engine.ConversionResult;
import org.budgetanalyzer.finance.engine.CurrencyConverter;
import org.budgetanalyzer.finance.engine.GoalProgress;
import org.budgetanalyzer.finance.engine.GoalProgressCalculator;
import org.budgetanalyzer.finance.exception.ResourceNotFoundException;
import org.budgetanalyzer.finance.repository.FinancialGoalRepository;
import org.budgetanalyzer.finance.repository.UserProfileRepository;
import org.budgetanalyzer.finance.service.dto.GoalOverview;
import org.budgetanalyzer.finance.service.dto.GoalView;

/** Service for financial goals and their savings progress. */
@Service
public class GoalService {

  private static final Logger log = LoggerFactory.getLogger(GoalService.class);

  private final UserProfileRepository userProfileRepository;
  private final FinancialGoalRepository financialGoalRepository;
  private final CurrencyService currencyService;
  private final ConversionContextFactory conversionContextFactory;
  private final GoalProgressCalculator goalProgressCalculator;
  private final CurrencyConverter currencyConverter;
  private final ParallelReader parallelReader;
  private final Clock clock;

  public GoalService(
      UserProfileRepository userProfileRepository,
      FinancialGoalRepository financialGoalRepository,
      CurrencyService currencyService,
      ConversionContextFactory conversionContextFactory,
      GoalProgressCalculator goalProgressCalculator,
      CurrencyConverter currencyConverter,
      ParallelReader parallelReader,
      Clock clock) {
    this.userProfileRepository = userProfileRepository;
    this.financialGoalRepository = financialGoalRepository;
    this.currencyService = currencyService;
    this.conversionContextFactory = conversionContextFactory;
    this.goalProgressCalculator = goalProgressCalculator;
    this.currencyConverter = currencyConverter;
    this.parallelReader = parallelReader;
    this.clock = clock;
  }

  /**
   * Retrieves a user's goals with progress, amounts rendered in the user's display currency.
   *
   * @param userId user identifier
   * @return goals ordered by target date, then name
   * @throws ResourceNotFoundException if the user does not exist
   */
  public GoalOverview getGoals(UUID userId) {
    log.info("Retrieving goals for user: {}", userId);

    var profileRead = parallelReader.start(() -> userProfileRepository.findById(userId));
    var currenciesRead = parallelReader.start(() -> currencyService.getCurrencies(true));
    var goalsRead =
        parallelReader.start(
            () -> financialGoalRepository.findByUserIdOrderByTargetDateAscNameAsc(userId));

    var profile =
        parallelReader
            .await(profileRead, "user profile")
            .orElseThrow(
                () ->
                    new ResourceNotFoundException(
                        "User not found: " + userId, FinanceServiceError.USER_NOT_FOUND.name()));
    var currencies = parallelReader.await(currenciesRead, "currencies");
    var goals = parallelReader.await(goalsRead, "financial goals");

    var goalCurrencies =
        goals.stream().map(goal -> currencyOf(goal.getTarget())).distinct().toList();
    var context =
        conversionContextFactory.create(
            LocalDate.now(clock), profile.getPreferredCurrency(), currencies, goalCurrencies);

    var views =
        goalProgressCalculator.computeProgress(goals).stream()
            .map(progress -> render(progress, context))
            .toList();

    return new GoalOverview(userId, context.displayCurrency(), views);
  }

  private GoalView render(GoalProgress progress, ConversionContext context) {
    var currency = currencyOf(progress.target());
    return new GoalView(
        progress,
        convertNative(progress.target(), context),
        convertNative(progress.saved(), context),
        currencyConverter.convert(progress.remainingNative(), currency, context));
  }

  private ConversionResult convertNative(Money money, ConversionContext context) {
    var amount = money != null ? money.getNativeAmount() : null;
    return currencyConverter.convert(amount, currencyOf(money), context);
  }

  private static String currencyOf(Money money) {
    return money != null ? money.getNativeCurrencyCode() : null;
  }
}
