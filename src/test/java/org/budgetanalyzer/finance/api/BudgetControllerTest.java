package org.budgetanalyzer.finance.api;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import org.budgetanalyzer.finance.base.AbstractControllerTest;
import org.budgetanalyzer.finance.domain.ExchangeRate;
import org.budgetanalyzer.finance.fixture.BudgetTestBuilder;
import org.budgetanalyzer.finance.fixture.ExpenseTestBuilder;
import org.budgetanalyzer.finance.fixture.RecordTestData;
import org.budgetanalyzer.finance.fixture.TestConstants;
import org.budgetanalyzer.finance.repository.BudgetRepository;
import org.budgetanalyzer.finance.repository.ExchangeRateRepository;
import org.budgetanalyzer.finance.repository.ExpenseRepository;
import org.budgetanalyzer.finance.repository.IncomeRepository;
import org.budgetanalyzer.finance.repository.UserProfileRepository;

/**
 * Integration tests for {@link BudgetController}.
 *
 * <ul>
 *   <li>GET /v1/users/{userId}/budgets - monthly budgets with actuals
 * </ul>
 */
class BudgetControllerTest extends AbstractControllerTest {

  private static final String BUDGETS_URL = "/v1/users/{userId}/budgets";
  private static final LocalDate APRIL_START = LocalDate.of(2024, 4, 1);

  @Autowired private UserProfileRepository userProfileRepository;
  @Autowired private ExchangeRateRepository exchangeRateRepository;
  @Autowired private BudgetRepository budgetRepository;
  @Autowired private ExpenseRepository expenseRepository;
  @Autowired private IncomeRepository incomeRepository;

  @BeforeEach
  void setUp() {
    userProfileRepository.save(RecordTestData.profile("USD"));
    exchangeRateRepository.save(
        new ExchangeRate(TestConstants.TODAY, "USD", "EUR", TestConstants.RATE_USD_EUR));
  }

  // ===========================================================================================
  // A. Happy Path Tests
  // ===========================================================================================

  @Test
  void shouldReturnCurrentMonthBudgetsWithActuals() throws Exception {
    // Setup
    budgetRepository.save(
        BudgetTestBuilder.aBudget().withCategory("Food_And_Drink").withLimit(400.0).build());
    expenseRepository.saveAll(
        List.of(
            ExpenseTestBuilder.anExpense().withAmount(100.0).build(),
            ExpenseTestBuilder.anExpense().withAmount(20.0, "EUR", 21.74).build(),
            ExpenseTestBuilder.anExpense()
                .withDate(LocalDate.of(2024, 4, 30))
                .withAmount(500.0)
                .build()));
    incomeRepository.save(RecordTestData.income(2000.0, TestConstants.MAY_2024_START));

    // Execute
    performGet(BUDGETS_URL, TestConstants.USER_ID)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.periodStart").value("2024-05-01"))
        .andExpect(jsonPath("$.periodEnd").value("2024-05-31"))
        .andExpect(jsonPath("$.budgets", hasSize(1)))
        .andExpect(jsonPath("$.budgets[0].categoryName").value("Food And Drink"))
        .andExpect(jsonPath("$.budgets[0].spent.baseAmount").value(closeTo(121.74, 1e-9)))
        .andExpect(jsonPath("$.budgets[0].remaining.display.formatted").value("$278.26"))
        .andExpect(jsonPath("$.budgets[0].nativeLimit.formatted").value("$400.00"))
        .andExpect(jsonPath("$.budgets[0].malformed").value(false))
        .andExpect(jsonPath("$.budgets[0].errorCode").doesNotExist())
        .andExpect(jsonPath("$.monthIncome.baseAmount").value(2000.0))
        .andExpect(jsonPath("$.incomeConsidered.baseAmount").value(2000.0));
  }

  @Test
  void shouldReturnRequestedMonth() throws Exception {
    // Setup
    budgetRepository.saveAll(
        List.of(
            BudgetTestBuilder.aBudget().withPeriodStart(APRIL_START).withLimit(300.0).build(),
            BudgetTestBuilder.aBudget().withLimit(999.0).build()));
    expenseRepository.save(
        ExpenseTestBuilder.anExpense()
            .withDate(LocalDate.of(2024, 4, 30))
            .withAmount(150.0)
            .build());

    // Execute
    performGet(BUDGETS_URL + "?periodStart=2024-04-01", TestConstants.USER_ID)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.budgets", hasSize(1)))
        .andExpect(jsonPath("$.budgets[0].progressPercent").value(closeTo(50.0, 1e-9)))
        .andExpect(jsonPath("$.incomeConsidered.baseAmount").value(300.0))
        .andExpect(jsonPath("$.percentOfIncomeSpent").value(closeTo(50.0, 1e-9)));
  }

  @Test
  void shouldReturnEmptyListWhenNoBudgets() throws Exception {
    performGet(BUDGETS_URL, TestConstants.USER_ID)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.budgets").isEmpty())
        .andExpect(jsonPath("$.totalLimit.display.formatted").value("$0.00"));
  }

  // ===========================================================================================
  // B. Error Tests
  // ===========================================================================================

  @Test
  void shouldReturn422ForMidMonthPeriodStart() throws Exception {
    performGet(BUDGETS_URL + "?periodStart=2024-05-15", TestConstants.USER_ID)
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.type").value("APPLICATION_ERROR"))
        .andExpect(jsonPath("$.code").value("INVALID_PERIOD_START"));
  }

  @Test
  void shouldReturn404ForUnknownUser() throws Exception {
    performGet(BUDGETS_URL, TestConstants.UNKNOWN_USER_ID)
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.type").value("NOT_FOUND"))
        .andExpect(jsonPath("$.code").value("USER_NOT_FOUND"));
  }
}
