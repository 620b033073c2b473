package org.budgetanalyzer.finance.api;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
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
import org.budgetanalyzer.finance.http.CorrelationIdFilter;
import org.budgetanalyzer.finance.repository.AccountRepository;
import org.budgetanalyzer.finance.repository.BudgetRepository;
import org.budgetanalyzer.finance.repository.DebtRepository;
import org.budgetanalyzer.finance.repository.ExchangeRateRepository;
import org.budgetanalyzer.finance.repository.ExpenseRepository;
import org.budgetanalyzer.finance.repository.IncomeRepository;
import org.budgetanalyzer.finance.repository.InvestmentRepository;
import org.budgetanalyzer.finance.repository.UserProfileRepository;

/**
 * Integration tests for {@link DashboardController}.
 *
 * <ul>
 *   <li>GET /v1/users/{userId}/dashboard - totals, net worth, budget quick view and breakdowns
 * </ul>
 *
 * <p>The clock is fixed at 2024-05-15, so the current month is May 2024. Rates are stored for
 * 2024-05-14 and carried forward.
 */
class DashboardControllerTest extends AbstractControllerTest {

  private static final String DASHBOARD_URL = "/v1/users/{userId}/dashboard";

  @Autowired private UserProfileRepository userProfileRepository;
  @Autowired private ExchangeRateRepository exchangeRateRepository;
  @Autowired private IncomeRepository incomeRepository;
  @Autowired private ExpenseRepository expenseRepository;
  @Autowired private AccountRepository accountRepository;
  @Autowired private InvestmentRepository investmentRepository;
  @Autowired private DebtRepository debtRepository;
  @Autowired private BudgetRepository budgetRepository;

  @BeforeEach
  void setUp() {
    userProfileRepository.save(RecordTestData.profile("EUR"));
    var rateDate = TestConstants.TODAY.minusDays(1);
    exchangeRateRepository.saveAll(
        List.of(
            new ExchangeRate(rateDate, "USD", "EUR", TestConstants.RATE_USD_EUR),
            new ExchangeRate(rateDate, "USD", "GBP", TestConstants.RATE_USD_GBP)));
  }

  // ===========================================================================================
  // A. Happy Path Tests
  // ===========================================================================================

  @Test
  void shouldComputeNetWorthInDisplayCurrency() throws Exception {
    // Setup
    accountRepository.saveAll(
        List.of(
            RecordTestData.account("Checking", 1000.0), RecordTestData.account("Savings", 500.0)));
    investmentRepository.save(RecordTestData.investment("Index fund", 300.0));
    debtRepository.saveAll(
        List.of(
            RecordTestData.debt("Card", 500.0, false), RecordTestData.debt("Loan", 900.0, true)));

    // Execute
    performGet(DASHBOARD_URL, TestConstants.USER_ID)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.fullName").value("Jane Doe"))
        .andExpect(jsonPath("$.baseCurrency").value("USD"))
        .andExpect(jsonPath("$.displayCurrency").value("EUR"))
        .andExpect(jsonPath("$.rateDate").value("2024-05-15"))
        .andExpect(jsonPath("$.netWorth.baseAmount").value(1300.0))
        .andExpect(jsonPath("$.netWorth.display.value").value(closeTo(1196.0, 1e-9)))
        .andExpect(jsonPath("$.netWorth.display.formatted").value("€1,196.00"))
        .andExpect(jsonPath("$.totalOutstandingDebt.baseAmount").value(500.0));
  }

  @Test
  void shouldDefaultRangeToCurrentMonth() throws Exception {
    // Setup
    incomeRepository.saveAll(
        List.of(
            RecordTestData.income(3000.0, LocalDate.of(2024, 5, 1)),
            RecordTestData.income(9999.0, LocalDate.of(2024, 4, 30))));
    expenseRepository.save(ExpenseTestBuilder.anExpense().withAmount(1000.0).build());

    // Execute
    performGet(DASHBOARD_URL, TestConstants.USER_ID)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.from").value("2024-05-01"))
        .andExpect(jsonPath("$.to").value("2024-05-31"))
        .andExpect(jsonPath("$.totalIncome.baseAmount").value(3000.0))
        .andExpect(jsonPath("$.netSavings.baseAmount").value(2000.0))
        .andExpect(jsonPath("$.netSavings.display.formatted").value("€1,840.00"));
  }

  @Test
  void shouldRespectExplicitRange() throws Exception {
    // Setup
    incomeRepository.saveAll(
        List.of(
            RecordTestData.income(3000.0, LocalDate.of(2024, 5, 1)),
            RecordTestData.income(2500.0, LocalDate.of(2024, 4, 1))));

    // Execute
    performGet(DASHBOARD_URL + "?from=2024-04-01&to=2024-05-31", TestConstants.USER_ID)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalIncome.baseAmount").value(5500.0));
  }

  @Test
  void shouldIncludeBudgetQuickView() throws Exception {
    // Setup
    budgetRepository.saveAll(
        List.of(
            BudgetTestBuilder.aBudget().withCategory("food_and_drink").withLimit(200.0).build(),
            BudgetTestBuilder.aBudget().withCategory("housing").withLimit(1000.0).build()));
    expenseRepository.saveAll(
        List.of(
            ExpenseTestBuilder.anExpense().withCategory("housing").withAmount(950.0).build(),
            ExpenseTestBuilder.anExpense()
                .withCategory("food_and_drink")
                .withAmount(50.0)
                .build()));

    // Execute
    performGet(DASHBOARD_URL, TestConstants.USER_ID)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.budgetQuickView", hasSize(2)))
        .andExpect(jsonPath("$.budgetQuickView[0].category").value("housing"))
        .andExpect(jsonPath("$.budgetQuickView[0].categoryName").value("Housing"))
        .andExpect(jsonPath("$.budgetQuickView[0].progressPercent").value(closeTo(95.0, 1e-9)))
        .andExpect(jsonPath("$.budgetQuickView[0].spent.display.formatted").value("€874.00"))
        .andExpect(jsonPath("$.budgetQuickView[1].category").value("food_and_drink"));
  }

  @Test
  void shouldIncludeBreakdowns() throws Exception {
    // Setup
    incomeRepository.saveAll(
        List.of(
            RecordTestData.income("Salary", 3000.0, LocalDate.of(2024, 5, 1)),
            RecordTestData.income("Freelance", 500.0, LocalDate.of(2024, 5, 10))));
    expenseRepository.saveAll(
        List.of(
            ExpenseTestBuilder.anExpense().withCategory("housing").withAmount(900.0).build(),
            ExpenseTestBuilder.anExpense().withCategory("pets").withAmount(100.0).build()));
    investmentRepository.save(RecordTestData.investment("Index fund", "etf", 300.0));

    // Execute
    performGet(DASHBOARD_URL, TestConstants.USER_ID)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.spendingByCategory", hasSize(2)))
        .andExpect(jsonPath("$.spendingByCategory[0].name").value("Housing"))
        .andExpect(jsonPath("$.spendingByCategory[0].total.baseAmount").value(900.0))
        .andExpect(jsonPath("$.spendingByCategory[0].total.display.formatted").value("€828.00"))
        .andExpect(jsonPath("$.incomeBySource[0].name").value("Salary"))
        .andExpect(jsonPath("$.incomeBySource[1].name").value("Freelance"))
        .andExpect(jsonPath("$.investmentAllocation[0].name").value("etf"))
        .andExpect(
            jsonPath("$.investmentAllocation[0].total.display.formatted").value("€276.00"));
  }

  @Test
  void shouldEchoCorrelationId() throws Exception {
    mockMvc
        .perform(
            get(DASHBOARD_URL, TestConstants.USER_ID)
                .header(CorrelationIdFilter.CORRELATION_ID_HEADER, "dashboard-test-1"))
        .andExpect(status().isOk())
        .andExpect(header().string(CorrelationIdFilter.CORRELATION_ID_HEADER, "dashboard-test-1"));
  }

  // ===========================================================================================
  // B. Error Tests
  // ===========================================================================================

  @Test
  void shouldReturn404ForUnknownUser() throws Exception {
    performGet(DASHBOARD_URL, TestConstants.UNKNOWN_USER_ID)
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.type").value("NOT_FOUND"))
        .andExpect(jsonPath("$.code").value("USER_NOT_FOUND"))
        .andExpect(
            jsonPath("$.message").value("User not found: " + TestConstants.UNKNOWN_USER_ID));
  }

  @Test
  void shouldReturn400ForInvertedRange() throws Exception {
    performGet(DASHBOARD_URL + "?from=2024-05-31&to=2024-05-01", TestConstants.USER_ID)
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("INVALID_REQUEST"));
  }

  @Test
  void shouldReturn400ForMalformedUserId() throws Exception {
    performGet(DASHBOARD_URL, "not-a-uuid")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("INVALID_REQUEST"));
  }
}
