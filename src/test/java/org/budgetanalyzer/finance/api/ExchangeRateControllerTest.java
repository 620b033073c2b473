package org.budgetanalyzer.finance.api;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import org.budgetanalyzer.finance.base.AbstractControllerTest;
import org.budgetanalyzer.finance.domain.ExchangeRate;
import org.budgetanalyzer.finance.repository.ExchangeRateRepository;

/**
 * Integration tests for {@link ExchangeRateController}.
 *
 * <ul>
 *   <li>GET /v1/exchange-rates - rates from the base currency on a date
 * </ul>
 */
class ExchangeRateControllerTest extends AbstractControllerTest {

  private static final LocalDate FRIDAY = LocalDate.of(2024, 5, 10);

  @Autowired private ExchangeRateRepository exchangeRateRepository;

  @BeforeEach
  void setUp() {
    exchangeRateRepository.saveAll(
        List.of(
            new ExchangeRate(FRIDAY, "USD", "EUR", 0.92),
            new ExchangeRate(FRIDAY, "USD", "GBP", 0.8),
            new ExchangeRate(FRIDAY.plusDays(3), "USD", "EUR", 0.93)));
  }

  // ===========================================================================================
  // A. Happy Path Tests
  // ===========================================================================================

  @Test
  void shouldReturnRequestedRates() throws Exception {
    performGet("/v1/exchange-rates?date=2024-05-10&targetCurrencies=EUR,GBP")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.date").value("2024-05-10"))
        .andExpect(jsonPath("$.baseCurrency").value("USD"))
        .andExpect(jsonPath("$.rates.EUR").value(0.92))
        .andExpect(jsonPath("$.rates.GBP").value(0.8))
        .andExpect(jsonPath("$.missingCurrencies").isEmpty());
  }

  @Test
  void shouldCarryFridayRateIntoWeekend() throws Exception {
    performGet("/v1/exchange-rates?date=2024-05-12&targetCurrencies=EUR")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.date").value("2024-05-12"))
        .andExpect(jsonPath("$.rates.EUR").value(0.92));
  }

  @Test
  void shouldNormalizeAndDeduplicateRequestedCodes() throws Exception {
    performGet("/v1/exchange-rates?date=2024-05-13&targetCurrencies=eur,EUR,usd")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.rates.EUR").value(0.93))
        .andExpect(jsonPath("$.rates.USD").value(1.0))
        .andExpect(jsonPath("$.missingCurrencies").isEmpty());
  }

  @Test
  void shouldListCurrenciesWithoutRateAsMissing() throws Exception {
    performGet("/v1/exchange-rates?date=2024-05-10&targetCurrencies=EUR,THB,XXX")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.rates.EUR").value(0.92))
        .andExpect(jsonPath("$.missingCurrencies", contains("THB", "XXX")));
  }

  @Test
  void shouldDeriveRatesForAllActiveCurrenciesWhenNoneRequested() throws Exception {
    performGet("/v1/exchange-rates?date=2024-05-10")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.rates.USD").value(1.0))
        .andExpect(jsonPath("$.rates.GBP").value(closeTo(0.8, 1e-9)));
  }

  // ===========================================================================================
  // B. Validation Tests
  // ===========================================================================================

  @Test
  void shouldReturn400ForInvalidDate() throws Exception {
    performGet("/v1/exchange-rates?date=2024-13-45")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("INVALID_REQUEST"));
  }
}
