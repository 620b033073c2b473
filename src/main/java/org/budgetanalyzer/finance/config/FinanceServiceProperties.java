package org.budgetanalyzer.finance.config;

import java.time.Duration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "finance-service")
@Validated
public class FinanceServiceProperties {

  @Valid private CurrencySettings currency = new CurrencySettings();
  @Valid private Dashboard dashboard = new Dashboard();
  @Valid private Cache cache = new Cache();

  public CurrencySettings getCurrency() {
    return currency;
  }

  public void setCurrency(CurrencySettings currency) {
    this.currency = currency;
  }

  public Dashboard getDashboard() {
    return dashboard;
  }

  public void setDashboard(Dashboard dashboard) {
    this.dashboard = dashboard;
  }

  public Cache getCache() {
    return cache;
  }

  public void setCache(Cache cache) {
    this.cache = cache;
  }

  public static class CurrencySettings {

    /**
     * Fixed currency in which every stored reporting amount is expressed. Changing it does not
     * restate stored amounts.
     */
    @NotBlank
    @Pattern(regexp = "[A-Z]{3}")
    private String baseReportingCurrency = "USD";

    /** Display currency for users without a preference. */
    @NotBlank
    @Pattern(regexp = "[A-Z]{3}")
    private String defaultDisplayCurrency = "USD";

    /** BCP 47 language tag used for monetary formatting. */
    @NotBlank private String displayLocale = "en-US";

    /** Text rendered when an amount cannot be converted or formatted. */
    @NotNull private String fallbackDisplay = "N/A";

    public String getBaseReportingCurrency() {
      return baseReportingCurrency;
    }

    public void setBaseReportingCurrency(String baseReportingCurrency) {
      this.baseReportingCurrency = baseReportingCurrency;
    }

    public String getDefaultDisplayCurrency() {
      return defaultDisplayCurrency;
    }

    public void setDefaultDisplayCurrency(String defaultDisplayCurrency) {
      this.defaultDisplayCurrency = defaultDisplayCurrency;
    }

    public String getDisplayLocale() {
      return displayLocale;
    }

    public void setDisplayLocale(String displayLocale) {
      this.displayLocale = displayLocale;
    }

    public String getFallbackDisplay() {
      return fallbackDisplay;
    }

    public void setFallbackDisplay(String fallbackDisplay) {
      this.fallbackDisplay = fallbackDisplay;
    }
  }

  public static class Dashboard {

    /** Number of budgets shown in the dashboard quick view. */
    @Min(1)
    @Max(20)
    private int budgetQuickViewSize = 5;

    public int getBudgetQuickViewSize() {
      return budgetQuickViewSize;
    }

    public void setBudgetQuickViewSize(int budgetQuickViewSize) {
      this.budgetQuickViewSize = budgetQuickViewSize;
    }
  }

  public static class Cache {

    /** Time to live for cached currency metadata. */
    @NotNull private Duration currenciesTtl = Duration.ofHours(1);

    public Duration getCurrenciesTtl() {
      return currenciesTtl;
    }

    public void setCurrenciesTtl(Duration currenciesTtl) {
      this.currenciesTtl = currenciesTtl;
    }
  }
}
