package org.budgetanalyzer.finance.service.dto;

import org.budgetanalyzer.finance.domain.Money;
import org.budgetanalyzer.finance.engine.BudgetActual;
import org.budgetanalyzer.finance.engine.ConversionContext;
import org.budgetanalyzer.finance.engine.ConversionResult;
import org.budgetanalyzer.finance.engine.CurrencyConverter;

/**
 * A budget actual with its figures rendered in the display currency.
 *
 * @param actual computed figures in the base reporting currency
 * @param limit rendered limit
 * @param nativeLimit limit as entered, rendered in its own currency
 * @param spent rendered actual spending
 * @param remaining rendered remaining amount
 */
public record BudgetActualView(
    BudgetActual actual,
    ConversionResult limit,
    ConversionResult nativeLimit,
    ConversionResult spent,
    ConversionResult remaining) {

  /**
   * Renders a budget actual in the context's display currency.
   *
   * @param actual computed figures
   * @param converter currency converter
   * @param context conversion context of the request
   * @return the rendered view
   */
  public static BudgetActualView render(
      BudgetActual actual, CurrencyConverter converter, ConversionContext context) {
    var base = context.baseCurrency();
    return new BudgetActualView(
        actual,
        converter.convert(actual.limitReporting(), base, context),
        renderNative(actual.limit(), converter, context),
        converter.convert(actual.actual(), base, context),
        converter.convert(actual.remaining(), base, context));
  }

  private static ConversionResult renderNative(
      Money limit, CurrencyConverter converter, ConversionContext context) {
    if (limit == null) {
      return converter.convert((Double) null, context.baseCurrency(), context);
    }
    var code = limit.getNativeCurrencyCode();
    return converter.convert(
        limit.getNativeAmount(), code, code, context.registry(), context.rates());
  }
}
