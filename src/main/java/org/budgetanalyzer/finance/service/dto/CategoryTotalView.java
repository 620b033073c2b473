package org.budgetanalyzer.finance.service.dto;

import java.util.List;

import org.budgetanalyzer.finance.engine.CategoryTotal;
import org.budgetanalyzer.finance.engine.ConversionContext;
import org.budgetanalyzer.finance.engine.ConversionResult;
import org.budgetanalyzer.finance.engine.CurrencyConverter;

/**
 * A breakdown entry with its total rendered in the display currency.
 *
 * @param total group total in the base reporting currency
 * @param rendered rendered total
 */
public record CategoryTotalView(CategoryTotal total, ConversionResult rendered) {

  /**
   * Renders breakdown entries in the context's display currency, keeping their order.
   *
   * @param totals group totals
   * @param converter currency converter
   * @param context conversion context of the request
   * @return the rendered entries
   */
  public static List<CategoryTotalView> renderAll(
      List<CategoryTotal> totals, CurrencyConverter converter, ConversionContext context) {
    return totals.stream()
        .map(
            total ->
                new CategoryTotalView(
                    total, converter.convert(total.amount(), context.baseCurrency(), context)))
        .toList();
  }
}
