package org.budgetanalyzer.finance.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Sparse map of exchange rates from the base reporting currency, keyed by target code.
 *
 * <p>A rate {@code r} for code {@code X} means one unit of the base currency buys {@code r} units
 * of {@code X}. Missing codes are reported as an empty {@link OptionalDouble}, never as zero.
 */
public final class RateMap {

  private static final RateMap EMPTY = new RateMap(Map.of());

  private final Map<String, Double> rates;

  private RateMap(Map<String, Double> rates) {
    this.rates = rates;
  }

  public static RateMap empty() {
    return EMPTY;
  }

  public static RateMap of(Map<String, Double> rates) {
    if (rates == null || rates.isEmpty()) {
      return EMPTY;
    }
    return new RateMap(Collections.unmodifiableMap(new LinkedHashMap<>(rates)));
  }

  public OptionalDouble get(String code) {
    if (code == null) {
      return OptionalDouble.empty();
    }

    var rate = rates.get(code);
    return rate != null ? OptionalDouble.of(rate) : OptionalDouble.empty();
  }

  public boolean contains(String code) {
    return code != null && rates.containsKey(code);
  }

  public Map<String, Double> asMap() {
    return rates;
  }

  public boolean isEmpty() {
    return rates.isEmpty();
  }

  public int size() {
    return rates.size();
  }

  @Override
  public String toString() {
    return "RateMap" + rates;
  }
}
