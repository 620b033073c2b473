package org.budgetanalyzer.finance.engine;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable index of currency metadata by code.
 *
 * <p>Built once per request from the currency store. Iteration order follows the order of the
 * source collection; a later entry with the same code replaces an earlier one.
 */
public final class CurrencyRegistry {

  private static final CurrencyRegistry EMPTY = new CurrencyRegistry(Map.of());

  private final Map<String, CurrencyInfo> byCode;

  private CurrencyRegistry(Map<String, CurrencyInfo> byCode) {
    this.byCode = byCode;
  }

  public static CurrencyRegistry empty() {
    return EMPTY;
  }

  public static CurrencyRegistry of(Collection<CurrencyInfo> currencies) {
    if (currencies == null || currencies.isEmpty()) {
      return EMPTY;
    }

    var map = new LinkedHashMap<String, CurrencyInfo>();
    for (var currency : currencies) {
      if (currency != null && currency.code() != null) {
        map.put(currency.code(), currency);
      }
    }

    return new CurrencyRegistry(Collections.unmodifiableMap(map));
  }

  public Optional<CurrencyInfo> find(String code) {
    if (code == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(byCode.get(code));
  }

  public boolean contains(String code) {
    return code != null && byCode.containsKey(code);
  }

  public Set<String> codes() {
    return byCode.keySet();
  }

  public Collection<CurrencyInfo> currencies() {
    return byCode.values();
  }

  public boolean isEmpty() {
    return byCode.isEmpty();
  }

  public int size() {
    return byCode.size();
  }

  @Override
  public String toString() {
    return "CurrencyRegistry{codes=" + byCode.keySet() + '}';
  }
}
