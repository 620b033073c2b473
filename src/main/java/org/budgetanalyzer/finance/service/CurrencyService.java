package org.budgetanalyzer.finance.service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import org.budgetanalyzer.finance.config.CacheConfig;
import org.budgetanalyzer.finance.engine.CurrencyInfo;
import org.budgetanalyzer.finance.repository.CurrencyRepository;

/**
 * Service for reading currency metadata.
 *
 * <p>Currency metadata is maintained outside this service and changes rarely, so lists are cached
 * in Redis under {@code finance-service:currencies::{activeOnly}} and expire after the configured
 * TTL.
 */
@Service
@Transactional(readOnly = true)
public class CurrencyService {

  private static final Logger log = LoggerFactory.getLogger(CurrencyService.class);

  private final CurrencyRepository currencyRepository;

  public CurrencyService(CurrencyRepository currencyRepository) {
    this.currencyRepository = currencyRepository;
  }

  /**
   * Lists currencies ordered by name.
   *
   * @param activeOnly whether to return active currencies only
   * @return currency metadata, possibly empty
   */
  @Cacheable(cacheNames = CacheConfig.CURRENCIES_CACHE, key = "#activeOnly")
  public List<CurrencyInfo> getCurrencies(boolean activeOnly) {
    var currencies =
        activeOnly
            ? currencyRepository.findByActiveTrueOrderByNameAsc()
            : currencyRepository.findAllByOrderByNameAsc();

    log.debug("Loaded {} currencies (activeOnly: {})", currencies.size(), activeOnly);

    // Mutable list: the Redis serializer records its concrete type
    return currencies.stream()
        .map(CurrencyInfo::from)
        .collect(Collectors.toCollection(ArrayList::new));
  }
}
