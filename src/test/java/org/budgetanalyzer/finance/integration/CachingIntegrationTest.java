package org.budgetanalyzer.finance.integration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.CacheManager;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.test.context.TestPropertySource;

import org.budgetanalyzer.finance.base.AbstractIntegrationTest;
import org.budgetanalyzer.finance.config.CacheConfig;
import org.budgetanalyzer.finance.engine.CurrencyInfo;
import org.budgetanalyzer.finance.fixture.TestConstants;
import org.budgetanalyzer.finance.service.CurrencyService;

/**
 * Integration tests for Redis caching of currency metadata.
 *
 * <p><b>Cache Configuration:</b> This test explicitly enables Redis cache via
 * {@code @TestPropertySource}. Other tests run with caching disabled.
 *
 * @see org.budgetanalyzer.finance.config.CacheConfig
 * @see CurrencyService#getCurrencies
 */
@TestPropertySource(properties = "spring.cache.type=redis")
class CachingIntegrationTest extends AbstractIntegrationTest {

  @Autowired private CurrencyService currencyService;

  @Autowired private CacheManager cacheManager;

  @BeforeEach
  void clearCurrencyCache() {
    var cache = cacheManager.getCache(CacheConfig.CURRENCIES_CACHE);
    if (cache != null) {
      cache.clear();
    }
  }

  @Test
  void shouldUseRedisCacheManager() {
    assertThat(cacheManager).isInstanceOf(RedisCacheManager.class);
  }

  @Test
  void shouldServeCachedListAfterMetadataChanges() {
    // Given: first call populates the cache with THB active
    var first = currencyService.getCurrencies(true);
    assertThat(first).extracting(CurrencyInfo::code).contains(TestConstants.CURRENCY_THB);

    // When: THB is deactivated behind the cache
    testDatabaseHelper.setCurrencyActive(TestConstants.CURRENCY_THB, false);
    var second = currencyService.getCurrencies(true);

    // Then: the cached list still contains it, deserialized back to CurrencyInfo
    assertThat(second).extracting(CurrencyInfo::code).contains(TestConstants.CURRENCY_THB);
    assertThat(second).hasSameSizeAs(first).allSatisfy(c -> assertThat(c).isNotNull());
  }

  @Test
  void shouldReloadAfterCacheIsCleared() {
    // Given
    currencyService.getCurrencies(true);
    testDatabaseHelper.setCurrencyActive(TestConstants.CURRENCY_THB, false);

    // When
    cacheManager.getCache(CacheConfig.CURRENCIES_CACHE).clear();
    var reloaded = currencyService.getCurrencies(true);

    // Then
    assertThat(reloaded).extracting(CurrencyInfo::code).doesNotContain(TestConstants.CURRENCY_THB);
  }

  @Test
  void shouldCacheActiveAndFullListsSeparately() {
    // Given
    testDatabaseHelper.setCurrencyActive(TestConstants.CURRENCY_THB, false);

    // When
    var active = currencyService.getCurrencies(true);
    var all = currencyService.getCurrencies(false);

    // Then
    assertThat(active).extracting(CurrencyInfo::code).doesNotContain(TestConstants.CURRENCY_THB);
    assertThat(all).extracting(CurrencyInfo::code).contains(TestConstants.CURRENCY_THB);
    assertThat(cacheManager.getCache(CacheConfig.CURRENCIES_CACHE).get(true)).isNotNull();
    assertThat(cacheManager.getCache(CacheConfig.CURRENCIES_CACHE).get(false)).isNotNull();
  }
}
