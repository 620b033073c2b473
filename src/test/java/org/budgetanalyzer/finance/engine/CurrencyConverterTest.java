package org.budgetanalyzer.finance.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.budgetanalyzer.finance.config.FinanceServiceProperties;
import org.budgetanalyzer.finance.fixture.TestConstants;

@DisplayName("CurrencyConverter")
class CurrencyConverterTest {

  private SimpleMeterRegistry meterRegistry;
  private CurrencyConverter converter;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    converter = new CurrencyConverter(TestConstants.defaultProperties(), meterRegistry);
  }

  // ===========================================================================================
  // Conversion
  // ===========================================================================================

  @Test
  @DisplayName("Should return amount unchanged when source equals target")
  void convert_sameCurrency_returnsAmount() {
    // Act
    var result = converter.convert(42.5, "EUR", "EUR", TestConstants.registry(), RateMap.empty());

    // Assert
    assertThat(result.outcome()).isEqualTo(ConversionOutcome.CONVERTED);
    assertThat(result.value()).isEqualTo(42.5);
    assertThat(result.formatted()).isEqualTo("€42.50");
  }

  @Test
  @DisplayName("Should multiply by target rate when converting from base")
  void convert_fromBase_multipliesByTargetRate() {
    // Act
    var result =
        converter.convert(100.0, "USD", "EUR", TestConstants.registry(), TestConstants.rates());

    // Assert
    assertThat(result.value()).isCloseTo(92.0, within(1e-9));
    assertThat(result.formatted()).isEqualTo("€92.00");
  }

  @Test
  @DisplayName("Should divide by source rate when converting into base")
  void convert_toBase_dividesBySourceRate() {
    // Act
    var result =
        converter.convert(80.0, "GBP", "USD", TestConstants.registry(), TestConstants.rates());

    // Assert
    assertThat(result.value()).isCloseTo(100.0, within(1e-9));
    assertThat(result.formatted()).isEqualTo("$100.00");
  }

  @Test
  @DisplayName("Should cross convert through base when neither side is base")
  void convert_crossRate_goesThroughBase() {
    // Act
    var result =
        converter.convert(92.0, "EUR", "GBP", TestConstants.registry(), TestConstants.rates());

    // Assert
    assertThat(result.value()).isCloseTo(80.0, within(1e-9));
  }

  @Test
  @DisplayName("Should return original amount after converting there and back")
  void convert_roundTrip_returnsOriginal() {
    // Arrange
    var registry = TestConstants.registry();
    var rates = TestConstants.rates();

    // Act
    var there = converter.convert(1234.56, "EUR", "JPY", registry, rates);
    var back = converter.convert(there.value(), "JPY", "EUR", registry, rates);

    // Assert
    assertThat(back.value()).isCloseTo(1234.56, within(1e-6));
  }

  @Test
  @DisplayName("Should round to zero decimals for JPY")
  void convert_jpy_usesZeroDecimals() {
    // Act
    var result =
        converter.convert(10.0, "USD", "JPY", TestConstants.registry(), TestConstants.rates());

    // Assert
    assertThat(result.value()).isCloseTo(1500.0, within(1e-9));
    assertThat(result.formatted()).isEqualTo("¥1,500");
  }

  @Test
  @DisplayName("Should round half up at the currency precision")
  void convert_halfway_roundsUp() {
    // Act
    var formatted =
        converter.format(0.125, "USD", "USD", TestConstants.registry(), RateMap.empty());

    // Assert
    assertThat(formatted).isEqualTo("$0.13");
  }

  @Test
  @DisplayName("Should use context display and base currencies")
  void convert_context_usesDisplayCurrency() {
    // Arrange
    var context =
        new ConversionContext(TestConstants.registry(), TestConstants.rates(), "USD", "GBP");

    // Act
    var result = converter.convert(50.0, "USD", context);

    // Assert
    assertThat(result.isConverted()).isTrue();
    assertThat(result.value()).isCloseTo(40.0, within(1e-9));
    assertThat(converter.format(50.0, "USD", context)).isEqualTo("£40.00");
  }

  // ===========================================================================================
  // Fallbacks
  // ===========================================================================================

  @Test
  @DisplayName("Should render fallback text when amount is null")
  void convert_nullAmount_returnsFallback() {
    // Act
    var result =
        converter.convert(null, "USD", "EUR", TestConstants.registry(), TestConstants.rates());

    // Assert
    assertThat(result.outcome()).isEqualTo(ConversionOutcome.FALLBACK);
    assertThat(result.value()).isNull();
    assertThat(result.formatted()).isEqualTo("N/A");
    assertThat(degradedCount("missing_amount")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should render fallback text when amount is NaN")
  void convert_nanAmount_returnsFallback() {
    // Act
    var result =
        converter.convert(
            Double.NaN, "USD", "EUR", TestConstants.registry(), TestConstants.rates());

    // Assert
    assertThat(result.outcome()).isEqualTo(ConversionOutcome.FALLBACK);
  }

  @Test
  @DisplayName("Should render raw amount with marker when target metadata is missing")
  void convert_unknownTarget_returnsDegradedText() {
    // Act
    var result =
        converter.convert(
            12.5,
            "USD",
            TestConstants.CURRENCY_UNKNOWN,
            TestConstants.registry(),
            TestConstants.rates());

    // Assert
    assertThat(result.outcome()).isEqualTo(ConversionOutcome.DEGRADED);
    assertThat(result.value()).isEqualTo(12.5);
    assertThat(result.formatted()).isEqualTo("12.50 XXX (Info?)");
    assertThat(degradedCount("missing_target_metadata")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should return fallback when source rate is missing")
  void convert_missingSourceRate_returnsFallback() {
    // Arrange
    var rates = RateMap.of(Map.of("USD", 1.0, "EUR", 0.92));

    // Act
    var result = converter.convert(100.0, "GBP", "EUR", TestConstants.registry(), rates);

    // Assert
    assertThat(result.outcome()).isEqualTo(ConversionOutcome.FALLBACK);
    assertThat(degradedCount("missing_source_rate")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should return fallback when source rate is zero")
  void convert_zeroSourceRate_returnsFallback() {
    // Arrange
    var rates = RateMap.of(Map.of("USD", 1.0, "EUR", 0.0));

    // Act
    var result = converter.convert(100.0, "EUR", "USD", TestConstants.registry(), rates);

    // Assert
    assertThat(result.outcome()).isEqualTo(ConversionOutcome.FALLBACK);
    assertThat(degradedCount("missing_source_rate")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should return fallback when target rate is missing")
  void convert_missingTargetRate_returnsFallback() {
    // Act
    var result = converter.convert(100.0, "USD", "GBP", TestConstants.registry(), RateMap.empty());

    // Assert
    assertThat(result.outcome()).isEqualTo(ConversionOutcome.FALLBACK);
    assertThat(degradedCount("missing_target_rate")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should use configured fallback text")
  void convert_customFallback_rendersConfiguredText() {
    // Arrange
    var properties = new FinanceServiceProperties();
    properties.getCurrency().setFallbackDisplay("--");
    var customConverter = new CurrencyConverter(properties, meterRegistry);

    // Act
    var formatted =
        customConverter.format(null, "USD", "USD", TestConstants.registry(), RateMap.empty());

    // Assert
    assertThat(formatted).isEqualTo("--");
  }

  @Test
  @DisplayName("Should fall back to plain formatting for codes unknown to the JDK")
  void convert_nonIsoCurrency_usesPlainFormatting() {
    // Arrange
    var registry = CurrencyRegistry.of(List.of(TestConstants.INFO_USD, TestConstants.INFO_PSEUDO));

    // Act
    var result = converter.convert(2.25, "ZZZ", "ZZZ", registry, RateMap.empty());

    // Assert
    assertThat(result.outcome()).isEqualTo(ConversionOutcome.CONVERTED);
    assertThat(result.formatted()).isEqualTo("2.3 pts");
    assertThat(degradedCount("format_error")).isEqualTo(1.0);
  }

  private double degradedCount(String reason) {
    var counter =
        meterRegistry.find(CurrencyConverter.DEGRADED_METRIC).tag("reason", reason).counter();
    return counter != null ? counter.count() : 0.0;
  }
}
