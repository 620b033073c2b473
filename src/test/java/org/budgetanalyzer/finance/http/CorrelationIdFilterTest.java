package org.budgetanalyzer.finance.http;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

  private final CorrelationIdFilter filter = new CorrelationIdFilter();

  @Test
  @DisplayName("Should reuse a valid incoming correlation id")
  void doFilter_validHeader_reusesId() throws Exception {
    // Arrange
    var request = new MockHttpServletRequest("GET", "/v1/currencies");
    request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "req-42.a_b");
    var response = new MockHttpServletResponse();
    var seenInChain = new AtomicReference<String>();

    // Act
    filter.doFilter(
        request,
        response,
        (req, res) -> seenInChain.set(MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY)));

    // Assert
    assertThat(seenInChain.get()).isEqualTo("req-42.a_b");
    assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER))
        .isEqualTo("req-42.a_b");
    assertThat(MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY)).isNull();
  }

  @Test
  @DisplayName("Should generate an id when the header is malformed")
  void doFilter_malformedHeader_generatesId() throws Exception {
    // Arrange
    var request = new MockHttpServletRequest("GET", "/v1/currencies");
    request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "bad id\r\ninjected");
    var response = new MockHttpServletResponse();

    // Act
    filter.doFilter(request, response, (req, res) -> {});

    // Assert
    assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER))
        .isNotEqualTo("bad id\r\ninjected")
        .matches("[0-9a-f-]{36}");
  }

  @Test
  @DisplayName("Should generate an id when the header is missing")
  void doFilter_noHeader_generatesId() throws Exception {
    // Arrange
    var response = new MockHttpServletResponse();

    // Act
    filter.doFilter(new MockHttpServletRequest(), response, (req, res) -> {});

    // Assert
    assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).isNotBlank();
  }
}
