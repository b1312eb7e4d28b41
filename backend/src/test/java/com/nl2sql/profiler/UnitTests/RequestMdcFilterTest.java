package com.nl2sql.profiler;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

@DisplayName("RequestMdcFilter Tests")
class RequestMdcFilterTest {

  private final RequestMdcFilter filter = new RequestMdcFilter();

  private static MockFilterChain capturing(
      AtomicReference<String> username, AtomicReference<String> correlationId) {
    return new MockFilterChain(
        new HttpServlet() {
          @Override
          protected void service(HttpServletRequest req, HttpServletResponse resp) {
            username.set(MDC.get(RequestMdcFilter.USERNAME_MDC_KEY));
            correlationId.set(MDC.get(RequestMdcFilter.CORRELATION_ID_MDC_KEY));
          }
        });
  }

  @Test
  @DisplayName("Should tag the request with caller and correlation id")
  void shouldPutHeadersIntoMdc() throws Exception {
    AtomicReference<String> username = new AtomicReference<>();
    AtomicReference<String> correlationId = new AtomicReference<>();
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/datasets");
    request.addHeader(RequestMdcFilter.USERNAME_HEADER, "analyst");
    request.addHeader(RequestMdcFilter.CORRELATION_ID_HEADER, "abc-123");
    MockHttpServletResponse response = new MockHttpServletResponse();

    filter.doFilter(request, response, capturing(username, correlationId));

    assertThat(username.get()).isEqualTo("analyst");
    assertThat(correlationId.get()).isEqualTo("abc-123");
    assertThat(response.getHeader(RequestMdcFilter.CORRELATION_ID_HEADER)).isEqualTo("abc-123");
  }

  @Test
  @DisplayName("Should fall back to anonymous and a generated correlation id")
  void shouldGenerateDefaults() throws Exception {
    AtomicReference<String> username = new AtomicReference<>();
    AtomicReference<String> correlationId = new AtomicReference<>();
    MockHttpServletResponse response = new MockHttpServletResponse();

    filter.doFilter(
        new MockHttpServletRequest("GET", "/api/datasets"),
        response,
        capturing(username, correlationId));

    assertThat(username.get()).isEqualTo(RequestMdcFilter.DEFAULT_USERNAME);
    assertThat(correlationId.get()).isNotBlank();
    assertThat(response.getHeader(RequestMdcFilter.CORRELATION_ID_HEADER))
        .isEqualTo(correlationId.get());
  }

  @Test
  @DisplayName("Should clear the MDC after the request")
  void shouldClearMdc() throws Exception {
    filter.doFilter(
        new MockHttpServletRequest("GET", "/api/datasets"),
        new MockHttpServletResponse(),
        new MockFilterChain());

    assertThat(MDC.get(RequestMdcFilter.USERNAME_MDC_KEY)).isNull();
    assertThat(MDC.get(RequestMdcFilter.CORRELATION_ID_MDC_KEY)).isNull();
  }
}
