package io.fantasymcp.mcp_gateway.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void putAndRemoveMdcValuesAroundRequestLifecycle() {
    final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/mcp");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Forwarded-For", "10.0.0.1, 10.0.0.2");
    request.addHeader("X-Correlation-ID", "corr-1");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    try {
      interceptor.preHandle(request, response, new Object());
    } catch (Exception ex) {
      fail("preHandle should not throw", ex);
    }
    // ハンドラ内で認証後に設定される値
    MDC.put(RequestMdcInterceptor.USER_ID_KEY, "user-123...");

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("correlation_id")).isEqualTo("corr-1");
    assertThat(MDC.get("http_method")).isEqualTo("POST");
    assertThat(MDC.get("http_path")).isEqualTo("/mcp");
    assertThat(MDC.get("client_ip")).isEqualTo("10.0.0.1");
    assertThat(response.getHeader("X-Correlation-ID")).isEqualTo("corr-1");
    assertThat(RequestMdcInterceptor.correlationId(request)).isEqualTo("corr-1");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("correlation_id")).isNull();
    assertThat(MDC.get("user_id")).isNull();
  }

  @Test
  void unsafeCorrelationAndRequestIdsAreReplaced() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/mcp");
    request.addHeader("X-Correlation-ID", "bad id\nwith newline");
    request.addHeader("X-Request-Id", "req\r\nforged=1");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    final String correlationId = RequestMdcInterceptor.correlationId(request);
    assertThat(correlationId).isNotBlank().doesNotContain(" ");
    assertThat(response.getHeader("X-Correlation-ID")).isEqualTo(correlationId);
    assertThat(MDC.get("request_id")).isNotBlank().doesNotContain("forged");
  }
}
