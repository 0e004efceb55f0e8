package io.fantasymcp.mcp_gateway.config;

import io.fantasymcp.common.CorrelationIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  /** ハンドラ内で認証後に設定される呼び出し元 ID。完了時に必ず除去する。 */
  public static final String USER_ID_KEY = "user_id";

  public static final String CORRELATION_ID_ATTRIBUTE =
      RequestMdcInterceptor.class.getName() + ".CORRELATION_ID";

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    final String correlationId =
        CorrelationIds.resolve(request.getHeader(CorrelationIds.HEADER_NAME));
    request.setAttribute(CORRELATION_ID_ATTRIBUTE, correlationId);
    response.setHeader(CorrelationIds.HEADER_NAME, correlationId);
    put(keys, "request_id", resolveRequestId(request));
    put(keys, "correlation_id", correlationId);
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    put(keys, "client_ip", resolveClientIp(request));
    keys.add(USER_ID_KEY);
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    final Object attribute = request.getAttribute(ATTRIBUTE_KEYS);
    if (!(attribute instanceof List<?> rawKeys)) {
      return;
    }
    for (Object rawKey : rawKeys) {
      if (rawKey instanceof String key) {
        MDC.remove(key);
      }
    }
  }

  /** preHandle 済みなら採番済みの値、そうでなければヘッダから解決する。 */
  public static String correlationId(HttpServletRequest request) {
    final Object attribute = request.getAttribute(CORRELATION_ID_ATTRIBUTE);
    if (attribute instanceof String value) {
      return value;
    }
    return CorrelationIds.resolve(request.getHeader(CorrelationIds.HEADER_NAME));
  }

  // ログへそのまま出るため相関 ID と同じ規則で検証する
  private String resolveRequestId(HttpServletRequest request) {
    return CorrelationIds.resolve(request.getHeader("X-Request-Id"));
  }

  private String resolveClientIp(HttpServletRequest request) {
    final String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor == null || xForwardedFor.isBlank()) {
      return request.getRemoteAddr();
    }
    final int commaIndex = xForwardedFor.indexOf(',');
    if (commaIndex < 0) {
      return xForwardedFor.trim();
    }
    return xForwardedFor.substring(0, commaIndex).trim();
  }

  private void put(List<String> keys, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
