package io.fantasymcp.mcp_gateway.api;

import io.fantasymcp.mcp_gateway.service.GatewayMetrics;
import io.fantasymcp.mcp_gateway.service.LeagueStoreIntegrationException;
import io.fantasymcp.mcp_gateway.service.discovery.OnboardingException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@RequiredArgsConstructor
public class GatewayApiExceptionHandler {

  private final GatewayMetrics gatewayMetrics;

  @ExceptionHandler(OnboardingException.class)
  public ResponseEntity<ApiErrorResponse> handleOnboarding(OnboardingException ex) {
    return ResponseEntity.status(ex.status())
        .body(new ApiErrorResponse(ex.code(), ex.getMessage()));
  }

  @ExceptionHandler(LeagueStoreIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleLeagueStoreIntegration(
      LeagueStoreIntegrationException ex) {
    final String code =
        switch (ex.reason()) {
          case UNAUTHORIZED -> "LEAGUE_STORE_UNAUTHORIZED";
          case FORBIDDEN -> "LEAGUE_STORE_FORBIDDEN";
          case NOT_FOUND -> "LEAGUE_STORE_NOT_FOUND";
          case TIMEOUT -> "LEAGUE_STORE_TIMEOUT";
          case INVALID_RESPONSE -> "LEAGUE_STORE_INVALID_RESPONSE";
          case BAD_GATEWAY -> "LEAGUE_STORE_BAD_GATEWAY";
        };
    // ストアが呼び出し元トークンを拒否した場合は再認可を促すため 401 をそのまま返す
    final HttpStatus status =
        switch (ex.reason()) {
          case UNAUTHORIZED -> HttpStatus.UNAUTHORIZED;
          case FORBIDDEN -> HttpStatus.FORBIDDEN;
          case NOT_FOUND -> HttpStatus.NOT_FOUND;
          case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
          case INVALID_RESPONSE, BAD_GATEWAY -> HttpStatus.BAD_GATEWAY;
        };
    gatewayMetrics.recordStoreIntegrationError(code);
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, ex.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    return ResponseEntity.badRequest()
        .body(new ApiErrorResponse("VALIDATION_ERROR", "request body is not valid JSON"));
  }
}
