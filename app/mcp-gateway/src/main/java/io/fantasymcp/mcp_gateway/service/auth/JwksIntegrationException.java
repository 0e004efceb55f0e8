package io.fantasymcp.mcp_gateway.service.auth;

public class JwksIntegrationException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public JwksIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public JwksIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
