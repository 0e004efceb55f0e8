package io.fantasymcp.mcp_gateway.service;

public class LeagueStoreIntegrationException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    FORBIDDEN,
    NOT_FOUND,
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public LeagueStoreIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public LeagueStoreIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  /** 呼び出し元トークンが拒否された(再認可が必要)かどうか。 */
  public boolean isAuthFailure() {
    return reason == Reason.UNAUTHORIZED || reason == Reason.FORBIDDEN;
  }
}
