package io.fantasymcp.mcp_gateway.service.auth;

import io.fantasymcp.mcp_gateway.model.TokenFailureReason;
import io.fantasymcp.mcp_gateway.model.VerifiedIdentity;

/** 呼び出し元認証の結果。資格情報なしとトークン不正は別の 401 チャレンジになる。 */
public record CallerAuthentication(
    Outcome outcome, VerifiedIdentity identity, TokenFailureReason failure) {

  public enum Outcome {
    AUTHENTICATED,
    MISSING_CREDENTIALS,
    INVALID_TOKEN
  }

  public static CallerAuthentication authenticated(VerifiedIdentity identity) {
    return new CallerAuthentication(Outcome.AUTHENTICATED, identity, null);
  }

  public static CallerAuthentication missingCredentials() {
    return new CallerAuthentication(Outcome.MISSING_CREDENTIALS, null, null);
  }

  public static CallerAuthentication invalidToken(TokenFailureReason failure) {
    return new CallerAuthentication(Outcome.INVALID_TOKEN, null, failure);
  }

  public boolean isAuthenticated() {
    return outcome == Outcome.AUTHENTICATED;
  }
}
