package io.fantasymcp.mcp_gateway.service.mcp;

/** 401 応答の種別。資格情報なしとトークン不正でクライアントの再認可フローが異なる。 */
public enum AuthChallenge {
  UNAUTHORIZED(
      "unauthorized",
      "Authentication required",
      "Authentication required. Please provide a valid Bearer token."),
  INVALID_TOKEN("invalid_token", "Token is invalid or expired", "Invalid or expired token.");

  private final String error;
  private final String description;
  private final String message;

  AuthChallenge(String error, String description, String message) {
    this.error = error;
    this.description = description;
    this.message = message;
  }

  public String error() {
    return error;
  }

  public String description() {
    return description;
  }

  public String message() {
    return message;
  }
}
