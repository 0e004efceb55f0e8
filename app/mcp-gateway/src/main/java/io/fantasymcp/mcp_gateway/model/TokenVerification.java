/*
 * どこで: MCP Gateway モデル
 * 何を: Bearer トークン検証の成功(identity)か失敗(reason)のどちらかを表す
 * なぜ: 検証失敗を例外ではなく値で返し、呼び出し側が 401 応答の種別を選べるようにするため
 */
package io.fantasymcp.mcp_gateway.model;

public record TokenVerification(VerifiedIdentity identity, TokenFailureReason failure) {

  public TokenVerification {
    if ((identity == null) == (failure == null)) {
      throw new IllegalArgumentException("exactly one of identity or failure is required");
    }
  }

  public static TokenVerification verified(VerifiedIdentity identity) {
    return new TokenVerification(identity, null);
  }

  public static TokenVerification failed(TokenFailureReason failure) {
    return new TokenVerification(null, failure);
  }

  public boolean isVerified() {
    return identity != null;
  }
}
