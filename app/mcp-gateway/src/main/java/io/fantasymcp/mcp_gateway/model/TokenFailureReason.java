package io.fantasymcp.mcp_gateway.model;

public enum TokenFailureReason {
  MALFORMED("malformed"),
  UNSUPPORTED_ALG("unsupported_alg"),
  MISSING_KID("missing_kid"),
  UNTRUSTED_ISSUER("untrusted_issuer"),
  KEYS_UNAVAILABLE("keys_unavailable"),
  KEY_NOT_FOUND("key_not_found"),
  EXPIRED("expired"),
  BAD_SIGNATURE("bad_signature");

  private final String code;

  TokenFailureReason(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
