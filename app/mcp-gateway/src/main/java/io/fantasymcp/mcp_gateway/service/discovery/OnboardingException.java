package io.fantasymcp.mcp_gateway.service.discovery;

import org.springframework.http.HttpStatus;

/** オンボーディング API の業務エラー。code はクライアントが分岐に使う安定した識別子。 */
public class OnboardingException extends RuntimeException {

  private final String code;
  private final HttpStatus status;

  public OnboardingException(String code, HttpStatus status, String message) {
    super(message);
    this.code = code;
    this.status = status;
  }

  public String code() {
    return code;
  }

  public HttpStatus status() {
    return status;
  }
}
