/*
 * どこで: MCP Gateway 認証
 * 何を: Authorization ヘッダから呼び出し元を確定し、開発モード時のみ識別ヘッダでの代替を許す
 * なぜ: JSON-RPC と REST の両入口で同じ認証判定を共有するため
 */
package io.fantasymcp.mcp_gateway.service.auth;

import io.fantasymcp.mcp_gateway.config.GatewayAuthProperties;
import io.fantasymcp.mcp_gateway.model.TokenVerification;
import io.fantasymcp.mcp_gateway.model.VerifiedIdentity;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CallerAuthenticator {

  static final String DEVELOPMENT_ISSUER = "development";

  private static final Logger logger = LoggerFactory.getLogger(CallerAuthenticator.class);

  private final BearerTokenVerifier bearerTokenVerifier;
  private final Clock clock;
  private final boolean developmentMode;
  private final String developmentUserHeader;
  private final Duration developmentIdentityTtl;

  public CallerAuthenticator(
      BearerTokenVerifier bearerTokenVerifier, Clock clock, GatewayAuthProperties properties) {
    this.bearerTokenVerifier = bearerTokenVerifier;
    this.clock = clock;
    this.developmentMode = properties.developmentMode();
    this.developmentUserHeader = properties.developmentUserHeader();
    this.developmentIdentityTtl = properties.developmentIdentityTtl();
    if (developmentMode) {
      logger.warn(
          "development mode is enabled: requests without a bearer token may identify via {}",
          developmentUserHeader);
    }
  }

  /**
   * @param authorizationHeader Authorization ヘッダ値(無ければ null)
   * @param developmentUserId 開発用識別ヘッダ値。開発モード以外では無視する
   */
  public CallerAuthentication authenticate(String authorizationHeader, String developmentUserId) {
    if (isBlank(authorizationHeader)) {
      if (developmentMode && !isBlank(developmentUserId)) {
        logger.warn(
            "accepting unverified caller from {} header (development mode)",
            developmentUserHeader);
        return CallerAuthentication.authenticated(
            new VerifiedIdentity(
                developmentUserId.trim(),
                DEVELOPMENT_ISSUER,
                clock.instant().plus(developmentIdentityTtl)));
      }
      return CallerAuthentication.missingCredentials();
    }
    final TokenVerification verification = bearerTokenVerifier.verify(authorizationHeader);
    if (!verification.isVerified()) {
      return CallerAuthentication.invalidToken(verification.failure());
    }
    return CallerAuthentication.authenticated(verification.identity());
  }

  public String developmentUserHeader() {
    return developmentUserHeader;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
