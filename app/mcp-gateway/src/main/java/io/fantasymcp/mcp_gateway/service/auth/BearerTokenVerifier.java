package io.fantasymcp.mcp_gateway.service.auth;

import com.nimbusds.jose.Algorithm;
import com.nimbusds.jose.Header;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObject;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.util.Base64URL;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.fantasymcp.mcp_gateway.config.GatewayAuthProperties;
import io.fantasymcp.mcp_gateway.model.TokenFailureReason;
import io.fantasymcp.mcp_gateway.model.TokenVerification;
import io.fantasymcp.mcp_gateway.model.VerifiedIdentity;
import io.fantasymcp.mcp_gateway.service.GatewayMetrics;
import java.net.URI;
import java.net.URISyntaxException;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Bearer トークン(RS256 の JWT)を issuer の JWKS で検証する。
 *
 * <p>役割: 共有秘密なしで呼び出し元の subject を確定する。
 *
 * <p>期待動作: 失敗は例外にせず {@link TokenFailureReason} 付きの値で返す。トークン本体はログに出さない。
 */
@Service
public class BearerTokenVerifier {

  private static final Logger logger = LoggerFactory.getLogger(BearerTokenVerifier.class);
  private static final String BEARER_PREFIX = "bearer ";

  private final SigningKeyCache signingKeyCache;
  private final Clock clock;
  private final List<String> trustedIssuers;
  private final boolean allowPlainHttpIssuer;
  private final GatewayMetrics gatewayMetrics;

  public BearerTokenVerifier(
      SigningKeyCache signingKeyCache,
      Clock clock,
      GatewayAuthProperties properties,
      GatewayMetrics gatewayMetrics) {
    this.signingKeyCache = signingKeyCache;
    this.clock = clock;
    this.trustedIssuers = properties.trustedIssuers();
    this.allowPlainHttpIssuer = properties.developmentMode();
    this.gatewayMetrics = gatewayMetrics;
  }

  public TokenVerification verify(String authorizationHeader) {
    final String token = extractToken(authorizationHeader);
    if (token == null) {
      return fail(TokenFailureReason.MALFORMED, "authorization header is not a bearer token");
    }

    final SignedJWT jwt;
    try {
      jwt = SignedJWT.parse(token);
    } catch (ParseException ex) {
      if (declaresUnsignedAlgorithm(token)) {
        return fail(TokenFailureReason.UNSUPPORTED_ALG, "token declares alg none");
      }
      return fail(TokenFailureReason.MALFORMED, "token could not be parsed");
    }

    final JWSHeader header = jwt.getHeader();
    if (!JWSAlgorithm.RS256.equals(header.getAlgorithm())) {
      return fail(TokenFailureReason.UNSUPPORTED_ALG, "token alg=" + header.getAlgorithm());
    }

    final JWTClaimsSet claims;
    try {
      claims = jwt.getJWTClaimsSet();
    } catch (ParseException ex) {
      return fail(TokenFailureReason.MALFORMED, "token claims could not be parsed");
    }
    final String issuer = claims.getIssuer();
    final String subject = claims.getSubject();
    if (!isHttpUrl(issuer) || isBlank(subject)) {
      return fail(TokenFailureReason.MALFORMED, "token is missing iss or sub");
    }

    final String keyId = header.getKeyID();
    if (isBlank(keyId)) {
      return fail(TokenFailureReason.MISSING_KID, "token header has no kid");
    }

    // JWKS 取得先は iss から決まるため、取得前に許可リストと https を確認する
    if (!allowPlainHttpIssuer && !issuer.startsWith("https://")) {
      return fail(TokenFailureReason.UNTRUSTED_ISSUER, "issuer is not https: " + issuer);
    }
    if (!trustedIssuers.contains(issuer)) {
      return fail(TokenFailureReason.UNTRUSTED_ISSUER, "issuer is not trusted: " + issuer);
    }

    final JWKSet keys;
    try {
      keys = signingKeyCache.keysFor(issuer);
    } catch (JwksIntegrationException ex) {
      return fail(TokenFailureReason.KEYS_UNAVAILABLE, "jwks unavailable: " + ex.reason());
    }

    final JWK key = keys.getKeyByKeyId(keyId);
    if (!(key instanceof RSAKey rsaKey)) {
      // ローテーション直後の可能性がある。強制再取得はせず TTL 経過を待つ
      return fail(TokenFailureReason.KEY_NOT_FOUND, "no rsa key for kid=" + keyId);
    }

    try {
      if (!jwt.verify(new RSASSAVerifier(rsaKey))) {
        return fail(TokenFailureReason.BAD_SIGNATURE, "signature mismatch");
      }
    } catch (JOSEException | RuntimeException ex) {
      return fail(TokenFailureReason.BAD_SIGNATURE, "signature verification error");
    }

    final Date expirationTime = claims.getExpirationTime();
    if (expirationTime == null) {
      return fail(TokenFailureReason.MALFORMED, "token has no exp");
    }
    final Instant expiresAt = expirationTime.toInstant();
    if (!expiresAt.isAfter(clock.instant())) {
      return fail(TokenFailureReason.EXPIRED, "token expired");
    }

    return TokenVerification.verified(new VerifiedIdentity(subject, issuer, expiresAt));
  }

  /** "Bearer <token>" からトークンを取り出す。スキームは大文字小文字を区別しない。 */
  public static String extractToken(String authorizationHeader) {
    if (authorizationHeader == null) {
      return null;
    }
    final String trimmed = authorizationHeader.trim();
    if (trimmed.length() <= BEARER_PREFIX.length()) {
      return null;
    }
    final String scheme = trimmed.substring(0, BEARER_PREFIX.length()).toLowerCase(Locale.ROOT);
    if (!BEARER_PREFIX.equals(scheme)) {
      return null;
    }
    final String token = trimmed.substring(BEARER_PREFIX.length()).trim();
    return token.isEmpty() ? null : token;
  }

  private TokenVerification fail(TokenFailureReason reason, String detail) {
    if (reason == TokenFailureReason.KEY_NOT_FOUND
        || reason == TokenFailureReason.KEYS_UNAVAILABLE) {
      logger.warn("bearer token rejected reason={} detail={}", reason.code(), detail);
    } else {
      logger.debug("bearer token rejected reason={} detail={}", reason.code(), detail);
    }
    gatewayMetrics.recordTokenFailure(reason.code());
    return TokenVerification.failed(reason);
  }

  private boolean declaresUnsignedAlgorithm(String token) {
    try {
      final Base64URL[] parts = JOSEObject.split(token);
      final Header header = Header.parse(parts[0]);
      return Algorithm.NONE.equals(header.getAlgorithm());
    } catch (ParseException ex) {
      return false;
    }
  }

  private boolean isHttpUrl(String value) {
    if (isBlank(value)) {
      return false;
    }
    try {
      final URI uri = new URI(value);
      return ("https".equals(uri.getScheme()) || "http".equals(uri.getScheme()))
          && uri.getHost() != null;
    } catch (URISyntaxException ex) {
      return false;
    }
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
