package io.fantasymcp.mcp_gateway.service.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.nimbusds.jose.jwk.RSAKey;
import io.fantasymcp.mcp_gateway.config.GatewayAuthProperties;
import io.fantasymcp.mcp_gateway.model.TokenFailureReason;
import io.fantasymcp.mcp_gateway.model.TokenVerification;
import io.fantasymcp.mcp_gateway.service.GatewayMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class BearerTokenVerifierTest {

  private static final Instant NOW = Instant.parse("2025-10-01T12:00:00Z");
  private static final URI JWKS_URI = URI.create(TestTokens.ISSUER + "/.well-known/jwks.json");

  private static RSAKey signingKey;
  private static RSAKey otherKey;

  @BeforeAll
  static void generateKeys() {
    signingKey = TestTokens.generateKey(TestTokens.KEY_ID);
    otherKey = TestTokens.generateKey(TestTokens.KEY_ID);
  }

  @Test
  void verifyAcceptsSignedTokenWithKnownKid() {
    final Fixture fixture = newFixture();
    final String token =
        TestTokens.rs256(
            signingKey, TestTokens.KEY_ID, TestTokens.ISSUER, "user-1", NOW.plusSeconds(600));

    final TokenVerification result = fixture.verifier.verify("Bearer " + token);

    assertThat(result.isVerified()).isTrue();
    assertThat(result.identity().subjectId()).isEqualTo("user-1");
    assertThat(result.identity().issuer()).isEqualTo(TestTokens.ISSUER);
    assertThat(result.identity().expiresAt()).isEqualTo(NOW.plusSeconds(600));
  }

  @Test
  void verifyAcceptsLowercaseScheme() {
    final Fixture fixture = newFixture();
    final String token =
        TestTokens.rs256(
            signingKey, TestTokens.KEY_ID, TestTokens.ISSUER, "user-1", NOW.plusSeconds(600));

    assertThat(fixture.verifier.verify("bearer " + token).isVerified()).isTrue();
  }

  @Test
  void verifyRejectsExpiredToken() {
    final Fixture fixture = newFixture();
    final String token =
        TestTokens.rs256(
            signingKey, TestTokens.KEY_ID, TestTokens.ISSUER, "user-1", NOW.minusSeconds(1));

    final TokenVerification result = fixture.verifier.verify("Bearer " + token);

    assertThat(result.failure()).isEqualTo(TokenFailureReason.EXPIRED);
    assertThat(
            fixture
                .meterRegistry
                .get("gateway.auth.token.failure.total")
                .tag("reason", "expired")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void verifyRejectsUnknownKid() {
    final Fixture fixture = newFixture();
    final String token =
        TestTokens.rs256(
            signingKey, "rotated-kid", TestTokens.ISSUER, "user-1", NOW.plusSeconds(600));

    assertThat(fixture.verifier.verify("Bearer " + token).failure())
        .isEqualTo(TokenFailureReason.KEY_NOT_FOUND);
  }

  @Test
  void verifyRejectsHmacAlgorithm() {
    final Fixture fixture = newFixture();
    final String token = TestTokens.hs256(TestTokens.ISSUER, "user-1", NOW.plusSeconds(600));

    assertThat(fixture.verifier.verify("Bearer " + token).failure())
        .isEqualTo(TokenFailureReason.UNSUPPORTED_ALG);
    verify(fixture.jwksClient, never()).fetch(any());
  }

  @Test
  void verifyRejectsTokenSignedByAnotherKey() {
    final Fixture fixture = newFixture();
    final String token =
        TestTokens.rs256(
            otherKey, TestTokens.KEY_ID, TestTokens.ISSUER, "user-1", NOW.plusSeconds(600));

    assertThat(fixture.verifier.verify("Bearer " + token).failure())
        .isEqualTo(TokenFailureReason.BAD_SIGNATURE);
  }

  @Test
  void verifyRejectsTokenWithoutKid() {
    final Fixture fixture = newFixture();
    final String token =
        TestTokens.rs256(signingKey, null, TestTokens.ISSUER, "user-1", NOW.plusSeconds(600));

    assertThat(fixture.verifier.verify("Bearer " + token).failure())
        .isEqualTo(TokenFailureReason.MISSING_KID);
  }

  @Test
  void verifyRejectsGarbageAndNonBearerHeaders() {
    final Fixture fixture = newFixture();

    assertThat(fixture.verifier.verify("Bearer not-a-jwt").failure())
        .isEqualTo(TokenFailureReason.MALFORMED);
    assertThat(fixture.verifier.verify("Basic dXNlcjpwYXNz").failure())
        .isEqualTo(TokenFailureReason.MALFORMED);
    assertThat(fixture.verifier.verify("Bearer ").failure())
        .isEqualTo(TokenFailureReason.MALFORMED);
  }

  @Test
  void verifyRejectsIssuerThatIsNotUrl() {
    final Fixture fixture = newFixture();
    final String token =
        TestTokens.rs256(
            signingKey, TestTokens.KEY_ID, "not a url", "user-1", NOW.plusSeconds(600));

    assertThat(fixture.verifier.verify("Bearer " + token).failure())
        .isEqualTo(TokenFailureReason.MALFORMED);
  }

  @Test
  void verifyRejectsIssuerOutsideAllowlist() {
    final Fixture fixture = newFixture(List.of("https://other-issuer.test"));
    final String token =
        TestTokens.rs256(
            signingKey, TestTokens.KEY_ID, TestTokens.ISSUER, "user-1", NOW.plusSeconds(600));

    assertThat(fixture.verifier.verify("Bearer " + token).failure())
        .isEqualTo(TokenFailureReason.UNTRUSTED_ISSUER);
    verify(fixture.jwksClient, never()).fetch(any());
  }

  @Test
  void defaultConfigurationRejectsIssuerOutsideAuthorizationServers() {
    final Fixture fixture = newFixture(null, null, false, JWKS_URI);
    final String token =
        TestTokens.rs256(
            signingKey, TestTokens.KEY_ID, TestTokens.ISSUER, "user-1", NOW.plusSeconds(600));

    assertThat(fixture.verifier.verify("Bearer " + token).failure())
        .isEqualTo(TokenFailureReason.UNTRUSTED_ISSUER);
    verify(fixture.jwksClient, never()).fetch(any());
  }

  @Test
  void defaultConfigurationTrustsAuthorizationServerIssuer() {
    final Fixture fixture = newFixture(List.of(TestTokens.ISSUER), null, false, JWKS_URI);
    final String token =
        TestTokens.rs256(
            signingKey, TestTokens.KEY_ID, TestTokens.ISSUER, "user-1", NOW.plusSeconds(600));

    assertThat(fixture.verifier.verify("Bearer " + token).isVerified()).isTrue();
  }

  @Test
  void plainHttpIssuerIsRejectedOutsideDevelopmentMode() {
    final String issuer = "http://auth.fantasymcp.test";
    final URI jwksUri = URI.create(issuer + "/.well-known/jwks.json");
    final String token =
        TestTokens.rs256(signingKey, TestTokens.KEY_ID, issuer, "user-1", NOW.plusSeconds(600));

    final Fixture production = newFixture(null, List.of(issuer), false, jwksUri);
    assertThat(production.verifier.verify("Bearer " + token).failure())
        .isEqualTo(TokenFailureReason.UNTRUSTED_ISSUER);
    verify(production.jwksClient, never()).fetch(any());

    final Fixture development = newFixture(null, List.of(issuer), true, jwksUri);
    assertThat(development.verifier.verify("Bearer " + token).isVerified()).isTrue();
  }

  @Test
  void verifyReportsKeysUnavailableWhenJwksFetchFails() {
    final Fixture fixture = newFixture();
    when(fixture.jwksClient.fetch(JWKS_URI))
        .thenThrow(
            new JwksIntegrationException(
                JwksIntegrationException.Reason.TIMEOUT, "jwks request timeout"));
    final String token =
        TestTokens.rs256(
            signingKey, TestTokens.KEY_ID, TestTokens.ISSUER, "user-1", NOW.plusSeconds(600));

    assertThat(fixture.verifier.verify("Bearer " + token).failure())
        .isEqualTo(TokenFailureReason.KEYS_UNAVAILABLE);
  }

  @Test
  void extractTokenHandlesMissingAndBlankHeaders() {
    assertThat(BearerTokenVerifier.extractToken(null)).isNull();
    assertThat(BearerTokenVerifier.extractToken("   ")).isNull();
    assertThat(BearerTokenVerifier.extractToken("Token abc")).isNull();
    assertThat(BearerTokenVerifier.extractToken("  Bearer   abc  ")).isEqualTo("abc");
  }

  private Fixture newFixture() {
    return newFixture(List.of(TestTokens.ISSUER));
  }

  private Fixture newFixture(List<String> trustedIssuers) {
    return newFixture(null, trustedIssuers, false, JWKS_URI);
  }

  private Fixture newFixture(
      List<String> authorizationServers,
      List<String> trustedIssuers,
      boolean developmentMode,
      URI jwksUri) {
    final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    final GatewayAuthProperties properties =
        new GatewayAuthProperties(
            null,
            null,
            authorizationServers,
            null,
            trustedIssuers,
            null,
            null,
            null,
            null,
            developmentMode,
            null,
            null);
    final JwksClient jwksClient = mock(JwksClient.class);
    when(jwksClient.fetch(jwksUri)).thenReturn(TestTokens.publicKeys(signingKey));
    final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    final BearerTokenVerifier verifier =
        new BearerTokenVerifier(
            new SigningKeyCache(jwksClient, clock, properties),
            clock,
            properties,
            new GatewayMetrics(meterRegistry));
    return new Fixture(verifier, jwksClient, meterRegistry);
  }

  private record Fixture(
      BearerTokenVerifier verifier, JwksClient jwksClient, SimpleMeterRegistry meterRegistry) {}
}
