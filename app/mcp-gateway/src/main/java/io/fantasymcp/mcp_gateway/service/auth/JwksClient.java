package io.fantasymcp.mcp_gateway.service.auth;

import com.nimbusds.jose.jwk.JWKSet;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.text.ParseException;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/** issuer の公開鍵セット(JWKS)を取得する。 */
@Service
@RequiredArgsConstructor
public class JwksClient {

  private static final Logger logger = LoggerFactory.getLogger(JwksClient.class);

  private final RestClient jwksRestClient;

  public JWKSet fetch(@NonNull URI jwksUri) {
    final String body;
    try {
      body =
          jwksRestClient
              .get()
              .uri(jwksUri)
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .body(String.class);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "jwks fetch failed with http status={} uri={}", ex.getStatusCode().value(), jwksUri);
      if (ex.getStatusCode().value() == 404) {
        throw new JwksIntegrationException(
            JwksIntegrationException.Reason.NOT_FOUND, "jwks not found", ex);
      }
      throw new JwksIntegrationException(
          JwksIntegrationException.Reason.BAD_GATEWAY, "jwks request failed", ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("jwks fetch timed out uri={}", jwksUri);
        throw new JwksIntegrationException(
            JwksIntegrationException.Reason.TIMEOUT, "jwks request timeout", ex);
      }
      logger.warn("jwks fetch connection failed uri={}", jwksUri, ex);
      throw new JwksIntegrationException(
          JwksIntegrationException.Reason.BAD_GATEWAY, "jwks connection failed", ex);
    }
    if (body == null || body.isBlank()) {
      throw new JwksIntegrationException(
          JwksIntegrationException.Reason.INVALID_RESPONSE, "jwks response is empty");
    }
    try {
      return JWKSet.parse(body);
    } catch (ParseException ex) {
      logger.warn("jwks response parse failed uri={}", jwksUri);
      throw new JwksIntegrationException(
          JwksIntegrationException.Reason.INVALID_RESPONSE, "jwks response parse failed", ex);
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
