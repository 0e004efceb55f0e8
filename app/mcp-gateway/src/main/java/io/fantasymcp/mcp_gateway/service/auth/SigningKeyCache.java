/*
 * どこで: MCP Gateway 認証
 * 何を: issuer ごとの JWKS を TTL 付きでプロセス内にキャッシュする
 * なぜ: リクエストごとの鍵取得を避けつつ、鍵ローテーションを TTL 経過後に取り込むため
 */
package io.fantasymcp.mcp_gateway.service.auth;

import com.nimbusds.jose.jwk.JWKSet;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.fantasymcp.mcp_gateway.config.GatewayAuthProperties;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "JwksClient と Clock は Spring 管理の共有コンポーネントで防御的コピーが不要なため")
public class SigningKeyCache {

  private static final Logger logger = LoggerFactory.getLogger(SigningKeyCache.class);

  private final JwksClient jwksClient;
  private final Clock clock;
  private final Duration ttl;
  private final String jwksPath;
  // 同時に期限切れを検出した場合は各スレッドが取得し、最後の書き込みが残る
  private final ConcurrentMap<String, CachedKeySet> entries = new ConcurrentHashMap<>();

  public SigningKeyCache(JwksClient jwksClient, Clock clock, GatewayAuthProperties properties) {
    this.jwksClient = jwksClient;
    this.clock = clock;
    this.ttl = properties.jwksCacheTtl();
    this.jwksPath = properties.jwksPath();
  }

  /**
   * issuer の鍵セットを返す。TTL 内ならキャッシュ、期限切れか未取得なら取得して置き換える。
   *
   * @throws JwksIntegrationException 取得に失敗した場合
   */
  public JWKSet keysFor(String issuer) {
    final Instant now = clock.instant();
    final CachedKeySet cached = entries.get(issuer);
    if (cached != null && cached.isFresh(now, ttl)) {
      return cached.keys();
    }
    final URI jwksUri = jwksUri(issuer);
    logger.debug("fetching jwks issuer={} uri={}", issuer, jwksUri);
    final JWKSet keys = jwksClient.fetch(jwksUri);
    entries.put(issuer, new CachedKeySet(keys, now));
    return keys;
  }

  int size() {
    return entries.size();
  }

  private URI jwksUri(String issuer) {
    final String base = issuer.endsWith("/") ? issuer.substring(0, issuer.length() - 1) : issuer;
    return URI.create(base + jwksPath);
  }

  private record CachedKeySet(JWKSet keys, Instant fetchedAt) {

    boolean isFresh(Instant now, Duration ttl) {
      return now.isBefore(fetchedAt.plus(ttl));
    }
  }
}
