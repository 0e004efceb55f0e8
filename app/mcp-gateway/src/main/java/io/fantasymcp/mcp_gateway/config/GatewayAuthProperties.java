package io.fantasymcp.mcp_gateway.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.auth")
public record GatewayAuthProperties(
    String resource,
    String resourceMetadataUrl,
    List<String> authorizationServers,
    List<String> scopesSupported,
    List<String> trustedIssuers,
    String jwksPath,
    Duration jwksCacheTtl,
    Duration jwksConnectTimeout,
    Duration jwksReadTimeout,
    boolean developmentMode,
    String developmentUserHeader,
    Duration developmentIdentityTtl) {

  public GatewayAuthProperties {
    resource = isBlank(resource) ? "https://api.fantasymcp.io/mcp" : resource;
    resourceMetadataUrl =
        isBlank(resourceMetadataUrl)
            ? "https://api.fantasymcp.io/.well-known/oauth-protected-resource"
            : resourceMetadataUrl;
    authorizationServers =
        authorizationServers == null || authorizationServers.isEmpty()
            ? List.of("https://api.fantasymcp.io")
            : List.copyOf(authorizationServers);
    scopesSupported =
        scopesSupported == null || scopesSupported.isEmpty()
            ? List.of("mcp:read", "mcp:write")
            : List.copyOf(scopesSupported);
    // 未設定なら認可サーバだけを信頼する。空の許可リストで全 issuer を受け入れることはしない
    trustedIssuers =
        trustedIssuers == null || trustedIssuers.isEmpty()
            ? authorizationServers
            : List.copyOf(trustedIssuers);
    jwksPath = isBlank(jwksPath) ? "/.well-known/jwks.json" : jwksPath;
    jwksCacheTtl = jwksCacheTtl == null ? Duration.ofMinutes(5) : jwksCacheTtl;
    jwksConnectTimeout = jwksConnectTimeout == null ? Duration.ofSeconds(2) : jwksConnectTimeout;
    jwksReadTimeout = jwksReadTimeout == null ? Duration.ofSeconds(3) : jwksReadTimeout;
    developmentUserHeader =
        isBlank(developmentUserHeader) ? "X-User-Id" : developmentUserHeader;
    developmentIdentityTtl =
        developmentIdentityTtl == null ? Duration.ofMinutes(5) : developmentIdentityTtl;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
