package io.fantasymcp.mcp_gateway.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "provider")
public record ProviderClientProperties(
    String baseUrl,
    String leaguePath,
    String userAgent,
    String fantasySource,
    String fantasyPlatform,
    Duration connectTimeout,
    Duration readTimeout) {

  public ProviderClientProperties {
    baseUrl = isBlank(baseUrl) ? "https://lm-api-reads.fantasy.espn.com/apis/v3" : baseUrl;
    leaguePath =
        isBlank(leaguePath)
            ? "/games/{gameId}/seasons/{seasonYear}/segments/0/leagues/{leagueId}"
            : leaguePath;
    userAgent = isBlank(userAgent) ? "fantasy-mcp-gateway/1.0" : userAgent;
    fantasySource = isBlank(fantasySource) ? "kona" : fantasySource;
    fantasyPlatform = isBlank(fantasyPlatform) ? "kona-web-2.0.0" : fantasyPlatform;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(3) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(7) : readTimeout;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
