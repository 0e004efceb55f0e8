package io.fantasymcp.mcp_gateway.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "league-store")
public record LeagueStoreClientProperties(
    String baseUrl,
    String leaguesPath,
    String credentialsPath,
    String addLeaguePath,
    String patchTeamPath,
    String userIdHeaderName,
    Duration connectTimeout,
    Duration readTimeout) {

  public LeagueStoreClientProperties {
    baseUrl = isBlank(baseUrl) ? "http://league-store:80" : baseUrl;
    leaguesPath = isBlank(leaguesPath) ? "/leagues" : leaguesPath;
    credentialsPath = isBlank(credentialsPath) ? "/credentials/espn?raw=true" : credentialsPath;
    addLeaguePath = isBlank(addLeaguePath) ? "/leagues/add" : addLeaguePath;
    patchTeamPath = isBlank(patchTeamPath) ? "/leagues/{leagueId}/team" : patchTeamPath;
    userIdHeaderName = isBlank(userIdHeaderName) ? "X-User-Id" : userIdHeaderName;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
