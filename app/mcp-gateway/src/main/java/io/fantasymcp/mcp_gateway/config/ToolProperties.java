package io.fantasymcp.mcp_gateway.config;

import io.fantasymcp.mcp_gateway.model.Sport;
import java.time.ZoneId;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.tools")
public record ToolProperties(List<Sport> sports, Sport defaultSport, String timezone) {

  public ToolProperties {
    sports = sports == null || sports.isEmpty() ? List.of(Sport.values()) : List.copyOf(sports);
    defaultSport = defaultSport == null ? Sport.FOOTBALL : defaultSport;
    // シーズン切替は米国東部の暦で判定する
    timezone = timezone == null || timezone.isBlank() ? "America/New_York" : timezone;
  }

  public ZoneId zoneId() {
    return ZoneId.of(timezone);
  }
}
