package io.fantasymcp.mcp_gateway.config;

import io.fantasymcp.mcp_gateway.model.Sport;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "discovery")
public record DiscoveryProperties(
    @Positive Integer minYear,
    @Positive Integer maxConsecutiveMisses,
    @Positive Integer mandatoryWindowYears,
    Duration probeDelay,
    Duration retryDelay,
    Sport defaultSport) {

  public DiscoveryProperties {
    minYear = minYear == null ? 2000 : minYear;
    maxConsecutiveMisses = maxConsecutiveMisses == null ? 2 : maxConsecutiveMisses;
    // 当年と前年は miss 数に関係なく必ず probe する
    mandatoryWindowYears = mandatoryWindowYears == null ? 2 : mandatoryWindowYears;
    probeDelay = probeDelay == null ? Duration.ofMillis(200) : probeDelay;
    retryDelay = retryDelay == null ? Duration.ofSeconds(1) : retryDelay;
    defaultSport = defaultSport == null ? Sport.FOOTBALL : defaultSport;
  }
}
