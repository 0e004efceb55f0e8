/*
 * どこで: MCP Gateway 設定
 * 何を: 時刻源(Clock)とシーズン探索の待機(ProbeDelay)を Bean として提供する
 * なぜ: トークン期限判定・シーズン算出・探索ループの時間依存をテストで差し替えられるようにするため
 */
package io.fantasymcp.mcp_gateway.config;

import io.fantasymcp.mcp_gateway.service.discovery.ProbeDelay;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({DiscoveryProperties.class, ToolProperties.class})
public class DiscoveryConfig {

  // 期限判定は UTC、シーズン境界は ToolProperties のタイムゾーンで解釈する
  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  ProbeDelay probeDelay() {
    return duration -> Thread.sleep(duration.toMillis());
  }
}
