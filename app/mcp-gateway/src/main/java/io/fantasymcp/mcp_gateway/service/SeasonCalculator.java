package io.fantasymcp.mcp_gateway.service;

import io.fantasymcp.mcp_gateway.config.ToolProperties;
import io.fantasymcp.mcp_gateway.model.Sport;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import org.springframework.stereotype.Component;

/**
 * スポーツごとの「現在のシーズン年」を算出する。
 *
 * <p>切替月より前は前年をシーズン年とする。年をまたぐスポーツも開始年で返す。
 */
@Component
public class SeasonCalculator {

  private final Clock clock;
  private final ZoneId zoneId;

  public SeasonCalculator(Clock clock, ToolProperties toolProperties) {
    this.clock = clock;
    this.zoneId = toolProperties.zoneId();
  }

  public int currentSeasonYear(Sport sport) {
    final LocalDate today = today();
    if (today.getMonthValue() < sport.rolloverMonth()) {
      return today.getYear() - 1;
    }
    return today.getYear();
  }

  public LocalDate today() {
    return LocalDate.now(clock.withZone(zoneId));
  }

  public int currentCalendarYear() {
    return today().getYear();
  }

  public ZoneId zoneId() {
    return zoneId;
  }
}
