/*
 * どこで: MCP Gateway 下流 DTO
 * 何を: fantasy provider のリーグ応答(view 指定で中身が変わる)を表現する
 * なぜ: 未型付けの upstream 応答を使用前に必要なフィールドだけへ絞り込むため
 */
package io.fantasymcp.mcp_gateway.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderLeagueResponse(
    Long id,
    Integer seasonId,
    Integer scoringPeriodId,
    Settings settings,
    Status status,
    List<ProviderMember> members,
    List<ProviderTeam> teams,
    List<ProviderScheduleItem> schedule) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Settings(String name, Integer size, ScheduleSettings scheduleSettings) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ScheduleSettings(Integer matchupPeriodCount, Integer playoffTeamCount) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Status(
      Integer currentMatchupPeriod, Integer latestScoringPeriod, Boolean isActive) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ProviderMember(
      String id, String displayName, String firstName, String lastName) {}
}
