package io.fantasymcp.mcp_gateway.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderTeam(
    Integer id,
    String abbrev,
    String location,
    String nickname,
    String name,
    String primaryOwner,
    Integer playoffSeed,
    Integer rankCalculatedFinal,
    TeamRecord record,
    Roster roster) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record TeamRecord(Overall overall) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Overall(
      Integer wins,
      Integer losses,
      Integer ties,
      Double percentage,
      Double pointsFor,
      Double pointsAgainst) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Roster(List<RosterEntry> entries) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record RosterEntry(
      Integer playerId, Integer lineupSlotId, PlayerPoolEntry playerPoolEntry) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record PlayerPoolEntry(Double appliedStatTotal, Player player) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Player(
      Integer id,
      String fullName,
      Integer defaultPositionId,
      Integer proTeamId,
      String injuryStatus) {}
}
