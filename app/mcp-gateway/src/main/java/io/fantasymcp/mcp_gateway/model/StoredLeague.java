package io.fantasymcp.mcp_gateway.model;

/**
 * 外部ストアが保持するユーザーのリーグ登録。
 *
 * <p>キーは (platform, leagueId, sport, seasonYear)。default フラグはストア側が管理し、gateway からは書き込まない。
 */
public record StoredLeague(
    String platform,
    String leagueId,
    String sport,
    Integer seasonYear,
    String teamId,
    String leagueName,
    String teamName,
    boolean isDefault) {

  public boolean hasTeam() {
    return teamId != null && !teamId.isBlank();
  }

  public boolean isSport(Sport target) {
    return Sport.fromLabel(sport).filter(target::equals).isPresent();
  }
}
