/*
 * どこで: MCP Gateway モデル
 * 何を: 対応スポーツごとの upstream game id とシーズン切替月を定義する
 * なぜ: シーズン年の算出とツール名・URL の組み立てを 1 か所の定義から行うため
 */
package io.fantasymcp.mcp_gateway.model;

import java.util.Locale;
import java.util.Optional;

public enum Sport {
  BASEBALL("baseball", "flb", 2, "mlb", false),
  FOOTBALL("football", "ffl", 7, "nfl", false),
  BASKETBALL("basketball", "fba", 8, "nba", true),
  HOCKEY("hockey", "fhl", 8, "nhl", true);

  private final String label;
  private final String gameId;
  private final int rolloverMonth;
  private final String synonym;
  private final boolean crossYear;

  Sport(String label, String gameId, int rolloverMonth, String synonym, boolean crossYear) {
    this.label = label;
    this.gameId = gameId;
    this.rolloverMonth = rolloverMonth;
    this.synonym = synonym;
    this.crossYear = crossYear;
  }

  public String label() {
    return label;
  }

  public String gameId() {
    return gameId;
  }

  /** この月(1-12)以降は当年、それより前は前年がシーズン年になる。 */
  public int rolloverMonth() {
    return rolloverMonth;
  }

  /** 年をまたぐシーズンは開始年で保持し、upstream には終了年(開始年 + 1)を渡す。 */
  public int toProviderSeasonYear(int seasonYear) {
    return crossYear ? seasonYear + 1 : seasonYear;
  }

  public static Optional<Sport> fromLabel(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (Sport sport : values()) {
      if (sport.label.equals(normalized) || sport.synonym.equals(normalized)) {
        return Optional.of(sport);
      }
    }
    return Optional.empty();
  }
}
