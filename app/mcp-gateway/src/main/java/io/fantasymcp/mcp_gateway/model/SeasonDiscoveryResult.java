/*
 * どこで: MCP Gateway モデル
 * 何を: シーズン探索 1 回分の結果(発見シーズンと停止理由のフラグ)を表す
 * なぜ: レート制限や登録上限で途中停止しても、それまでの成果を呼び出し元へ返すため
 */
package io.fantasymcp.mcp_gateway.model;

import java.util.List;

public record SeasonDiscoveryResult(
    Status status,
    String message,
    List<DiscoveredSeason> discovered,
    boolean rateLimited,
    boolean limitExceeded,
    boolean minYearReached,
    int skipped,
    int startYear) {

  public enum Status {
    COMPLETED,
    CREDENTIALS_REJECTED,
    UPSTREAM_FAILED
  }

  public SeasonDiscoveryResult {
    discovered = discovered == null ? List.of() : List.copyOf(discovered);
  }

  public boolean isCompleted() {
    return status == Status.COMPLETED;
  }
}
