package io.fantasymcp.mcp_gateway.model;

/** 外部ストアへのリーグ追加結果。重複と上限超過は障害ではなく想定内の結果として扱う。 */
public enum SeasonAddOutcome {
  ADDED,
  ALREADY_EXISTS,
  LIMIT_EXCEEDED,
  REJECTED
}
