package io.fantasymcp.mcp_gateway.service.tool;

public enum ToolKind {
  SESSION,
  LEAGUE_INFO,
  TEAM_ROSTER,
  MATCHUPS,
  STANDINGS
}
