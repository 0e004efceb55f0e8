package io.fantasymcp.mcp_gateway.service.tool;

/** 保存済みリーグで補完した後のツール引数。 */
public record ResolvedArguments(String leagueId, String teamId, int seasonYear, Integer week) {}
