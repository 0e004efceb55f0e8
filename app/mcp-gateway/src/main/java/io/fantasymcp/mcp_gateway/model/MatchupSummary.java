package io.fantasymcp.mcp_gateway.model;

public record MatchupSummary(
    Integer matchupPeriodId,
    String homeTeamId,
    String homeTeamName,
    Double homePoints,
    String awayTeamId,
    String awayTeamName,
    Double awayPoints,
    String winner) {}
