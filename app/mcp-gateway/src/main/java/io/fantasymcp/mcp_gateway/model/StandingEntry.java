package io.fantasymcp.mcp_gateway.model;

public record StandingEntry(
    String teamId,
    String teamName,
    int wins,
    int losses,
    int ties,
    double winPercentage,
    int rank,
    Integer playoffSeed) {}
