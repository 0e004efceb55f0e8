package io.fantasymcp.mcp_gateway.model;

public record RosterPlayer(
    Integer playerId,
    String fullName,
    Integer lineupSlotId,
    Integer defaultPositionId,
    Integer proTeamId,
    String injuryStatus,
    Double appliedStatTotal) {}
