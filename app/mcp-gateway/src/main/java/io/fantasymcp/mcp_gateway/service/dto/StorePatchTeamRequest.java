package io.fantasymcp.mcp_gateway.service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StorePatchTeamRequest(
    String teamId, String sport, String teamName, String leagueName, Integer seasonYear) {}
