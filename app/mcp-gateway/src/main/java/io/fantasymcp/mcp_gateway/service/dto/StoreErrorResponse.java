package io.fantasymcp.mcp_gateway.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreErrorResponse(String error, String code) {}
