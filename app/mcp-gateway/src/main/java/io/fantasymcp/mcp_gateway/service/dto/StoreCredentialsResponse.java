package io.fantasymcp.mcp_gateway.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreCredentialsResponse(Boolean success, Credentials credentials) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Credentials(String swid, String s2, String email) {}
}
