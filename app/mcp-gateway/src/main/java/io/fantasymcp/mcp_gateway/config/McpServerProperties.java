package io.fantasymcp.mcp_gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.mcp")
public record McpServerProperties(
    String name, String version, String description, String protocolVersion) {

  public McpServerProperties {
    name = name == null || name.isBlank() ? "fantasy-mcp-gateway" : name;
    version = version == null || version.isBlank() ? "1.0.0" : version;
    description =
        description == null || description.isBlank()
            ? "Read-only fantasy sports league tools for AI assistants"
            : description;
    protocolVersion =
        protocolVersion == null || protocolVersion.isBlank() ? "2024-11-05" : protocolVersion;
  }
}
