package io.fantasymcp.mcp_gateway.api.response;

import java.util.Map;

public record ServerDescriptorResponse(
    String name,
    String version,
    String description,
    String protocolVersion,
    Map<String, Object> capabilities,
    String resourceMetadata) {}
