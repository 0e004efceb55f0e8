package io.fantasymcp.mcp_gateway.service.tool;

import io.fantasymcp.mcp_gateway.model.Sport;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * tools/list に載せるツール定義。
 *
 * @param sport セッションツールのようにスポーツ横断のものは null
 */
public record ToolDefinition(
    String name, String description, Sport sport, ToolKind kind, Map<String, Object> inputSchema) {

  public ToolDefinition {
    inputSchema =
        inputSchema == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(inputSchema));
  }
}
