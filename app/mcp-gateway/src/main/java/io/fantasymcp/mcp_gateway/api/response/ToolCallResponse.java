package io.fantasymcp.mcp_gateway.api.response;

import java.util.List;

/** REST 側 tools/call の応答。JSON-RPC の result と同じ形にそろえる。 */
public record ToolCallResponse(List<Content> content, boolean isError) {

  public record Content(String type, String text) {}

  public static ToolCallResponse text(String text, boolean isError) {
    return new ToolCallResponse(List.of(new Content("text", text)), isError);
  }
}
