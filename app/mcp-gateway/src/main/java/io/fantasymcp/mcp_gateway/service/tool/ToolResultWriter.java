package io.fantasymcp.mcp_gateway.service.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fantasymcp.mcp_gateway.model.ToolCallResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** ツール出力をテキストコンテンツ(JSON 文字列)へ直列化する。 */
@Component
@RequiredArgsConstructor
public class ToolResultWriter {

  private final ObjectMapper objectMapper;

  public ToolCallResult success(Object body) {
    try {
      return ToolCallResult.success(objectMapper.writeValueAsString(body));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("tool output could not be serialized", ex);
    }
  }
}
