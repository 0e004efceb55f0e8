package io.fantasymcp.mcp_gateway.model;

/**
 * ツール実行結果。
 *
 * <p>{@code authError} は外部ストアが呼び出し元トークンを拒否したことを示し、プロトコル層で 401 に変換される。
 */
public record ToolCallResult(String content, boolean isError, boolean authError) {

  public static ToolCallResult success(String content) {
    return new ToolCallResult(content, false, false);
  }

  public static ToolCallResult error(String content) {
    return new ToolCallResult(content, true, false);
  }

  public static ToolCallResult authFailure(String content) {
    return new ToolCallResult(content, true, true);
  }
}
