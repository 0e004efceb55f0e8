package io.fantasymcp.mcp_gateway.service.tool;

/** ツール引数が解釈できない場合に投げる。ツール結果の isError として呼び出し元へ返る。 */
public class InvalidToolArgumentException extends RuntimeException {

  public InvalidToolArgumentException(String message) {
    super(message);
  }
}
