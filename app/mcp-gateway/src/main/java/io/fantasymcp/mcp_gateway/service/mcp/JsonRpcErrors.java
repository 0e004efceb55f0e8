package io.fantasymcp.mcp_gateway.service.mcp;

public final class JsonRpcErrors {

  public static final int PARSE_ERROR = -32700;
  public static final int INVALID_REQUEST = -32600;
  public static final int METHOD_NOT_FOUND = -32601;
  public static final int INVALID_PARAMS = -32602;
  // 認証チャレンジ用のサーバー定義コード
  public static final int AUTHENTICATION_REQUIRED = -32001;

  private JsonRpcErrors() {}
}
