package io.fantasymcp.mcp_gateway.service.tool;

import io.fantasymcp.mcp_gateway.model.VerifiedIdentity;
import io.fantasymcp.mcp_gateway.service.StoreCallContext;

/** 認証済みの呼び出し元と、外部ストアへ転送するヘッダ値。 */
public record ToolInvocation(
    VerifiedIdentity identity, String authorizationHeader, String correlationId) {

  public StoreCallContext storeContext() {
    return new StoreCallContext(identity.subjectId(), authorizationHeader, correlationId);
  }
}
