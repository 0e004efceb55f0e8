package io.fantasymcp.mcp_gateway.service.discovery;

import java.time.Duration;

/** probe 間の待機。テストでは実時間を待たない実装に差し替える。 */
@FunctionalInterface
public interface ProbeDelay {

  void sleep(Duration duration) throws InterruptedException;
}
