package io.fantasymcp.mcp_gateway.model;

/** upstream へ cookie として転送する不透明な資格情報。 */
public record UpstreamCredentials(String primarySecret, String secondarySecret, String ownerEmail) {

  public boolean isComplete() {
    return primarySecret != null
        && !primarySecret.isBlank()
        && secondarySecret != null
        && !secondarySecret.isBlank();
  }

  @Override
  public String toString() {
    return "UpstreamCredentials[primarySecret=***, secondarySecret=***, ownerEmail="
        + (ownerEmail == null ? "null" : "***")
        + "]";
  }
}
