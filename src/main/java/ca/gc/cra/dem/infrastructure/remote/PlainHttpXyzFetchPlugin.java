package ca.gc.cra.dem.infrastructure.remote;

/** {@link HttpXyzFetchPlugin} for unencrypted {@code http} URLs. */
public final class PlainHttpXyzFetchPlugin extends HttpXyzFetchPlugin {
  public PlainHttpXyzFetchPlugin() {
    super("http");
  }
}
