package ca.gc.cra.dem.application.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dem.application.port.RemoteFetchPlugin;
import ca.gc.cra.dem.domain.point.PointStream;
import ca.gc.cra.dem.domain.region.Region;
import ca.gc.cra.dem.infrastructure.remote.HttpXyzFetchPlugin;
import ca.gc.cra.dem.infrastructure.remote.PlainHttpXyzFetchPlugin;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RemoteFetchRegistryTest {

  @Test
  void discoverFindsServiceRegisteredPlugins() {
    RemoteFetchRegistry registry = RemoteFetchRegistry.discover();

    assertEquals(Set.of("https", "http"), registry.schemes());
    assertTrue(registry.find("HTTPS").orElseThrow() instanceof HttpXyzFetchPlugin);
    assertTrue(registry.find("http").orElseThrow() instanceof PlainHttpXyzFetchPlugin);
  }

  @Test
  void firstPluginWinsForDuplicateScheme() {
    RemoteFetchPlugin first = new FixedPlugin("Mb");
    RemoteFetchPlugin second = new FixedPlugin("mb");

    RemoteFetchRegistry registry = RemoteFetchRegistry.of(List.of(first, second));

    assertEquals(Set.of("mb"), registry.schemes());
    assertSame(first, registry.find("MB").orElseThrow());
  }

  @Test
  void emptyRegistryFindsNothing() {
    RemoteFetchRegistry registry = RemoteFetchRegistry.empty();

    assertTrue(registry.find("https").isEmpty());
    assertTrue(registry.find(null).isEmpty());
  }

  private static final class FixedPlugin implements RemoteFetchPlugin {
    private final String scheme;

    FixedPlugin(String scheme) {
      this.scheme = scheme;
    }

    @Override
    public String scheme() {
      return scheme;
    }

    @Override
    public PointStream fetch(Region region, Map<String, String> args) {
      throw new UnsupportedOperationException("not fetched in this test");
    }
  }
}
