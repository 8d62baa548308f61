package ca.gc.cra.dem.application.catalog;

import ca.gc.cra.dem.application.port.RemoteFetchPlugin;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remote fetch plugins keyed by scheme.
 *
 * <p>Immutable once built. When two plugins claim the same scheme the first one registered wins and the
 * other is logged and ignored.</p>
 *
 * @since 0.1.0
 */
public final class RemoteFetchRegistry {
  private static final Logger log = LoggerFactory.getLogger(RemoteFetchRegistry.class);

  private final Map<String, RemoteFetchPlugin> plugins;

  private RemoteFetchRegistry(Map<String, RemoteFetchPlugin> plugins) {
    this.plugins = Map.copyOf(plugins);
  }

  /**
   * Discovers plugins declared in {@code META-INF/services}.
   *
   * @return registry of discovered plugins
   */
  public static RemoteFetchRegistry discover() {
    Map<String, RemoteFetchPlugin> found = new LinkedHashMap<>();
    for (RemoteFetchPlugin plugin : ServiceLoader.load(RemoteFetchPlugin.class)) {
      register(found, plugin);
    }
    log.debug("Discovered remote fetch schemes {}", found.keySet());
    return new RemoteFetchRegistry(found);
  }

  /**
   * Builds a registry from explicit plugins.
   *
   * @param plugins plugins to register
   * @return registry
   */
  public static RemoteFetchRegistry of(Collection<? extends RemoteFetchPlugin> plugins) {
    Objects.requireNonNull(plugins, "plugins");
    Map<String, RemoteFetchPlugin> found = new LinkedHashMap<>();
    for (RemoteFetchPlugin plugin : plugins) {
      register(found, plugin);
    }
    return new RemoteFetchRegistry(found);
  }

  /** Registry without plugins. */
  public static RemoteFetchRegistry empty() {
    return new RemoteFetchRegistry(Map.of());
  }

  private static void register(Map<String, RemoteFetchPlugin> target, RemoteFetchPlugin plugin) {
    String scheme = plugin.scheme().toLowerCase(Locale.ROOT);
    RemoteFetchPlugin previous = target.putIfAbsent(scheme, plugin);
    if (previous != null) {
      log.warn("Ignoring {} for scheme '{}'; already served by {}", plugin.getClass().getName(), scheme,
          previous.getClass().getName());
    }
  }

  /**
   * Finds the plugin serving {@code scheme}.
   *
   * @param scheme scheme, any case
   * @return plugin, or empty when none is registered
   */
  public Optional<RemoteFetchPlugin> find(String scheme) {
    if (scheme == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(plugins.get(scheme.toLowerCase(Locale.ROOT)));
  }

  public Set<String> schemes() {
    return plugins.keySet();
  }
}
