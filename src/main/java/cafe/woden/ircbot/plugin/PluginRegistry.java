package cafe.woden.ircbot.plugin;

import cafe.woden.ircbot.config.MasterConfigStore;
import cafe.woden.ircbot.config.PluginConfig;
import cafe.woden.ircbot.transport.Transport;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns the loaded plugins: one {@link PluginDescriptor} per name.
 *
 * <p>Names resolve to code through the {@link PluginFactory} beans in the context. All methods
 * are expected to run on the event loop.
 */
@Component
public class PluginRegistry {
  private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

  private static final Pattern PLUGIN_NAME =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_]*\\.[A-Za-z_][A-Za-z0-9_]*");

  private final Transport transport;
  private final MasterConfigStore masterConfig;
  private final Map<String, PluginFactory> factories;
  private final Map<String, PluginDescriptor> loaded = new LinkedHashMap<>();

  public PluginRegistry(
      Transport transport, MasterConfigStore masterConfig, List<PluginFactory> factories) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.masterConfig = Objects.requireNonNull(masterConfig, "masterConfig");

    Map<String, PluginFactory> byName = new LinkedHashMap<>();
    for (PluginFactory f : Objects.requireNonNullElse(factories, List.<PluginFactory>of())) {
      PluginFactory prev = byName.put(f.pluginName(), f);
      if (prev != null) {
        throw new IllegalStateException("Two plugin factories claim '" + f.pluginName() + "'");
      }
    }
    this.factories = Collections.unmodifiableMap(byName);
  }

  /**
   * Resolves, constructs, configures and starts {@code name}.
   *
   * <p>If start fails, everything the instance already hooked onto the transport is removed and
   * the failure propagates; the name stays unregistered.
   */
  public BotPlugin load(String name) {
    String pluginName = Objects.toString(name, "").trim();
    if (!PLUGIN_NAME.matcher(pluginName).matches()) {
      throw new PluginLoadException(
          pluginName, "Plugin names look like module.Type, got '" + pluginName + "'");
    }
    if (loaded.containsKey(pluginName)) {
      throw new PluginLoadException(pluginName, "Plugin '" + pluginName + "' is already loaded");
    }
    PluginFactory factory = factories.get(pluginName);
    if (factory == null) {
      throw new PluginLoadException(pluginName, "No such plugin: '" + pluginName + "'");
    }

    BotPlugin plugin;
    try {
      plugin = factory.create(pluginName, transport, this);
      plugin.reload();
    } catch (RuntimeException e) {
      throw new PluginLoadException(
          pluginName, "Could not construct plugin '" + pluginName + "': " + e.getMessage(), e);
    }

    try {
      plugin.start();
    } catch (RuntimeException e) {
      transport.unhookPlugin(plugin);
      throw new PluginLoadException(
          pluginName, "Plugin '" + pluginName + "' failed to start: " + e.getMessage(), e);
    }

    loaded.put(pluginName, new PluginDescriptor(pluginName, plugin));
    List<String> missing = missingDependencies(pluginName);
    if (missing.isEmpty()) {
      log.info("[ircbot] Loaded plugin {}", pluginName);
    } else {
      log.warn("[ircbot] Loaded plugin {} but it is missing {}", pluginName, missing);
    }
    return plugin;
  }

  /** Unregisters {@code name}, unhooks it from the transport, then stops it. */
  public void unload(String name) {
    PluginDescriptor desc = loaded.remove(Objects.toString(name, "").trim());
    if (desc == null) {
      throw new UnknownPluginException(name);
    }
    transport.unhookPlugin(desc.plugin());
    desc.plugin().stop();
    log.info("[ircbot] Unloaded plugin {}", desc.name());
  }

  /**
   * Loads every configured plugin in order. Each load is independent: a failure is logged and the
   * remaining names are still attempted.
   *
   * @return the names that failed to load
   */
  public List<String> loadAll() {
    List<String> failed = new ArrayList<>();
    for (String name : masterConfig.pluginNames()) {
      try {
        load(name);
      } catch (RuntimeException e) {
        log.error("[ircbot] Could not load plugin {}", name, e);
        failed.add(name);
      }
    }
    return List.copyOf(failed);
  }

  /** Signals that {@code name}'s configuration changed. */
  public void reload(String name) {
    plugin(name).orElseThrow(() -> new UnknownPluginException(name)).reload();
  }

  public PluginConfig getPluginConfig(String name) {
    return masterConfig.openPluginConfig(name);
  }

  public Optional<BotPlugin> plugin(String name) {
    PluginDescriptor desc = loaded.get(Objects.toString(name, "").trim());
    return (desc == null) ? Optional.empty() : Optional.of(desc.plugin());
  }

  public boolean isLoaded(String name) {
    return loaded.containsKey(Objects.toString(name, "").trim());
  }

  public List<String> loadedPlugins() {
    return List.copyOf(loaded.keySet());
  }

  public Set<String> availablePlugins() {
    return factories.keySet();
  }

  /** Declared dependencies of a loaded plugin that are not loaded themselves. */
  public List<String> missingDependencies(String name) {
    BotPlugin plugin = plugin(name).orElseThrow(() -> new UnknownPluginException(name));
    List<String> missing = new ArrayList<>();
    for (String dep : plugin.requires()) {
      if (!loaded.containsKey(dep)) missing.add(dep);
    }
    return List.copyOf(missing);
  }

  /** Loaded, started and with every declared dependency present. */
  public boolean isReady(String name) {
    Optional<BotPlugin> plugin = plugin(name);
    return plugin.isPresent()
        && plugin.get().state() == PluginState.STARTED
        && missingDependencies(name).isEmpty();
  }

  /** Unloads everything in reverse load order. */
  @PreDestroy
  public void unloadAll() {
    List<String> names = new ArrayList<>(loaded.keySet());
    Collections.reverse(names);
    for (String name : names) {
      try {
        unload(name);
      } catch (RuntimeException e) {
        log.warn("[ircbot] Error while unloading plugin {}", name, e);
      }
    }
  }
}
