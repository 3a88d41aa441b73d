package cafe.woden.ircbot.plugin;

import java.util.List;

/** Lifecycle surface every loaded plugin exposes to the {@link PluginRegistry}. */
public interface BotPlugin {

  /** Qualified {@code module.Type} name the plugin was loaded under. */
  String name();

  /**
   * Plugins that must be loaded before this one is usable. Advisory: the registry reports missing
   * ones but never loads them.
   */
  default List<String> requires() {
    return List.of();
  }

  PluginState state();

  /** Re-derives runtime state from the current configuration. */
  void reload();

  /** Hooks the plugin onto the bus. */
  void start();

  /** Unhooks everything {@link #start()} hooked. */
  void stop();
}
