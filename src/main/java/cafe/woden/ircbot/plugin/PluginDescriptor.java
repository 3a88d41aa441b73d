package cafe.woden.ircbot.plugin;

import java.util.Objects;

/**
 * A loaded plugin: its name plus the one live instance registered under it.
 *
 * <p>The plugin's config handle is not kept here. The instance holds it and replaces it on every
 * reload through {@link PluginRegistry#getPluginConfig(String)}, so there is a single handle per
 * loaded name.
 */
public record PluginDescriptor(String name, BotPlugin plugin) {
  public PluginDescriptor {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(plugin, "plugin");
  }
}
