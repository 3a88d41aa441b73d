package cafe.woden.ircbot.plugin;

import cafe.woden.ircbot.transport.Transport;

/**
 * Resolves one plugin name to code. Factories are Spring beans, so they carry whatever
 * collaborators their plugin needs beyond the transport and registry.
 */
public interface PluginFactory {

  /** The {@code module.Type} name this factory builds. */
  String pluginName();

  BotPlugin create(String name, Transport transport, PluginRegistry registry);
}
