package cafe.woden.ircbot.plugin;

/** Lifecycle of a plugin instance. Only {@link #STARTED} instances see live traffic. */
public enum PluginState {
  CONSTRUCTED,
  CONFIGURED,
  STARTED,
  STOPPED
}
