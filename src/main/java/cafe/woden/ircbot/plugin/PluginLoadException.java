package cafe.woden.ircbot.plugin;

/** A plugin could not be resolved, constructed or started. Nothing was registered. */
public class PluginLoadException extends RuntimeException {

  private final String pluginName;

  public PluginLoadException(String pluginName, String message) {
    super(message);
    this.pluginName = pluginName;
  }

  public PluginLoadException(String pluginName, String message, Throwable cause) {
    super(message, cause);
    this.pluginName = pluginName;
  }

  public String pluginName() {
    return pluginName;
  }
}
