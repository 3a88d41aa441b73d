package cafe.woden.ircbot.plugin;

/** The named plugin is not loaded. */
public class UnknownPluginException extends RuntimeException {

  public UnknownPluginException(String pluginName) {
    super("No plugin named '" + pluginName + "' is loaded");
  }
}
