package cafe.woden.ircbot.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Process-level bot settings.
 *
 * <p>Example YAML:
 * <pre>
 * ircbot:
 *   config-dir: /var/lib/ircbot
 *   default-plugins:
 *     - admin.ChannelAdmin
 *     - topic.ChannelTopic
 * </pre>
 */
@ConfigurationProperties(prefix = "ircbot")
public record BotProperties(
    /** Directory holding {@code config.json} and one {@code <plugin>.json} per plugin. */
    String configDir,

    /** Plugin list written to a freshly created master config. Ignored once the file exists. */
    List<String> defaultPlugins,

    /** Name of the single event-loop thread. */
    String eventLoopThreadName
) {

  public static final String DEFAULT_CONFIG_DIR =
      System.getProperty("user.home") + "/.config/ircbot";

  public BotProperties {
    if (configDir == null || configDir.isBlank()) {
      configDir = DEFAULT_CONFIG_DIR;
    }
    defaultPlugins = (defaultPlugins == null) ? List.of() : List.copyOf(defaultPlugins);
    if (eventLoopThreadName == null || eventLoopThreadName.isBlank()) {
      eventLoopThreadName = "ircbot-event-loop";
    }
  }
}
