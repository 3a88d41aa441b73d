package cafe.woden.ircbot.config;

import java.nio.file.Path;

/** The master config file exists but could not be parsed. Fatal at startup. */
public class ConfigurationUnreadableException extends RuntimeException {

  private final Path file;

  public ConfigurationUnreadableException(Path file, Throwable cause) {
    super("Could not read bot configuration '" + file + "': " + cause.getMessage(), cause);
    this.file = file;
  }

  public Path file() {
    return file;
  }
}
