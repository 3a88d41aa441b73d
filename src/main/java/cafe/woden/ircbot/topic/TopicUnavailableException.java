package cafe.woden.ircbot.topic;

/** The current topic of a channel could not be determined in time. */
public class TopicUnavailableException extends RuntimeException {
  private final String channel;

  public TopicUnavailableException(String channel) {
    super("Could not determine current topic of " + channel);
    this.channel = channel;
  }

  public TopicUnavailableException(String channel, Throwable cause) {
    super("Could not determine current topic of " + channel, cause);
    this.channel = channel;
  }

  public String channel() {
    return channel;
  }
}
