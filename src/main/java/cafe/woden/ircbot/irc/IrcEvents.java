package cafe.woden.ircbot.irc;

import cafe.woden.ircbot.transport.BotEvent;

/** Event types exchanged with the protocol side of the bus. */
public final class IrcEvents {

  /** Fields: {@code mode} (letter), {@code set} (boolean), {@code arg}, {@code channel}. */
  public static final String MODE_CHANGED = "mode.changed";

  /** Fields: {@code channel}, {@code topic}. */
  public static final String TOPIC_UPDATED = "topic.updated";

  /** Outbound. Fields: {@code target} (channel or nick), {@code message}. */
  public static final String SEND_MESSAGE = "protocol.sendMessage";

  private IrcEvents() {}

  public static BotEvent sendMessage(String target, String message) {
    return BotEvent.of(SEND_MESSAGE, "target", target, "message", message);
  }

  public static BotEvent modeChanged(String channel, char mode, boolean set, String arg) {
    return BotEvent.of(
        MODE_CHANGED, "mode", String.valueOf(mode), "set", set, "arg", arg, "channel", channel);
  }

  public static BotEvent topicUpdated(String channel, String topic) {
    return BotEvent.of(TOPIC_UPDATED, "channel", channel, "topic", topic);
  }
}
