package cafe.woden.ircbot.irc;

import cafe.woden.ircbot.transport.BotRequest;

/**
 * Names and builders for the requests the bot issues to the protocol side of the bus.
 *
 * <p>Providers of the {@code op.*} requests fail with {@link OperationFailedException} when the
 * network refuses the change and with {@link InvalidParameterException} for malformed arguments.
 */
public final class IrcRequests {
  public static final String OP_BAN = "op.ban";
  public static final String OP_UNBAN = "op.unban";
  public static final String OP_QUIET = "op.quiet";
  public static final String OP_UNQUIET = "op.unquiet";
  public static final String OP_OP = "op.op";
  public static final String OP_DEOP = "op.deop";
  public static final String OP_VOICE = "op.voice";
  public static final String OP_DEVOICE = "op.devoice";
  public static final String OP_KICK = "op.kick";
  public static final String OP_MODE = "op.mode";

  /**
   * Completes with a {@link WhoisReply}; fails with {@link NoSuchNickException} or {@link
   * WhoisTimeoutException}.
   */
  public static final String DIRECTORY_WHOIS = "directory.whois";

  /** Fire-and-forget: the answer arrives later as a {@link IrcEvents#TOPIC_UPDATED} event. */
  public static final String PROTOCOL_FETCH_TOPIC = "protocol.fetchTopic";
  public static final String PROTOCOL_SET_TOPIC = "protocol.setTopic";

  /** Completes with the channel's current mode letters as a string, e.g. {@code "nt"}. */
  public static final String PROTOCOL_QUERY_CHAN_MODE = "protocol.queryChanMode";

  private IrcRequests() {}

  /** One of the channel/target requests ({@code op.ban}, {@code op.voice}, ...). */
  public static BotRequest targeted(String requestName, String channel, String target) {
    return BotRequest.of(requestName, "channel", channel, "target", target);
  }

  public static BotRequest kick(String channel, String target, String reason) {
    return BotRequest.of(OP_KICK, "channel", channel, "target", target, "reason", reason);
  }

  public static BotRequest mode(String channel, String mode, String param) {
    return BotRequest.of(OP_MODE, "channel", channel, "mode", mode, "param", param);
  }

  public static BotRequest whois(String nick) {
    return BotRequest.of(DIRECTORY_WHOIS, "nick", nick);
  }

  public static BotRequest fetchTopic(String channel) {
    return BotRequest.of(PROTOCOL_FETCH_TOPIC, "channel", channel);
  }

  public static BotRequest setTopic(String channel, String topic) {
    return BotRequest.of(PROTOCOL_SET_TOPIC, "channel", channel, "topic", topic);
  }

  public static BotRequest queryChanMode(String channel) {
    return BotRequest.of(PROTOCOL_QUERY_CHAN_MODE, "channel", channel);
  }
}
