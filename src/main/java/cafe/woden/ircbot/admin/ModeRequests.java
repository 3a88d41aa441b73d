package cafe.woden.ircbot.admin;

import cafe.woden.ircbot.irc.IrcRequests;
import cafe.woden.ircbot.transport.BotRequest;
import java.util.Map;
import java.util.Optional;

/** Maps a {@code +x}/{@code -x} mode spec onto the high-level {@code op.*} request for it. */
public final class ModeRequests {

  private static final Map<String, String> NAMED =
      Map.of(
          "+b", IrcRequests.OP_BAN,
          "-b", IrcRequests.OP_UNBAN,
          "+q", IrcRequests.OP_QUIET,
          "-q", IrcRequests.OP_UNQUIET,
          "+o", IrcRequests.OP_OP,
          "-o", IrcRequests.OP_DEOP,
          "+v", IrcRequests.OP_VOICE,
          "-v", IrcRequests.OP_DEVOICE);

  private ModeRequests() {}

  public static Optional<String> namedRequestFor(String modeSpec) {
    return Optional.ofNullable(NAMED.get(modeSpec));
  }

  /** The named request when the letter is known, otherwise a generic {@code op.mode}. */
  public static BotRequest requestFor(String channel, String modeSpec, String parameter) {
    return namedRequestFor(modeSpec)
        .map(name -> IrcRequests.targeted(name, channel, parameter))
        .orElseGet(() -> IrcRequests.mode(channel, modeSpec, parameter));
  }

  public static BotRequest requestFor(PendingActionKey key) {
    return requestFor(key.channel(), key.modeSpec(), key.parameter());
  }

  /** {@code +x} becomes {@code -x} and vice versa. */
  public static String reverse(String modeSpec) {
    char sign = modeSpec.charAt(0) == '+' ? '-' : '+';
    return sign + modeSpec.substring(1);
  }
}
