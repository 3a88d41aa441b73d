package cafe.woden.ircbot.irc;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** The RPL_WHOISUSER part of a WHOIS answer. */
@ValueObject
public record WhoisReply(String nick, String username, String host) {
  public WhoisReply {
    nick = Objects.requireNonNull(nick, "nick").trim();
    username = Objects.requireNonNull(username, "username").trim();
    host = Objects.requireNonNull(host, "host").trim();
  }
}
