package cafe.woden.ircbot.irc;

/** Directory lookup got no answer in time. */
public class WhoisTimeoutException extends RuntimeException {
  private final String nick;

  public WhoisTimeoutException(String nick) {
    super("WHOIS for " + nick + " timed out");
    this.nick = nick;
  }

  public String nick() {
    return nick;
  }
}
