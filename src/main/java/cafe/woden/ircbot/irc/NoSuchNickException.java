package cafe.woden.ircbot.irc;

/** Directory lookup found nobody using the nick. */
public class NoSuchNickException extends RuntimeException {
  private final String nick;

  public NoSuchNickException(String nick) {
    super("No such nick: " + nick);
    this.nick = nick;
  }

  public String nick() {
    return nick;
  }
}
