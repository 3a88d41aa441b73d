package cafe.woden.ircbot.admin;

/** A time string that {@link TimeSpecParser} does not understand. The message is user-facing. */
public class TimeSpecParseException extends RuntimeException {
  private final String input;

  public TimeSpecParseException(String input) {
    super(TimeSpecParser.NOT_UNDERSTOOD);
    this.input = input;
  }

  public String input() {
    return input;
  }
}
