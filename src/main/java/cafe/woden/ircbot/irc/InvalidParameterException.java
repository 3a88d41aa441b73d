package cafe.woden.ircbot.irc;

/** A mode or target argument the network (or its provider) could not make sense of. */
public class InvalidParameterException extends RuntimeException {
  public InvalidParameterException(String message) {
    super(message);
  }
}
