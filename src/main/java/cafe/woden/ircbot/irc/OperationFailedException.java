package cafe.woden.ircbot.irc;

/**
 * The network refused an operator action (no privilege, channel protection, ...). The message is
 * meant for users and is never retried automatically.
 */
public class OperationFailedException extends RuntimeException {
  public OperationFailedException(String message) {
    super(message);
  }

  public OperationFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
