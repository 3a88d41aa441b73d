package cafe.woden.ircbot.topic;

/** Fewer than two topics are known for the channel, so there is no previous one to restore. */
public class NothingToUndoException extends RuntimeException {
  public NothingToUndoException() {
    super("I don't know what the topic used to be. Cannot undo =(");
  }
}
