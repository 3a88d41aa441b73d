package cafe.woden.ircbot.topic;

/** A topic edit named a segment index the current topic does not have. */
public class TopicPositionException extends RuntimeException {
  private final int parts;

  public TopicPositionException(int parts) {
    super("There are only " + parts + " topic parts. Remember indexes start at 0");
    this.parts = parts;
  }

  public int parts() {
    return parts;
  }
}
