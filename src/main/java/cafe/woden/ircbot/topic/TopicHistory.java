package cafe.woden.ircbot.topic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The last few topics seen in one channel, most recent on top.
 *
 * <p>Bounded: pushing beyond {@link #CAPACITY} silently drops the oldest entry.
 */
public final class TopicHistory {
  public static final int CAPACITY = 10;

  private final Deque<String> topics = new ArrayDeque<>(CAPACITY);

  /**
   * Records an observed topic.
   *
   * @return false if it equals the current top, in which case nothing changes
   */
  public boolean push(String topic) {
    Objects.requireNonNull(topic, "topic");
    if (topic.equals(topics.peekFirst())) return false;
    topics.addFirst(topic);
    while (topics.size() > CAPACITY) {
      topics.removeLast();
    }
    return true;
  }

  public Optional<String> top() {
    return Optional.ofNullable(topics.peekFirst());
  }

  public Optional<String> pop() {
    return Optional.ofNullable(topics.pollFirst());
  }

  public int size() {
    return topics.size();
  }

  public boolean isEmpty() {
    return topics.isEmpty();
  }

  /** Snapshot, most recent first. */
  public List<String> list() {
    return List.copyOf(new ArrayList<>(topics));
  }
}
