package cafe.woden.ircbot.topic;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splitting and joining of {@code |}-separated topics.
 *
 * <p>Positions are 0-based; negative positions count from the end, so {@code -1} is the last
 * segment.
 */
public final class TopicParts {
  public static final String JOINER = " | ";

  private static final Pattern SEPARATOR = Pattern.compile("\\|");

  private TopicParts() {}

  /** Trimmed segments; a blank topic has none. */
  public static List<String> split(String topic) {
    List<String> parts = new ArrayList<>();
    if (topic == null || topic.isBlank()) return parts;
    for (String p : SEPARATOR.split(topic.trim(), -1)) {
      parts.add(p.trim());
    }
    return parts;
  }

  public static String join(List<String> parts) {
    return String.join(JOINER, parts);
  }

  public static String append(String topic, String text) {
    List<String> parts = split(topic);
    parts.add(text.trim());
    return join(parts);
  }

  /** Inserts before {@code pos}; {@code pos == size} appends. */
  public static String insert(String topic, int pos, String text) {
    List<String> parts = split(topic);
    int size = parts.size();
    if (pos < -size || pos > size) throw new TopicPositionException(size);
    parts.add(pos < 0 ? pos + size : pos, text.trim());
    return join(parts);
  }

  public static String replace(String topic, int pos, String text) {
    List<String> parts = split(topic);
    parts.set(existing(parts, pos), text.trim());
    return join(parts);
  }

  public static String remove(String topic, int pos) {
    List<String> parts = split(topic);
    parts.remove(existing(parts, pos));
    return join(parts);
  }

  public static String pop(String topic) {
    return remove(topic, -1);
  }

  private static int existing(List<String> parts, int pos) {
    int size = parts.size();
    if (pos < -size || pos >= size) throw new TopicPositionException(size);
    return pos < 0 ? pos + size : pos;
  }
}
