package cafe.woden.ircbot.transport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * An event travelling over the bus.
 *
 * <p>{@code type} is a case-sensitive, dot-namespaced tag such as {@code mode.changed}. Fields are
 * an open key/value bag whose shape is a contract between the emitting and consuming plugins.
 */
@ValueObject
public record BotEvent(String type, Map<String, Object> fields) {
  public BotEvent {
    type = Objects.requireNonNull(type, "type").trim();
    if (type.isEmpty()) throw new IllegalArgumentException("type is blank");
    fields =
        (fields == null)
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  /** Builds an event from alternating key/value arguments. */
  public static BotEvent of(String type, Object... keyValues) {
    return new BotEvent(type, KeyValues.toMap(keyValues));
  }

  public Object get(String key) {
    return fields.get(key);
  }

  /** The field rendered as a string, or {@code null} if absent. */
  public String string(String key) {
    Object v = fields.get(key);
    return (v == null) ? null : String.valueOf(v);
  }

  public boolean flag(String key) {
    Object v = fields.get(key);
    if (v instanceof Boolean b) return b;
    return v != null && Boolean.parseBoolean(String.valueOf(v));
  }

  /** A copy of this event with one field added or replaced. Used by middleware. */
  public BotEvent with(String key, Object value) {
    Map<String, Object> copy = new LinkedHashMap<>(fields);
    copy.put(key, value);
    return new BotEvent(type, copy);
  }
}
