package cafe.woden.ircbot.transport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** A named request with keyword arguments, resolved by the bus to exactly one handler plugin. */
@ValueObject
public record BotRequest(String name, Map<String, Object> args) {
  public BotRequest {
    name = Objects.requireNonNull(name, "name").trim();
    if (name.isEmpty()) throw new IllegalArgumentException("name is blank");
    // LinkedHashMap rather than Map.copyOf: request arguments may legitimately be null.
    args =
        (args == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
  }

  /** Builds a request from alternating key/value arguments. */
  public static BotRequest of(String name, Object... keyValues) {
    return new BotRequest(name, KeyValues.toMap(keyValues));
  }

  public Object arg(String key) {
    return args.get(key);
  }

  /** The argument rendered as a string, or {@code null} if absent. */
  public String string(String key) {
    Object v = args.get(key);
    return (v == null) ? null : String.valueOf(v);
  }
}
