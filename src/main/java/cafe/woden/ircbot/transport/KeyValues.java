package cafe.woden.ircbot.transport;

import java.util.LinkedHashMap;
import java.util.Map;

final class KeyValues {
  private KeyValues() {}

  static Map<String, Object> toMap(Object... keyValues) {
    if (keyValues == null || keyValues.length == 0) return Map.of();
    if (keyValues.length % 2 != 0) {
      throw new IllegalArgumentException("expected alternating keys and values");
    }
    Map<String, Object> out = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      out.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
    }
    return out;
  }
}
