package cafe.woden.ircbot.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable, mutable key-value settings of one plugin, backed by {@code <configDir>/<plugin>.json}.
 *
 * <p>Mutations only touch memory until {@link #save()} is called. Instances are confined to the
 * event loop.
 */
public final class PluginConfig {

  private final Path file;
  private final Map<String, Object> data;

  private PluginConfig(Path file, Map<String, Object> data) {
    this.file = file;
    this.data = data;
  }

  public static PluginConfig open(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    return new PluginConfig(file, JsonFiles.readDocument(file));
  }

  public Path file() {
    return file;
  }

  public boolean containsKey(String key) {
    return data.containsKey(key);
  }

  public Object get(String key) {
    return data.get(key);
  }

  public void put(String key, Object value) {
    data.put(key, value);
  }

  public Object remove(String key) {
    return data.remove(key);
  }

  public void putIfAbsent(String key, Object value) {
    data.putIfAbsent(key, value);
  }

  /** Returns the value as a number of seconds, or empty when absent, null or not numeric. */
  public Optional<Double> getSeconds(String key) {
    Object v = data.get(key);
    if (v instanceof Number n) return Optional.of(n.doubleValue());
    if (v instanceof String s && !s.isBlank()) {
      try {
        return Optional.of(Double.parseDouble(s.trim()));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the list stored under {@code key}, creating an empty one if absent or of the wrong
   * type. The returned list is live.
   */
  @SuppressWarnings("unchecked")
  public List<Object> getOrCreateList(String key) {
    Object o = data.get(key);
    if (o instanceof List<?> list) return (List<Object>) list;
    List<Object> created = new ArrayList<>();
    data.put(key, created);
    return created;
  }

  /** Persists the current contents atomically. */
  public void save() {
    try {
      JsonFiles.writeDocumentAtomically(file, data);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not save plugin config '" + file + "'", e);
    }
  }
}
