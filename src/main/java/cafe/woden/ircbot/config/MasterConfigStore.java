package cafe.woden.ircbot.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The master {@code config.json}: the ordered plugin list under {@code core.plugins} plus, for
 * older installs, per-plugin settings inlined under {@code plugin_config}.
 *
 * <p>Inline sections are migrated out into {@code <plugin>.json} the first time a plugin asks for
 * its config; see {@link #openPluginConfig(String)}.
 */
@Component
public class MasterConfigStore {

  private static final Logger log = LoggerFactory.getLogger(MasterConfigStore.class);

  static final String FILE_NAME = "config.json";
  static final String LEGACY_PLUGIN_CONFIG = "plugin_config";

  private final Path configDir;
  private final Path file;
  private final Map<String, Object> doc;

  public MasterConfigStore(BotProperties props) {
    this.configDir = Paths.get(Objects.requireNonNull(props, "props").configDir().trim());
    this.file = configDir.resolve(FILE_NAME);

    try {
      if (!Files.exists(configDir)) {
        Files.createDirectories(configDir);
      } else if (!Files.isDirectory(configDir)) {
        throw new IllegalStateException(
            "The config path should be a directory: '" + configDir + "'");
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Could not create config directory '" + configDir + "'", e);
    }

    if (Files.exists(file)) {
      try {
        this.doc = JsonFiles.readDocument(file);
      } catch (IOException e) {
        throw new ConfigurationUnreadableException(file, e);
      }
    } else {
      this.doc = new LinkedHashMap<>();
      getOrCreateMap(doc, "core").put("plugins", new ArrayList<>(props.defaultPlugins()));
      log.info(
          "[ircbot] Created new master config '{}' with plugins {}", file, props.defaultPlugins());
      save();
    }
  }

  public Path configDir() {
    return configDir;
  }

  public Path file() {
    return file;
  }

  /** The configured plugin names, in load order. */
  public synchronized List<String> pluginNames() {
    Object core = doc.get("core");
    if (!(core instanceof Map<?, ?> coreMap)) return List.of();
    Object plugins = coreMap.get("plugins");
    if (!(plugins instanceof List<?> list)) return List.of();

    List<String> out = new ArrayList<>();
    for (Object o : list) {
      String name = Objects.toString(o, "").trim();
      if (!name.isEmpty()) out.add(name);
    }
    return List.copyOf(out);
  }

  /**
   * Opens the durable config handle for {@code pluginName}.
   *
   * <p>If the plugin has no file of its own yet, one is written from its legacy inline section (or
   * empty). Any inline section is then dropped from the master file, and an emptied
   * {@code plugin_config} map is dropped too. Repeated calls are no-ops beyond reading the file.
   */
  public synchronized PluginConfig openPluginConfig(String pluginName) {
    String name = Objects.requireNonNull(pluginName, "pluginName").trim();
    Path pluginFile = configDir.resolve(name + ".json");

    Map<String, Object> legacy = legacySections();
    try {
      if (!Files.exists(pluginFile)) {
        Map<String, Object> seed = new LinkedHashMap<>();
        Object old = (legacy == null) ? null : legacy.get(name);
        if (old instanceof Map<?, ?> oldMap) {
          for (Map.Entry<?, ?> e : oldMap.entrySet()) {
            seed.put(String.valueOf(e.getKey()), e.getValue());
          }
        }
        JsonFiles.writeDocumentAtomically(pluginFile, seed);
      }

      if (legacy != null) {
        boolean changed = legacy.remove(name) != null;
        if (legacy.isEmpty()) {
          doc.remove(LEGACY_PLUGIN_CONFIG);
          changed = true;
        }
        if (changed) {
          log.info("[ircbot] Migrated inline config of '{}' to '{}'", name, pluginFile);
          save();
        }
      }

      return PluginConfig.open(pluginFile);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not open plugin config '" + pluginFile + "'", e);
    }
  }

  public synchronized void save() {
    try {
      JsonFiles.writeDocumentAtomically(file, doc);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not save master config '" + file + "'", e);
    }
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> legacySections() {
    Object o = doc.get(LEGACY_PLUGIN_CONFIG);
    if (o instanceof Map<?, ?> m) return (Map<String, Object>) m;
    return null;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> getOrCreateMap(Map<String, Object> parent, String key) {
    Object o = parent.get(key);
    if (o instanceof Map<?, ?> m) return (Map<String, Object>) m;
    Map<String, Object> created = new LinkedHashMap<>();
    parent.put(key, created);
    return created;
  }
}
