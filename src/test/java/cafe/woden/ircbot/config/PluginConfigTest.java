package cafe.woden.ircbot.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PluginConfigTest {

  @TempDir Path tempDir;

  @Test
  void changesOnlyReachDiskOnSave() throws Exception {
    Path file = Files.writeString(tempDir.resolve("p.json"), "{}");
    PluginConfig config = PluginConfig.open(file);

    config.put("defaulttime", 300);
    assertFalse(PluginConfig.open(file).containsKey("defaulttime"));

    config.save();
    assertEquals(300.0, PluginConfig.open(file).getSeconds("defaulttime").orElseThrow(), 0.001);
    assertFalse(Files.exists(tempDir.resolve("p.json~")));
  }

  @Test
  void secondsAcceptNumbersAndNumericStrings() throws Exception {
    Path file =
        Files.writeString(
            tempDir.resolve("p.json"),
            "{\"a\":90,\"b\":\"12.5\",\"c\":\"soon\",\"d\":null,\"e\":\" \"}");
    PluginConfig config = PluginConfig.open(file);

    assertEquals(Optional.of(90.0), config.getSeconds("a"));
    assertEquals(Optional.of(12.5), config.getSeconds("b"));
    assertEquals(Optional.empty(), config.getSeconds("c"));
    assertEquals(Optional.empty(), config.getSeconds("d"));
    assertEquals(Optional.empty(), config.getSeconds("e"));
    assertEquals(Optional.empty(), config.getSeconds("missing"));
  }

  @Test
  void listIsCreatedOnceAndStaysLive() throws Exception {
    Path file = Files.writeString(tempDir.resolve("p.json"), "{\"laters\":\"garbage\"}");
    PluginConfig config = PluginConfig.open(file);

    List<Object> laters = config.getOrCreateList("laters");
    assertTrue(laters.isEmpty());
    laters.add(List.of(1.0, "x!*@*", "#a", "-q"));

    assertSame(laters, config.getOrCreateList("laters"));
    config.save();
    assertEquals(1, PluginConfig.open(file).getOrCreateList("laters").size());
  }

  @Test
  void putIfAbsentKeepsExistingValues() throws Exception {
    Path file = Files.writeString(tempDir.resolve("p.json"), "{\"defaulttime\":5}");
    PluginConfig config = PluginConfig.open(file);

    config.putIfAbsent("defaulttime", 900);
    config.putIfAbsent("other", "x");

    assertEquals(5, config.get("defaulttime"));
    assertEquals("x", config.get("other"));
    assertEquals("x", config.remove("other"));
    assertFalse(config.containsKey("other"));
  }
}
