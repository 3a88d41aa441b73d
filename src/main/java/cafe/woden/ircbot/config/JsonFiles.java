package cafe.woden.ircbot.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/** JSON document helpers shared by the master and per-plugin config stores. */
final class JsonFiles {
  private static final ObjectMapper JSON =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
  private static final TypeReference<LinkedHashMap<String, Object>> DOC_TYPE =
      new TypeReference<>() {};

  private JsonFiles() {}

  static Map<String, Object> readDocument(Path file) throws IOException {
    Map<String, Object> doc = JSON.readValue(file.toFile(), DOC_TYPE);
    return (doc == null) ? new LinkedHashMap<>() : doc;
  }

  /** Writes {@code doc} to {@code file~} and moves it over {@code file} in one step. */
  static void writeDocumentAtomically(Path file, Map<String, Object> doc) throws IOException {
    Path parent = file.getParent();
    if (parent != null && !Files.exists(parent)) {
      Files.createDirectories(parent);
    }
    Path tmp = file.resolveSibling(file.getFileName() + "~");
    JSON.writeValue(tmp.toFile(), doc);
    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
  }
}
