package workbench.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reading and writing automaton dumps as JSON.
 */
public final class AutomatonFiles {

  private static final ObjectMapper MAPPER = JsonMapper
    .builder()
    .enable(SerializationFeature.INDENT_OUTPUT)
    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
    .build();

  private AutomatonFiles() {
  }

  /**
   * Write a dump to a file, replacing the file if it exists.
   *
   * @param path destination file
   * @param dump automaton to write
   */
  public static void write(Path path, AutomatonDump dump) throws IOException {
    MAPPER.writerFor(AutomatonDump.class).writeValue(path.toFile(), dump);
  }

  /**
   * Read a dump from a file.
   *
   * @param path source file
   * @return either an {@link NfaDump} or a {@link DfaDump}, depending on the {@code mode} property
   * @throws IOException if the file cannot be read or is not a valid dump
   */
  public static AutomatonDump read(Path path) throws IOException {
    final AutomatonDump dump = MAPPER.readValue(path.toFile(), AutomatonDump.class);
    if (dump == null) {
      throw new IOException("No automaton in " + path);
    }
    return dump;
  }

  public static String toJson(AutomatonDump dump) throws JsonProcessingException {
    return MAPPER.writerFor(AutomatonDump.class).writeValueAsString(dump);
  }

  public static AutomatonDump fromJson(String json) throws JsonProcessingException {
    return MAPPER.readValue(json, AutomatonDump.class);
  }
}
