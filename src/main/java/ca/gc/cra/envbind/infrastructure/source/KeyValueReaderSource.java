package ca.gc.cra.envbind.infrastructure.source;

import ca.gc.cra.envbind.application.port.EnvironmentSource;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> {@link EnvironmentSource} parsed from {@code KEY=VALUE} lines.
 * <p><strong>Role:</strong> Infrastructure adapter for {@code .env}-style files and in-memory buffers.</p>
 * <p><strong>Format:</strong>
 * <ul>
 *   <li>One pair per line, split at the first {@code =}; the key is trimmed, the value kept verbatim.</li>
 *   <li>Blank lines and lines starting with {@code #} are skipped.</li>
 *   <li>{@code \n} and {@code \r\n} line endings are accepted; the last line needs no newline.</li>
 *   <li>A later line for the same key replaces the earlier one.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after parsing.</p>
 *
 * @since 0.1.0
 */
public final class KeyValueReaderSource implements EnvironmentSource {
  private final Map<String, String> values;

  private KeyValueReaderSource(Map<String, String> values) {
    this.values = values;
  }

  /**
   * Parses every line of a reader; the reader is consumed but not closed.
   *
   * @param reader character source
   * @return parsed source
   * @throws IOException when reading fails
   * @throws IllegalArgumentException when a non-blank line has no {@code =} or an empty key
   */
  public static KeyValueReaderSource read(Reader reader) throws IOException {
    Objects.requireNonNull(reader, "reader");
    BufferedReader buffered =
        reader instanceof BufferedReader existing ? existing : new BufferedReader(reader);
    Map<String, String> values = new LinkedHashMap<>();
    String line;
    int lineNumber = 0;
    while ((line = buffered.readLine()) != null) {
      lineNumber++;
      String stripped = line.strip();
      if (stripped.isEmpty() || stripped.startsWith("#")) {
        continue;
      }
      int eq = line.indexOf('=');
      if (eq < 0) {
        throw new IllegalArgumentException("line " + lineNumber + ": expected KEY=VALUE");
      }
      String key = line.substring(0, eq).trim();
      if (key.isEmpty()) {
        throw new IllegalArgumentException("line " + lineNumber + ": empty key");
      }
      values.put(key, line.substring(eq + 1));
    }
    return new KeyValueReaderSource(Map.copyOf(values));
  }

  /**
   * Parses a UTF-8 file.
   *
   * @param path file location
   * @return parsed source
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when a line is malformed; the message names the file
   */
  public static KeyValueReaderSource load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(path + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public Optional<String> lookup(String key) {
    if (key == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(values.get(key));
  }

  @Override
  public Set<String> keys() {
    return values.keySet();
  }
}
