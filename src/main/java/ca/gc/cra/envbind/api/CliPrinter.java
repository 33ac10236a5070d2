package ca.gc.cra.envbind.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Collection;

/**
 * Console output for command results.
 *
 * <p>Writes to the native stdout descriptor so command output stays separate from log output,
 * which Logback sends to stderr. Tests swap the writer through {@link #setWriterForTesting}.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /** Renders command output onto a writer owned by {@link CliPrinter}. */
  @FunctionalInterface
  interface Rendering {
    void renderTo(Writer out) throws IOException;
  }

  /**
   * Prints a single line.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints each entry on its own line; an empty collection prints nothing.
   *
   * @param lines lines to emit
   */
  static void printLines(Collection<String> lines) {
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
    writer.flush();
  }

  /**
   * Lets a renderer write straight to the console, then flushes.
   *
   * @param rendering output producer
   * @throws IOException when the renderer fails or the console rejects the output
   */
  static void render(Rendering rendering) throws IOException {
    PrintWriter writer = writer();
    rendering.renderTo(writer);
    writer.flush();
    if (writer.checkError()) {
      throw new IOException("console output failed");
    }
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
