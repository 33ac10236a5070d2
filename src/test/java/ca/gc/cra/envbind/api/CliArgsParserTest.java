package ca.gc.cra.envbind.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"spec=a.B", "prefix= app "});
    assertEquals("a.B", map.get("spec"));
    assertEquals("app", map.get("prefix"));
    assertEquals(List.of("spec", "prefix"), List.copyOf(map.keySet()));
  }

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"yaml=/tmp/a=b.yaml"});
    assertEquals("/tmp/a=b.yaml", map.get("yaml"));
  }

  @Test
  void rejectsBareWords() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertEquals("argument must be key=value (was 'invalid')", ex.getMessage());
  }

  @Test
  void rejectsMalformedNames() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"env-file=x"}));
    assertEquals("invalid argument name: env-file", ex.getMessage());
  }

  @Test
  void rejectsControlCharactersInValues() {
    assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"prefix=a\u0007b"}));
  }

  @Test
  void nullAndBlankArgumentsAreIgnored() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {" ", null}).isEmpty());
  }
}
