package ca.gc.cra.envbind.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesFlagsFromPositionals() {
    CliInput input = CliInput.parse(new String[] {"check", "spec=a.B", "--No-System-Env", "-v"});

    assertArrayEquals(new String[] {"check", "spec=a.B"}, input.keyValueArgs());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.hasFlag("--no-system-env"));
    assertEquals(Set.of("--no-system-env", "--verbose"), input.flags());
  }

  @Test
  void helpAliasesAreNormalized() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"HELP"}).hasFlag("--help"));
    assertTrue(CliInput.parse(new String[] {"--debug"}).verbose());
  }

  @Test
  void dashedValuesWithEqualsArePositional() {
    CliInput input = CliInput.parse(new String[] {"-x=1"});

    assertArrayEquals(new String[] {"-x=1"}, input.keyValueArgs());
    assertTrue(input.flags().isEmpty());
  }

  @Test
  void emptyInput() {
    CliInput input = CliInput.parse(null);

    assertEquals(0, input.keyValueArgs().length);
    assertFalse(input.help());
    assertFalse(input.verbose());
  }
}
