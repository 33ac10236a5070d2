package ca.gc.cra.envbind.domain.env;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class EnvironmentSnapshotTest {

  @Test
  void copiesAndDropsNullEntries() {
    Map<String, String> source = new HashMap<>();
    source.put("A", "1");
    source.put("B", null);
    source.put(null, "2");

    EnvironmentSnapshot snapshot = EnvironmentSnapshot.of(source);
    source.put("C", "3");

    assertEquals(1, snapshot.size());
    assertEquals(Optional.of("1"), snapshot.lookup("A"));
    assertTrue(snapshot.lookup("C").isEmpty());
  }

  @Test
  void blankKeysNeverMatch() {
    EnvironmentSnapshot snapshot = EnvironmentSnapshot.of(Map.of("A", ""));

    assertEquals(Optional.of(""), snapshot.lookup("A"));
    assertTrue(snapshot.lookup("").isEmpty());
    assertTrue(snapshot.lookup(null).isEmpty());
  }

  @Test
  void keysAreReadOnly() {
    EnvironmentSnapshot snapshot = EnvironmentSnapshot.of(Map.of("A", "1"));

    assertThrows(UnsupportedOperationException.class, () -> snapshot.keys().remove("A"));
    assertEquals(0, EnvironmentSnapshot.empty().size());
  }
}
