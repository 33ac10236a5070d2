package ca.gc.cra.envbind.application.walk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.envbind.application.coerce.TypeCoercer;
import ca.gc.cra.envbind.application.naming.KeyDeriver;
import ca.gc.cra.envbind.domain.decode.DecoderRegistry;
import ca.gc.cra.envbind.domain.env.EnvironmentSnapshot;
import ca.gc.cra.envbind.domain.failure.InvalidSpecificationException;
import ca.gc.cra.envbind.domain.type.TypeCatalog;
import ca.gc.cra.envbind.testutil.SampleConfigs.ClusterConfig;
import ca.gc.cra.envbind.testutil.SampleConfigs.Database;
import ca.gc.cra.envbind.testutil.SampleConfigs.NestedConfig;
import ca.gc.cra.envbind.testutil.SampleConfigs.Node;
import ca.gc.cra.envbind.testutil.SampleConfigs.JdkValueConfig;
import ca.gc.cra.envbind.testutil.SampleConfigs.OpaqueConfig;
import ca.gc.cra.envbind.testutil.SampleConfigs.OptionalNestedConfig;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class StructureWalkerTest {
  private final StructureWalker walker = new StructureWalker(
      new TypeCatalog(), new KeyDeriver(), new TypeCoercer(DecoderRegistry.empty()));

  @Test
  void allocatesNestedObjectsAndDerivesTheirKeys() throws Exception {
    NestedConfig config = new NestedConfig();

    List<VariableInfo> infos = walker.gather("app", config, EnvironmentSnapshot.empty());

    assertEquals(List.of("APP_NAME", "APP_DATABASE_HOST", "APP_DATABASE_PORT", "APP_CERT",
        "APP_CACHE_HOST", "APP_CACHE_PORT"), keys(infos));
    assertNotNull(config.database);
    assertNotNull(config.tls);
    assertNotNull(config.cache);
    assertSame(config.database, infos.get(1).target());
  }

  @Test
  void keepsExistingNestedObjects() throws Exception {
    NestedConfig config = new NestedConfig();
    Database existing = new Database();
    config.database = existing;

    walker.gather("app", config, EnvironmentSnapshot.empty());

    assertSame(existing, config.database);
  }

  @Test
  void indexedListRecordsElementCountAndElementKeys() throws Exception {
    ClusterConfig config = new ClusterConfig();
    EnvironmentSnapshot env = EnvironmentSnapshot.of(Map.of(
        "APP_SERVERS_0_HOST", "a", "APP_SERVERS_1_HOST", "b"));

    List<VariableInfo> infos = walker.gather("app", config, env);

    VariableInfo list = infos.get(1);
    assertEquals("APP_SERVERS", list.key());
    assertEquals(VariableKind.INDEXED_LIST, list.kind());
    assertEquals(2, list.elementCount());
    assertEquals(List.of("APP_NAME", "APP_SERVERS",
        "APP_SERVERS_0_HOST", "APP_SERVERS_0_PORT", "APP_SERVERS_0_NAME",
        "APP_SERVERS_1_HOST", "APP_SERVERS_1_PORT", "APP_SERVERS_1_NAME",
        "APP_BACKUPS"), keys(infos));
    assertTrue(infos.get(2).insideSequence());
    assertEquals("", infos.get(4).aliasKey());
    assertEquals(2, config.servers.size());
  }

  @Test
  void emptyIndexedListIsNotAllocated() throws Exception {
    ClusterConfig config = new ClusterConfig();

    List<VariableInfo> infos = walker.gather("app", config, EnvironmentSnapshot.empty());

    assertEquals(0, infos.get(1).elementCount());
    assertEquals(null, config.servers);
  }

  @Test
  void classifiesOpaqueFields() throws Exception {
    List<VariableInfo> infos =
        walker.gather("", new OpaqueConfig(), EnvironmentSnapshot.empty());

    assertTrue(infos.stream().allMatch(info -> info.kind() == VariableKind.OPAQUE));
    assertEquals(List.of("ANYTHING", "CALLBACK", "ENDPOINT", "LINKS"), keys(infos));
  }

  @Test
  void valueClassesAreValues() throws Exception {
    List<VariableInfo> infos =
        walker.gather("app", new JdkValueConfig(), EnvironmentSnapshot.empty());

    assertTrue(infos.stream().allMatch(info -> info.kind() == VariableKind.VALUE));
    assertEquals(List.of("APP_ENDPOINT", "APP_DIR", "APP_SINCE", "APP_DAY", "APP_ID",
        "APP_LINKS", "APP_UNTIL"), keys(infos));
  }

  @Test
  void optionalNestedObjectIsAllocatedAndWalked() throws Exception {
    OptionalNestedConfig config = new OptionalNestedConfig();

    List<VariableInfo> infos = walker.gather("app", config, EnvironmentSnapshot.empty());

    assertEquals(List.of("APP_DATABASE_HOST", "APP_DATABASE_PORT",
        "APP_PLAIN_HOST", "APP_PLAIN_PORT"), keys(infos));
    assertSame(config.database.orElseThrow(), infos.get(0).target());
  }

  @Test
  void rejectsRecursionBeforeTouchingFields() {
    Node node = new Node();

    assertThrows(InvalidSpecificationException.class,
        () -> walker.gather("app", node, EnvironmentSnapshot.empty()));
    assertEquals(null, node.next);
  }

  @Test
  void rejectsNullTarget() {
    assertThrows(InvalidSpecificationException.class,
        () -> walker.gather("app", null, EnvironmentSnapshot.empty()));
  }

  @Test
  void gatheringTwiceYieldsTheSameKeys() throws Exception {
    NestedConfig config = new NestedConfig();

    List<String> first = keys(walker.gather("app", config, EnvironmentSnapshot.empty()));
    List<String> second = keys(walker.gather("app", config, EnvironmentSnapshot.empty()));

    assertEquals(first, second);
    assertFalse(first.isEmpty());
  }

  private static List<String> keys(List<VariableInfo> infos) {
    return infos.stream().map(VariableInfo::key).collect(Collectors.toList());
  }
}
