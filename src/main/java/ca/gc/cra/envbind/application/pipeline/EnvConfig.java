package ca.gc.cra.envbind.application.pipeline;

import ca.gc.cra.envbind.application.coerce.CoercionException;
import ca.gc.cra.envbind.application.coerce.TypeCoercer;
import ca.gc.cra.envbind.application.naming.KeyDeriver;
import ca.gc.cra.envbind.application.port.EnvironmentSource;
import ca.gc.cra.envbind.application.resolve.ResolvedValue;
import ca.gc.cra.envbind.application.resolve.ValueResolver;
import ca.gc.cra.envbind.application.walk.StructureWalker;
import ca.gc.cra.envbind.application.walk.VariableInfo;
import ca.gc.cra.envbind.application.walk.VariableKind;
import ca.gc.cra.envbind.domain.decode.DecoderRegistry;
import ca.gc.cra.envbind.domain.env.EnvironmentSnapshot;
import ca.gc.cra.envbind.domain.failure.ConversionException;
import ca.gc.cra.envbind.domain.failure.EnvConfigException;
import ca.gc.cra.envbind.domain.failure.InvalidSpecificationException;
import ca.gc.cra.envbind.domain.failure.MissingRequiredException;
import ca.gc.cra.envbind.domain.type.FieldDescriptor;
import ca.gc.cra.envbind.domain.type.TypeCatalog;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Binds environment variables onto a caller-owned configuration object.
 * <p><strong>Why:</strong> Single entry point combining the walker, resolver and coercer over one consistent
 * snapshot of an {@link EnvironmentSource}.</p>
 * <p><strong>Role:</strong> Application facade used by libraries and the {@code envbind} CLI.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Capture the source once per call and freeze the decoder registry for that call.</li>
 *   <li>Gather variables first, then resolve, convert and write them in traversal order.</li>
 *   <li>Stop at the first failure; fields written before it keep their values.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe to share across threads for distinct target objects.</p>
 * <p><strong>Observability:</strong> Logs at DEBUG where each value came from; values are never logged.</p>
 *
 * @since 0.1.0
 */
public final class EnvConfig {
  private static final Logger log = LoggerFactory.getLogger(EnvConfig.class);

  private final EnvironmentSource source;
  private final DecoderRegistry registry;
  private final TypeCatalog catalog;
  private final KeyDeriver deriver = new KeyDeriver();
  private final ValueResolver resolver = new ValueResolver();

  /**
   * Creates a binder without ad hoc decoders.
   *
   * @param source environment source; must not be {@code null}
   */
  public EnvConfig(EnvironmentSource source) {
    this(source, DecoderRegistry.empty());
  }

  /**
   * Creates a binder.
   *
   * @param source environment source; must not be {@code null}
   * @param registry ad hoc decoders; read at the start of each call
   */
  public EnvConfig(EnvironmentSource source, DecoderRegistry registry) {
    this(source, registry, new TypeCatalog());
  }

  /**
   * Creates a binder sharing a descriptor cache.
   *
   * @param source environment source; must not be {@code null}
   * @param registry ad hoc decoders; read at the start of each call
   * @param catalog descriptor cache
   */
  public EnvConfig(EnvironmentSource source, DecoderRegistry registry, TypeCatalog catalog) {
    this.source = Objects.requireNonNull(source, "source");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
  }

  /**
   * Populates {@code spec} from the environment.
   *
   * @param prefix key prefix, possibly empty
   * @param spec mutable configuration object
   * @throws EnvConfigException on the first invalid class, missing required key, malformed index or
   *     conversion failure
   */
  public void process(String prefix, Object spec) throws EnvConfigException {
    requireSpec(spec);
    EnvironmentSnapshot snapshot = snapshot();
    TypeCoercer coercer = new TypeCoercer(registry);
    List<VariableInfo> infos = walker(coercer).gather(prefix, spec, snapshot);
    log.debug("Gathered {} variables for {}", infos.size(), spec.getClass().getName());
    for (VariableInfo info : infos) {
      apply(info, snapshot, coercer);
    }
  }

  /**
   * Populates {@code spec}, turning failures into unchecked exceptions.
   *
   * @param prefix key prefix, possibly empty
   * @param spec mutable configuration object
   * @throws IllegalStateException wrapping any {@link EnvConfigException}
   */
  public void mustProcess(String prefix, Object spec) {
    try {
      process(prefix, spec);
    } catch (EnvConfigException ex) {
      throw new IllegalStateException(ex.getMessage(), ex);
    }
  }

  /**
   * Lists the variables {@code spec} reads, without resolving or writing values. Nested objects and
   * indexed list elements are still allocated so that their keys can be listed.
   *
   * @param prefix key prefix, possibly empty
   * @param spec mutable configuration object
   * @return variables in traversal order
   * @throws EnvConfigException when the class is invalid or indexed keys are malformed
   */
  public List<VariableInfo> gather(String prefix, Object spec) throws EnvConfigException {
    requireSpec(spec);
    return walker(new TypeCoercer(registry)).gather(prefix, spec, snapshot());
  }

  /**
   * Lists keys under the prefix that no field of {@code spec} reads, neither as canonical key nor as
   * alias. With an empty prefix every key of the source is considered.
   *
   * @param prefix key prefix, possibly empty
   * @param spec mutable configuration object
   * @return unused keys in sorted order
   * @throws EnvConfigException when the class is invalid or indexed keys are malformed
   */
  public List<String> unused(String prefix, Object spec) throws EnvConfigException {
    requireSpec(spec);
    EnvironmentSnapshot snapshot = snapshot();
    List<VariableInfo> infos = walker(new TypeCoercer(registry)).gather(prefix, spec, snapshot);
    Set<String> used = new HashSet<>();
    for (VariableInfo info : infos) {
      used.add(info.key());
      if (!info.aliasKey().isEmpty()) {
        used.add(info.aliasKey());
      }
    }
    String head = prefix == null || prefix.isEmpty() ? "" : prefix.toUpperCase(Locale.ROOT) + "_";
    Set<String> unused = new TreeSet<>();
    for (String key : snapshot.keys()) {
      if (key.startsWith(head) && !used.contains(key)) {
        unused.add(key);
      }
    }
    return List.copyOf(unused);
  }

  private void apply(VariableInfo info, EnvironmentSnapshot snapshot, TypeCoercer coercer)
      throws EnvConfigException {
    FieldDescriptor field = info.field();
    if (info.kind() == VariableKind.INDEXED_LIST) {
      if (info.elementCount() == 0 && info.metadata().required()) {
        throw new MissingRequiredException(info.keys().reportedKey());
      }
      return;
    }
    Optional<ResolvedValue> resolved = resolver.resolve(
        info.keys(), info.metadata().defaultValue(), info.metadata().required(), snapshot);
    if (resolved.isEmpty()) {
      log.debug("{} not set; leaving {} unchanged", info.key(), field.name());
      return;
    }
    ResolvedValue value = resolved.get();
    if (info.kind() == VariableKind.OPAQUE) {
      log.debug("{} has no conversion for {}; leaving {} unchanged",
          info.key(), field.typeName(), field.name());
      return;
    }
    log.debug("{} resolved from {}", info.key(), value.source());
    Object converted;
    try {
      converted = coercer.coerce(value.value(), field.type());
    } catch (CoercionException ex) {
      throw new ConversionException(
          info.key(), field.name(), field.typeName(), value.value(), ex);
    }
    try {
      field.write(info.target(), converted);
    } catch (IllegalArgumentException ex) {
      throw new ConversionException(
          info.key(), field.name(), field.typeName(), value.value(), ex);
    }
  }

  private StructureWalker walker(TypeCoercer coercer) {
    return new StructureWalker(catalog, deriver, coercer);
  }

  private EnvironmentSnapshot snapshot() {
    Map<String, String> values = new LinkedHashMap<>();
    for (String key : new TreeSet<>(source.keys())) {
      source.lookup(key).ifPresent(value -> values.put(key, value));
    }
    return EnvironmentSnapshot.of(values);
  }

  private static void requireSpec(Object spec) throws InvalidSpecificationException {
    if (spec == null) {
      throw new InvalidSpecificationException("specification must not be null");
    }
  }
}
