package ca.gc.cra.envbind.application.port;

import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Port supplying the key/value pairs a binding pass reads from.
 * <p><strong>Why:</strong> Decouples the binder from {@link System#getenv()} so files, YAML documents and
 * in-memory maps can feed the same traversal.</p>
 * <p><strong>Role:</strong> Application port implemented by infrastructure sources.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Answer exact-key lookups, distinguishing "absent" from "present but empty".</li>
 *   <li>Enumerate every key it can answer for.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations should tolerate concurrent reads; a binding pass copies
 * the source once into an snapshot before traversal.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.envbind.infrastructure.source.SystemEnvironmentSource
 */
public interface EnvironmentSource {
  /**
   * Looks up a value by exact key.
   *
   * @param key environment key; case-sensitive
   * @return value when the key is present, possibly empty
   */
  Optional<String> lookup(String key);

  /**
   * Lists every key this source holds.
   *
   * @return key set; callers must not rely on ordering
   */
  Set<String> keys();
}
