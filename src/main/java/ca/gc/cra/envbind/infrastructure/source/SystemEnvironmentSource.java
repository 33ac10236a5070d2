package ca.gc.cra.envbind.infrastructure.source;

import ca.gc.cra.envbind.application.port.EnvironmentSource;
import java.util.Optional;
import java.util.Set;

/**
 * {@link EnvironmentSource} backed by the process environment.
 *
 * @since 0.1.0
 */
public final class SystemEnvironmentSource implements EnvironmentSource {
  @Override
  public Optional<String> lookup(String key) {
    if (key == null || key.isEmpty()) {
      return Optional.empty();
    }
    return Optional.ofNullable(System.getenv(key));
  }

  @Override
  public Set<String> keys() {
    return Set.copyOf(System.getenv().keySet());
  }
}
