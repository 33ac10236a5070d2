package ca.gc.cra.envbind.infrastructure.source;

import ca.gc.cra.envbind.application.port.EnvironmentSource;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Stacks several sources; the first layer holding a key wins.
 *
 * @since 0.1.0
 */
public final class LayeredEnvironmentSource implements EnvironmentSource {

  /**
   * Named layer, highest precedence first.
   *
   * @param name label used in override warnings
   * @param source layer contents
   */
  public record Layer(String name, EnvironmentSource source) {
    public Layer {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(source, "source");
    }
  }

  private final List<Layer> layers;

  private LayeredEnvironmentSource(List<Layer> layers) {
    this.layers = layers;
  }

  /**
   * Stacks layers and reports every key a higher layer overrides.
   *
   * @param layers layers, highest precedence first
   * @param warn receives one message per overridden key; may be {@code null}
   * @return layered source
   */
  public static LayeredEnvironmentSource of(List<Layer> layers, Consumer<String> warn) {
    Objects.requireNonNull(layers, "layers");
    List<Layer> copy = List.copyOf(layers);
    if (warn != null) {
      for (int upper = 0; upper < copy.size(); upper++) {
        Set<String> upperKeys = new TreeSet<>(copy.get(upper).source().keys());
        for (int lower = upper + 1; lower < copy.size(); lower++) {
          Set<String> lowerKeys = copy.get(lower).source().keys();
          for (String key : upperKeys) {
            if (lowerKeys.contains(key)) {
              warn.accept(copy.get(upper).name() + " overrides " + copy.get(lower).name()
                  + " for key: " + key);
            }
          }
        }
      }
    }
    return new LayeredEnvironmentSource(copy);
  }

  @Override
  public Optional<String> lookup(String key) {
    for (Layer layer : layers) {
      Optional<String> value = layer.source().lookup(key);
      if (value.isPresent()) {
        return value;
      }
    }
    return Optional.empty();
  }

  @Override
  public Set<String> keys() {
    Set<String> keys = new LinkedHashSet<>();
    for (Layer layer : layers) {
      keys.addAll(layer.source().keys());
    }
    return keys;
  }
}
