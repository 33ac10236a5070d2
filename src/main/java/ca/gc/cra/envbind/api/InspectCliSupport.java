package ca.gc.cra.envbind.api;

import ca.gc.cra.envbind.application.port.EnvironmentSource;
import ca.gc.cra.envbind.config.InspectConfig;
import ca.gc.cra.envbind.infrastructure.source.KeyValueReaderSource;
import ca.gc.cra.envbind.infrastructure.source.LayeredEnvironmentSource;
import ca.gc.cra.envbind.infrastructure.source.LayeredEnvironmentSource.Layer;
import ca.gc.cra.envbind.infrastructure.source.SystemEnvironmentSource;
import ca.gc.cra.envbind.infrastructure.source.YamlEnvironmentSource;
import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared plumbing for the inspection commands: option parsing, source layering and loading the
 * configuration class.
 */
final class InspectCliSupport {
  private static final Logger log = LoggerFactory.getLogger(InspectCliSupport.class);

  static final String NO_SYSTEM_ENV_FLAG = "--no-system-env";

  private InspectCliSupport() {
    // Utility class
  }

  /**
   * Parses options, logging the reason and printing the usage line on failure.
   *
   * @param input parsed arguments without the command word
   * @param summaryUsage usage line of the calling command
   * @return options, or empty when the arguments are invalid
   */
  static Optional<InspectConfig> parseConfig(CliInput input, String summaryUsage) {
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      return Optional.of(InspectConfig.fromMap(kv, !input.hasFlag(NO_SYSTEM_ENV_FLAG)));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(summaryUsage);
      return Optional.empty();
    }
  }

  /**
   * Stacks the process environment over the {@code KEY=VALUE} file over the YAML file.
   *
   * @param config options naming the layers
   * @return layered source
   * @throws IOException when a file cannot be read
   * @throws IllegalArgumentException when a file is malformed
   */
  static EnvironmentSource buildSource(InspectConfig config) throws IOException {
    List<Layer> layers = new ArrayList<>();
    if (config.includeSystemEnv()) {
      layers.add(new Layer("environment", new SystemEnvironmentSource()));
    }
    if (config.envFile().isPresent()) {
      Path envFile = config.envFile().get();
      layers.add(new Layer("envFile", KeyValueReaderSource.load(envFile)));
    }
    if (config.yamlFile().isPresent()) {
      Path yaml = config.yamlFile().get();
      Optional<YamlEnvironmentSource> source = YamlEnvironmentSource.load(yaml);
      if (source.isPresent()) {
        layers.add(new Layer("yaml", source.get()));
      } else {
        log.warn("YAML file {} disappeared before it could be read; skipping", yaml);
      }
    }
    log.debug("Layering {} environment sources", layers.size());
    return LayeredEnvironmentSource.of(layers, log::warn);
  }

  /**
   * Loads the configuration class and allocates a fresh instance.
   *
   * @param className fully qualified class name
   * @return new instance
   * @throws ReflectiveOperationException when the class is missing or cannot be instantiated
   */
  static Object instantiate(String className) throws ReflectiveOperationException {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    Class<?> type = Class.forName(className, true,
        loader != null ? loader : InspectCliSupport.class.getClassLoader());
    Constructor<?> constructor = type.getDeclaredConstructor();
    constructor.setAccessible(true);
    try {
      return constructor.newInstance();
    } catch (InvocationTargetException ex) {
      throw new InstantiationException(
          className + " constructor failed: " + ex.getCause());
    }
  }
}
