package ca.gc.cra.envbind.application.resolve;

/**
 * Where a resolved value came from.
 *
 * @since 0.1.0
 */
public enum ResolutionSource {
  /** Canonical, prefix-qualified key. */
  ENVIRONMENT,
  /** Bare alias key. */
  ALIAS,
  /** Declared default. */
  DEFAULT
}
