package ca.gc.cra.envbind.domain.decode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Caller-owned table of ad hoc {@link ValueDecoder}s keyed by exact target type.
 * <p><strong>Why:</strong> Lets applications teach the binder about third-party types without a process-wide
 * registry; each {@code EnvConfig} is handed its own instance.</p>
 * <p><strong>Role:</strong> Domain collaborator consulted by the type coercer before any other rule, and by
 * the structure walker to treat registered nested classes as leaves.</p>
 * <p><strong>Thread-safety:</strong> Copy-on-write. Registration is synchronized and publishes a new
 * immutable table; {@link #snapshot()} hands a traversal a frozen view so registering or clearing during
 * an in-flight pass has no effect on it.</p>
 * <p><strong>Performance:</strong> Lookups are a single hash probe; registration copies the table.</p>
 *
 * @since 0.1.0
 */
public final class DecoderRegistry {
  private static final DecoderRegistry EMPTY = new DecoderRegistry(Map.of(), true);

  private volatile Map<Class<?>, ValueDecoder<?>> decoders;
  private final boolean frozen;

  private DecoderRegistry(Map<Class<?>, ValueDecoder<?>> decoders, boolean frozen) {
    this.decoders = decoders;
    this.frozen = frozen;
  }

  /**
   * Creates an empty, mutable registry.
   *
   * @return new registry
   */
  public static DecoderRegistry create() {
    return new DecoderRegistry(Map.of(), false);
  }

  /**
   * Returns the shared empty, frozen registry.
   *
   * @return registry without decoders
   */
  public static DecoderRegistry empty() {
    return EMPTY;
  }

  /**
   * Registers (or replaces) the decoder for an exact type.
   *
   * @param type target type; boxed and primitive types are registered separately
   * @param decoder decoder producing instances of {@code type}
   * @param <T> target type
   * @return this registry for chaining
   * @throws IllegalStateException when called on a frozen snapshot
   */
  public <T> DecoderRegistry register(Class<T> type, ValueDecoder<? extends T> decoder) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(decoder, "decoder");
    synchronized (this) {
      ensureMutable();
      Map<Class<?>, ValueDecoder<?>> next = new LinkedHashMap<>(decoders);
      next.put(type, decoder);
      decoders = Map.copyOf(next);
    }
    return this;
  }

  /**
   * Removes the decoder for a type, if any.
   *
   * @param type target type
   * @return {@code true} when a decoder was removed
   */
  public boolean unregister(Class<?> type) {
    synchronized (this) {
      ensureMutable();
      if (!decoders.containsKey(type)) {
        return false;
      }
      Map<Class<?>, ValueDecoder<?>> next = new LinkedHashMap<>(decoders);
      next.remove(type);
      decoders = Map.copyOf(next);
      return true;
    }
  }

  /** Removes every registered decoder. */
  public void clear() {
    synchronized (this) {
      ensureMutable();
      decoders = Map.of();
    }
  }

  /**
   * Finds the decoder registered for exactly {@code type}.
   *
   * @param type target type; {@code null} yields empty
   * @return decoder when registered
   */
  public Optional<ValueDecoder<?>> find(Class<?> type) {
    if (type == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(decoders.get(type));
  }

  /**
   * Returns a frozen copy of the current table.
   *
   * @return immutable registry; registering on it throws {@link IllegalStateException}
   */
  public DecoderRegistry snapshot() {
    if (frozen) {
      return this;
    }
    Map<Class<?>, ValueDecoder<?>> current = decoders;
    return current.isEmpty() ? EMPTY : new DecoderRegistry(current, true);
  }

  /**
   * Returns the number of registered decoders.
   *
   * @return decoder count
   */
  public int size() {
    return decoders.size();
  }

  private void ensureMutable() {
    if (frozen) {
      throw new IllegalStateException("decoder registry snapshot is read-only");
    }
  }
}
