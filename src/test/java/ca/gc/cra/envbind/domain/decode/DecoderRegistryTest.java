package ca.gc.cra.envbind.domain.decode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class DecoderRegistryTest {

  @Test
  void registersAndFindsDecoders() throws Exception {
    DecoderRegistry registry = DecoderRegistry.create().register(URI.class, URI::create);

    assertEquals(1, registry.size());
    assertEquals(URI.create("a:b"), registry.find(URI.class).orElseThrow().decode("a:b"));
    assertTrue(registry.find(String.class).isEmpty());
    assertTrue(registry.find(null).isEmpty());
  }

  @Test
  void laterRegistrationReplacesEarlier() throws Exception {
    DecoderRegistry registry = DecoderRegistry.create()
        .register(Integer.class, Integer::valueOf)
        .register(Integer.class, value -> -1);

    assertEquals(-1, registry.find(Integer.class).orElseThrow().decode("5"));
  }

  @Test
  void unregisterAndClear() {
    DecoderRegistry registry = DecoderRegistry.create()
        .register(URI.class, URI::create)
        .register(Integer.class, Integer::valueOf);

    assertTrue(registry.unregister(URI.class));
    assertFalse(registry.unregister(URI.class));
    registry.clear();
    assertEquals(0, registry.size());
  }

  @Test
  void snapshotIsFrozenAndIsolated() {
    DecoderRegistry registry = DecoderRegistry.create().register(URI.class, URI::create);
    DecoderRegistry snapshot = registry.snapshot();

    registry.register(Integer.class, Integer::valueOf);

    assertEquals(1, snapshot.size());
    assertThrows(IllegalStateException.class, () -> snapshot.register(Long.class, Long::valueOf));
    assertSame(snapshot, snapshot.snapshot());
  }

  @Test
  void emptyRegistryIsShared() {
    assertSame(DecoderRegistry.empty(), DecoderRegistry.create().snapshot());
    assertThrows(IllegalStateException.class, () -> DecoderRegistry.empty().clear());
  }

  @Test
  void concurrentRegistrationKeepsEveryEntry() throws Exception {
    DecoderRegistry registry = DecoderRegistry.create();
    List<Class<?>> types = List.of(Integer.class, Long.class, Short.class, Byte.class,
        Double.class, Float.class, URI.class, StringBuilder.class);
    ExecutorService executor = Executors.newFixedThreadPool(4);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (Class<?> type : types) {
        futures.add(executor.submit(() -> {
          start.await();
          registry.register(type, value -> null);
          return null;
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(5, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertEquals(types.size(), registry.size());
  }
}
