package ca.gc.cra.relay.testutil;

import ca.gc.cra.relay.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double capturing metric usage for assertions. Safe to share with connection threads.
 */
public final class RecordingMetricsPort implements MetricsPort {
  private final Map<String, AtomicInteger> counters = new ConcurrentHashMap<>();
  private final Map<String, List<Long>> observations = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
  }

  @Override
  public void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(value);
  }

  public int count(String key) {
    AtomicInteger counter = counters.get(key);
    return counter == null ? 0 : counter.get();
  }

  public List<Long> observed(String key) {
    return new ArrayList<>(observations.getOrDefault(key, List.of()));
  }

  public long observedSum(String key) {
    return observed(key).stream().mapToLong(Long::longValue).sum();
  }
}
