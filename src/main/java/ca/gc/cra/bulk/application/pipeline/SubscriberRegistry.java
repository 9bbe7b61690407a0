package ca.gc.cra.bulk.application.pipeline;

import ca.gc.cra.bulk.application.port.BulkConsumer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Registry of consumers subscribed to a {@link BatchEngine}.
 *
 * <p>Mutation and snapshotting share one monitor. A flush works on the list returned by
 * {@link #snapshot()}, so a consumer removed after the snapshot was taken still receives that flush
 * and none after it. The registry holds references only; consumer lifetime belongs to whoever created
 * the consumer.</p>
 */
final class SubscriberRegistry {
  private final Object lock = new Object();
  private final List<BulkConsumer> consumers = new ArrayList<>();

  /**
   * Adds a consumer unless the same instance is already registered.
   *
   * @param consumer consumer to register
   * @return {@code true} if the registry changed
   */
  boolean add(BulkConsumer consumer) {
    Objects.requireNonNull(consumer, "consumer");
    synchronized (lock) {
      if (indexOf(consumer) >= 0) {
        return false;
      }
      return consumers.add(consumer);
    }
  }

  /**
   * Removes a consumer by identity.
   *
   * @param consumer consumer to remove; {@code null} is ignored
   * @return {@code true} if the consumer was registered
   */
  boolean remove(BulkConsumer consumer) {
    if (consumer == null) {
      return false;
    }
    synchronized (lock) {
      int idx = indexOf(consumer);
      if (idx < 0) {
        return false;
      }
      consumers.remove(idx);
      return true;
    }
  }

  List<BulkConsumer> snapshot() {
    synchronized (lock) {
      return List.copyOf(consumers);
    }
  }

  int size() {
    synchronized (lock) {
      return consumers.size();
    }
  }

  private int indexOf(BulkConsumer consumer) {
    for (int i = 0; i < consumers.size(); i++) {
      if (consumers.get(i) == consumer) {
        return i;
      }
    }
    return -1;
  }
}
