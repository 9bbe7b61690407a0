package ca.gc.cra.bulk.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class SubscriberRegistryTest {

  @Test
  void snapshotIsUnaffectedByLaterRemoval() {
    SubscriberRegistry registry = new SubscriberRegistry();
    RecordingConsumer first = new RecordingConsumer("first");
    RecordingConsumer second = new RecordingConsumer("second");
    registry.add(first);
    registry.add(second);

    var snapshot = registry.snapshot();
    assertTrue(registry.remove(first));

    assertEquals(List.of(first, second), snapshot);
    assertEquals(List.of(second), registry.snapshot());
  }

  @Test
  void duplicatesAreDetectedByIdentity() {
    SubscriberRegistry registry = new SubscriberRegistry();
    RecordingConsumer consumer = new RecordingConsumer();

    assertTrue(registry.add(consumer));
    assertFalse(registry.add(consumer));
    assertTrue(registry.add(new RecordingConsumer()));
    assertEquals(2, registry.size());
  }

  @Test
  void removingUnknownConsumerReturnsFalse() {
    SubscriberRegistry registry = new SubscriberRegistry();
    assertFalse(registry.remove(new RecordingConsumer()));
  }
}
