package ca.gc.cra.bulk.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("abc", Strings.requireNonBlank("name", "  abc "));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("name", null));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "a\nb"));
  }

  @Test
  void sanitizeTopicEnforcesKafkaRules() {
    assertEquals("bulk.batches-v1_x", Strings.sanitizeTopic("kafkaTopic", "bulk.batches-v1_x"));
    assertThrows(IllegalArgumentException.class, () -> Strings.sanitizeTopic("kafkaTopic", "bulk/batches"));
    assertThrows(IllegalArgumentException.class, () -> Strings.sanitizeTopic("kafkaTopic", "t".repeat(250)));
  }
}
