package io.campaign.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AbTestTest {

  private static AbTest test(double splitRatio) {
    return new AbTest("t-1", "c-1", "Hello A", "Hello B", splitRatio,
        List.of("delivery_rate"), AbTestStatus.ACTIVE, null, Instant.EPOCH, null);
  }

  @Test
  void assignmentIsDeterministic() {
    AbTest test = test(0.5);

    for (int i = 0; i < 100; i++) {
      String recipient = "recipient-" + i;
      assertEquals(test.assign(recipient), test.assign(recipient));
    }
  }

  @Test
  void evenSplitUsesBothArms() {
    AbTest test = test(0.5);
    int a = 0;
    for (int i = 0; i < 2000; i++) {
      if (test.assign("recipient-" + i) == Variant.A) {
        a++;
      }
    }

    assertTrue(a > 800 && a < 1200, "variant A got " + a + " of 2000");
  }

  @Test
  void extremeSplitsFavorOneArm() {
    AbTest mostlyA = test(0.9999);
    AbTest mostlyB = test(0.0001);
    int a = 0;
    int b = 0;
    for (int i = 0; i < 500; i++) {
      if (mostlyA.assign("r" + i) == Variant.A) a++;
      if (mostlyB.assign("r" + i) == Variant.B) b++;
    }

    assertTrue(a >= 495, "variant A got " + a);
    assertTrue(b >= 495, "variant B got " + b);
  }

  @Test
  void contentFollowsVariant() {
    AbTest test = test(0.5);

    assertEquals("Hello A", test.contentFor(Variant.A));
    assertEquals("Hello B", test.contentFor(Variant.B));
    assertTrue(test.isActive());
  }
}
