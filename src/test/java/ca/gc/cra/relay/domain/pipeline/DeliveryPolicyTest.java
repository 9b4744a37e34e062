package ca.gc.cra.relay.domain.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DeliveryPolicyTest {
  private static final ExportResult OK = ExportResult.success("otlp/a", 1, 1_000);
  private static final ExportResult FAILED = ExportResult.failed("otlp/b", 3, 9_000, new IOException("refused"));
  private static final ExportResult ABANDONED = ExportResult.abandoned("otlp/c", 1, 5_000, null);

  @Test
  void atLeastOneNeedsAnySuccess() {
    assertTrue(DeliveryPolicy.AT_LEAST_ONE.isDelivered(List.of(OK, FAILED)));
    assertFalse(DeliveryPolicy.AT_LEAST_ONE.isDelivered(List.of(FAILED, ABANDONED)));
  }

  @Test
  void allRequiredNeedsEverySuccess() {
    assertTrue(DeliveryPolicy.ALL_REQUIRED.isDelivered(List.of(OK, ExportResult.success("otlp/b", 2, 7))));
    assertFalse(DeliveryPolicy.ALL_REQUIRED.isDelivered(List.of(OK, FAILED)));
    assertFalse(DeliveryPolicy.ALL_REQUIRED.isDelivered(List.of(OK, ABANDONED)));
  }

  @Test
  void noResultsIsNeverDelivered() {
    assertFalse(DeliveryPolicy.AT_LEAST_ONE.isDelivered(List.of()));
    assertFalse(DeliveryPolicy.ALL_REQUIRED.isDelivered(List.of()));
  }

  @ParameterizedTest
  @CsvSource({
      "at_least_one, AT_LEAST_ONE",
      "AT-LEAST-ONE, AT_LEAST_ONE",
      "any, AT_LEAST_ONE",
      "all_required, ALL_REQUIRED",
      " all , ALL_REQUIRED"
  })
  void parsesPolicyNames(String raw, DeliveryPolicy expected) {
    assertEquals(expected, DeliveryPolicy.fromString(raw));
  }

  @Test
  void blankDefaultsToAtLeastOneAndUnknownFails() {
    assertEquals(DeliveryPolicy.AT_LEAST_ONE, DeliveryPolicy.fromString(null));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> DeliveryPolicy.fromString("majority"));
    assertEquals("Unknown delivery policy: majority", ex.getMessage());
  }

  @Test
  void outcomeSummarisesResults() {
    DeliveryOutcome outcome = DeliveryOutcome.of("traces", 4, 10, List.of(OK, FAILED, ABANDONED),
        DeliveryPolicy.AT_LEAST_ONE);

    assertTrue(outcome.delivered());
    assertEquals(1, outcome.count(ExportResult.Status.FAILED));
    assertEquals(3, outcome.resultFor("otlp/b").orElseThrow().attempts());
    assertTrue(outcome.resultFor("missing").isEmpty());
  }

  @Test
  void successCannotCarryError() {
    assertThrows(IllegalArgumentException.class,
        () -> new ExportResult("otlp", ExportResult.Status.SUCCESS, 1, 0, new IOException("x")));
  }
}
