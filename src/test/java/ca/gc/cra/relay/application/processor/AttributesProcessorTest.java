package ca.gc.cra.relay.application.processor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.relay.application.processor.AttributesProcessor.Action;
import ca.gc.cra.relay.application.processor.AttributesProcessor.ActionType;
import ca.gc.cra.relay.domain.signal.Signal;
import ca.gc.cra.relay.domain.signal.SpanSignal;
import ca.gc.cra.relay.testutil.TestSignals;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AttributesProcessorTest {

  @Test
  void appliesActionsInOrder() {
    AttributesProcessor processor = new AttributesProcessor("attributes/env", List.of(
        new Action("deployment.environment", ActionType.INSERT, "prod", null),
        new Action("http.route", ActionType.UPDATE, "/orders/{id}", null),
        new Action("user.email", ActionType.DELETE, null, null),
        new Action("peer", ActionType.UPSERT, null, "net.peer.name")));
    SpanSignal span = TestSignals.span(1, "GET", Map.of(
        "http.route", "/orders/42", "user.email", "a@b.ca", "net.peer.name", "db01"));

    SpanSignal edited = (SpanSignal) processor.process(List.of(span)).get(0);

    assertEquals("prod", edited.attributes().get("deployment.environment"));
    assertEquals("/orders/{id}", edited.attributes().get("http.route"));
    assertFalse(edited.attributes().containsKey("user.email"));
    assertEquals("db01", edited.attributes().get("peer"));
    assertEquals(span.spanId(), edited.spanId());
  }

  @Test
  void insertKeepsExistingAndUpdateSkipsMissing() {
    AttributesProcessor processor = new AttributesProcessor("attributes", List.of(
        new Action("env", ActionType.INSERT, "prod", null),
        new Action("missing", ActionType.UPDATE, "x", null)));
    SpanSignal span = TestSignals.span(1, "GET", Map.of("env", "dev"));

    Signal result = processor.process(List.of(span)).get(0);

    assertSame(span, result, "unchanged signals are passed through");
    assertEquals("dev", result.attributes().get("env"));
  }

  @Test
  void editsLogsAndMetricsToo() {
    AttributesProcessor processor = new AttributesProcessor("attributes", List.of(
        new Action("region", ActionType.UPSERT, "ca-central-1", null)));

    List<Signal> result = processor.process(List.of(TestSignals.log("hi"), TestSignals.gauge("cpu", 0.5)));

    result.forEach(signal -> assertEquals("ca-central-1", signal.attributes().get("region")));
  }

  @Test
  void rejectsIncompleteActions() {
    assertThrows(IllegalArgumentException.class, () -> new Action("k", ActionType.INSERT, null, null));
    assertThrows(IllegalArgumentException.class, () -> new Action(" ", ActionType.DELETE, null, null));
    assertThrows(IllegalArgumentException.class, () -> ActionType.fromString("rename"));
    assertEquals(ActionType.UPSERT, ActionType.fromString("Upsert"));
  }
}
