package ca.gc.cra.relay.testutil;

import java.util.Locale;
import java.util.StringJoiner;

/** Hand-written OTLP/JSON requests as clients send them. */
public final class OtlpPayloads {
  private OtlpPayloads() {}

  public static String traces(int spans) {
    StringJoiner items = new StringJoiner(",");
    for (int i = 0; i < spans; i++) {
      items.add(String.format(Locale.ROOT, """
          {"traceId":"%s","spanId":"%s","name":"span-%d","kind":"SPAN_KIND_SERVER",
           "startTimeUnixNano":"1700000000000000000","endTimeUnixNano":"1700000000005000000",
           "status":{"code":"STATUS_CODE_OK"},
           "attributes":[{"key":"http.method","value":{"stringValue":"GET"}}]}""",
          TestSignals.TRACE_ID, TestSignals.spanId(i), i));
    }
    return """
        {"resourceSpans":[{"resource":{"attributes":[{"key":"service.name","value":{"stringValue":"checkout"}}]},
         "scopeSpans":[{"scope":{"name":"io.opentelemetry.test"},"spans":[%s]}]}]}""".formatted(items);
  }

  public static String gauge(String name, double value) {
    return String.format(Locale.ROOT, """
        {"resourceMetrics":[{"resource":{"attributes":[]},"scopeMetrics":[{"metrics":[
         {"name":"%s","unit":"1","gauge":{"dataPoints":[{"timeUnixNano":"1700000000000000000","asDouble":%s}]}}]}]}]}""",
        name, value);
  }

  public static String logs(String body) {
    return """
        {"resourceLogs":[{"resource":{"attributes":[]},"scopeLogs":[{"logRecords":[
         {"timeUnixNano":"1700000000000000000","severityNumber":9,"severityText":"INFO","body":{"stringValue":"%s"}}]}]}]}"""
        .formatted(body);
  }
}
