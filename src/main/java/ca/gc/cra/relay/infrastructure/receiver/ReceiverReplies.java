package ca.gc.cra.relay.infrastructure.receiver;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Small JSON replies shared by the request/response and stream receivers.
 */
final class ReceiverReplies {
  private static final JsonFactory FACTORY = new JsonFactory();

  private ReceiverReplies() {}

  static byte[] accepted(int count) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(24);
    try (JsonGenerator gen = FACTORY.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeNumberField("accepted", count);
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    return out.toByteArray();
  }

  static byte[] error(String message) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(64);
    try (JsonGenerator gen = FACTORY.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("error", message == null ? "unknown error" : message);
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    return out.toByteArray();
  }
}
