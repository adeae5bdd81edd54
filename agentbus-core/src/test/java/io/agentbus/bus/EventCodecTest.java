package io.agentbus.bus;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventCodecTest {

  private final EventCodec codec = new EventCodec();

  @Test
  void preservesEveryField() {
    Event event = Event.builder("document.uploaded")
        .payload(Map.of("path", "/tmp/a.pdf", "pages", 3, "tags", List.of("x", "y")))
        .timestamp(Instant.parse("2026-01-02T03:04:05.678Z"))
        .source("ingest")
        .correlationId("corr-1")
        .metadata(new EventMetadata("2.0", 2, Priority.HIGH, 5000, Map.of("agentId", "a-7")))
        .build();

    Event decoded = codec.decode(codec.encode(event));

    assertEquals(event, decoded);
  }

  @Test
  void writesLowercasePriorityAndTtl() {
    Event event = Event.builder("x")
        .metadata(new EventMetadata(null, 0, Priority.CRITICAL, 250, null))
        .build();

    String json = new String(codec.encode(event), StandardCharsets.UTF_8);

    assertTrue(json.contains("\"priority\":\"critical\""), json);
    assertTrue(json.contains("\"ttl\":250"), json);
    assertTrue(json.contains("\"schemaVersion\":\"1.0\""), json);
  }

  @Test
  void missingMetadataTakesDefaults() {
    String json = "{\"id\":\"01J00000000000000000000000\",\"type\":\"ping\"}";

    Event decoded = codec.decode(json.getBytes(StandardCharsets.UTF_8));

    assertEquals("ping", decoded.type());
    assertEquals(Event.DEFAULT_SOURCE, decoded.source());
    assertEquals(Priority.NORMAL, decoded.metadata().priority());
    assertEquals(0, decoded.metadata().retryCount());
    assertTrue(decoded.payload().isEmpty());
  }

  @Test
  void rejectsMalformedMessages() {
    assertThrows(EventCodec.CodecException.class,
        () -> codec.decode("not json".getBytes(StandardCharsets.UTF_8)));
    assertThrows(EventCodec.CodecException.class,
        () -> codec.decode("[1,2]".getBytes(StandardCharsets.UTF_8)));
    assertThrows(EventCodec.CodecException.class,
        () -> codec.decode("{\"id\":\"1\"}".getBytes(StandardCharsets.UTF_8)));
    assertThrows(EventCodec.CodecException.class,
        () -> codec.decode("{\"id\":\"1\",\"type\":\"t\",\"timestamp\":\"yesterday\"}"
            .getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void unserializablePayloadFailsWithCodecException() {
    Event event = Event.builder("audit.logged").payload(Map.of("at", Instant.now())).build();

    EventCodec.CodecException e = assertThrows(EventCodec.CodecException.class,
        () -> codec.encode(event));
    assertTrue(e.getMessage().contains(event.id()));
  }
}
