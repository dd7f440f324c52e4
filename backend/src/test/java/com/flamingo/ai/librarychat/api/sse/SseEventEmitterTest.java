package com.flamingo.ai.librarychat.api.sse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.librarychat.api.dto.response.StreamEvent;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SseEventEmitterTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final SseEventEmitter emitter = new SseEventEmitter(out, objectMapper);

  @Test
  @DisplayName("Should frame each event as a data record")
  void shouldFrameEvents() {
    emitter.send(StreamEvent.token("Hello"));
    emitter.send(StreamEvent.token(" world", "B"));

    assertThat(written())
        .isEqualTo(
            "data: {\"token\":\"Hello\"}\n\n"
                + "data: {\"token\":\" world\",\"model\":\"B\"}\n\n");
  }

  @Test
  @DisplayName("Should drop events after a terminal event")
  void shouldDropAfterTerminal() {
    assertThat(emitter.send(StreamEvent.error("boom"))).isTrue();
    assertThat(emitter.send(StreamEvent.done())).isFalse();
    assertThat(emitter.send(StreamEvent.token("late"))).isFalse();

    assertThat(emitter.isTerminated()).isTrue();
    assertThat(written()).isEqualTo("data: {\"error\":\"boom\"}\n\n");
  }

  @Test
  @DisplayName("Should allow repeated close and drop events afterwards")
  void shouldCloseIdempotently() {
    emitter.close();
    emitter.close();

    assertThat(emitter.send(StreamEvent.token("after close"))).isFalse();
    assertThat(written()).isEmpty();
  }

  @Test
  @DisplayName("Should report a lost client connection")
  void shouldWrapWriteFailure() {
    OutputStream broken =
        new OutputStream() {
          @Override
          public void write(int b) throws IOException {
            throw new IOException("Broken pipe");
          }
        };
    SseEventEmitter brokenEmitter = new SseEventEmitter(broken, objectMapper);

    assertThatThrownBy(() -> brokenEmitter.send(StreamEvent.token("x")))
        .isInstanceOf(UncheckedIOException.class)
        .hasRootCauseMessage("Broken pipe");
  }

  private String written() {
    return out.toString(StandardCharsets.UTF_8);
  }
}
