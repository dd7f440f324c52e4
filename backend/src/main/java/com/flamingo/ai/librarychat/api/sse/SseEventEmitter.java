package com.flamingo.ai.librarychat.api.sse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.librarychat.api.dto.response.StreamEvent;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes stream events to one response body as server-sent-event records, {@code data:
 * <json>\n\n}.
 *
 * <p>Writes are serialised. Once a terminal event has been written, later events are dropped.
 * {@link #close()} may be called any number of times; it ends writing but leaves the underlying
 * stream to the servlet container.
 */
@Slf4j
public class SseEventEmitter implements AutoCloseable {

  private static final byte[] DATA_PREFIX = "data: ".getBytes(StandardCharsets.UTF_8);
  private static final byte[] RECORD_END = "\n\n".getBytes(StandardCharsets.UTF_8);

  private final OutputStream out;
  private final ObjectMapper objectMapper;

  private boolean terminated;
  private boolean closed;

  public SseEventEmitter(OutputStream out, ObjectMapper objectMapper) {
    this.out = out;
    this.objectMapper = objectMapper;
  }

  /**
   * Sends one event and flushes it to the client.
   *
   * @return false if the event was dropped because the stream had already ended
   * @throws UncheckedIOException if the client connection is gone
   */
  public synchronized boolean send(StreamEvent event) {
    if (closed || terminated) {
      log.debug("Dropping event after stream end: {}", event);
      return false;
    }
    byte[] json;
    try {
      json = objectMapper.writeValueAsBytes(event);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize stream event", e);
    }
    try {
      out.write(DATA_PREFIX);
      out.write(json);
      out.write(RECORD_END);
      out.flush();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write stream event", e);
    }
    if (event.isTerminal()) {
      terminated = true;
    }
    return true;
  }

  public synchronized boolean isTerminated() {
    return terminated;
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      out.flush();
    } catch (IOException e) {
      log.debug("Client gone before final flush: {}", e.getMessage());
    }
  }
}
