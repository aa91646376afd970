package net.eventpush.eventsource;

import com.launchdarkly.logging.LDLogger;

import java.io.IOException;
import java.net.URI;

/**
 * The SSE parsing state machine.
 * <p>
 * The parser starts in the {@code HEADERS} phase, where every line is skipped until the
 * first blank line, which ends the response headers. That blank line moves it to the
 * {@code BODY} phase and is reported with {@link Sink#streamOpened()}. There is no way back.
 * <p>
 * In the {@code BODY} phase, {@code event} and {@code data} fields accumulate into a pending
 * event, which is reported with {@link Sink#eventReceived(MessageEvent)} when a blank line
 * ends it. Comment lines (starting with a colon) and unknown fields are ignored. Every line
 * shape is accepted; nothing here throws because of malformed input.
 * <p>
 * The parser only runs on the stream worker thread, and calls the sink on that same thread.
 */
final class StreamParser {
  private static final String DATA = "data";
  private static final String EVENT = "event";

  /**
   * Receives the results of parsing.
   */
  interface Sink {
    void streamOpened();

    void eventReceived(MessageEvent event);
  }

  enum Phase {
    HEADERS,
    BODY
  }

  private final FrameReader reader;
  private final URI origin;
  private final Sink sink;
  private final LDLogger logger;

  private Phase phase = Phase.HEADERS;
  private boolean haveEvent;   // true once an "event" or "data" field has been seen in this event
  private String eventName;
  private String data;

  StreamParser(FrameReader reader, URI origin, Sink sink, LDLogger logger) {
    this.reader = reader;
    this.origin = origin;
    this.sink = sink;
    this.logger = logger;
  }

  Phase getPhase() {
    return phase;
  }

  /**
   * Reads and processes lines until the stream ends.
   * <p>
   * This method never returns normally. An event that has not been terminated by a blank
   * line when the stream ends is discarded.
   *
   * @throws StreamClosedByServerException if the stream reached end-of-stream
   * @throws StreamIOException if reading from the stream failed
   */
  void run() throws StreamException {
    while (true) {
      String line;
      try {
        line = reader.readLine();
      } catch (IOException e) {
        throw new StreamIOException(e);
      }
      if (line == null) {
        if (haveEvent) {
          logger.debug("Discarding incomplete event at end of stream");
        }
        throw new StreamClosedByServerException();
      }
      processLine(line);
    }
  }

  void processLine(String line) {
    if (phase == Phase.HEADERS) {
      if (line.isEmpty()) {
        phase = Phase.BODY;
        logger.debug("End of response headers");
        sink.streamOpened();
      } else {
        logger.debug("Skipping header line: {}", line);
      }
      return;
    }

    if (line.isEmpty()) {
      if (haveEvent) {
        MessageEvent event = new MessageEvent(eventName, data, origin);
        resetEvent();
        logger.debug("Received message: {}", event);
        sink.eventReceived(event);
      }
      return;
    }

    if (line.charAt(0) == ':') {
      return; // comment
    }

    int colonPos = line.indexOf(':');
    String fieldName = colonPos < 0 ? line : line.substring(0, colonPos);
    String fieldValue = colonPos < 0 ? "" : trimLeadingWhitespace(line, colonPos + 1);

    switch (fieldName) {
    case EVENT:
      eventName = fieldValue;
      haveEvent = true;
      break;
    case DATA:
      data = fieldValue;
      haveEvent = true;
      break;
    default:
      // Unknown fields are allowed, so that newer servers can add fields. Unlike event and
      // data they do not start an event, so "id: 1" followed by a blank line dispatches
      // nothing, where a client that treats every field line as the start of an event
      // would dispatch an empty message.
    }
  }

  private void resetEvent() {
    haveEvent = false;
    eventName = null;
    data = null;
  }

  private static String trimLeadingWhitespace(String line, int start) {
    int pos = start;
    while (pos < line.length() && Character.isWhitespace(line.charAt(pos))) {
      pos++;
    }
    return line.substring(pos);
  }
}
