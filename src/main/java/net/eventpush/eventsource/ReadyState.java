package net.eventpush.eventsource;

/**
 * Enum values that can be returned by {@link EventSource#getState()}.
 * <p>
 * The state only ever moves forward: {@code CONNECTING}, then {@code OPEN}, then {@code CLOSED}.
 * A stream that ends before its headers are complete goes straight from {@code CONNECTING}
 * to {@code CLOSED}.
 */
public enum ReadyState {
  /**
   * The connection has been made, but the end of the response headers has not yet been read.
   */
  CONNECTING,
  /**
   * The headers have been read and the EventSource is listening for events.
   */
  OPEN,
  /**
   * The connection has been closed, either by {@link EventSource#close()} or because the
   * stream ended. It will not reconnect.
   */
  CLOSED
}
