package net.eventpush.eventsource;

import java.util.Objects;

/**
 * Base class for all exceptions thrown by {@link EventSource}.
 * <p>
 * Only failures that happen while opening the stream are thrown to the caller:
 * {@link InvalidEndpointException} if the endpoint could not be parsed, and
 * {@link StreamIOException} if the connection could not be made. Once the stream is
 * open, a failure simply ends the background worker and moves the EventSource to
 * {@link ReadyState#CLOSED}; the other subclasses only describe why that happened in
 * the log output.
 */
@SuppressWarnings("serial")
public class StreamException extends Exception {
  /**
   * Base class constructor.
   * @param message the exception message
   */
  protected StreamException(String message) {
    super(message);
  }

  /**
   * Base class constructor.
   * @param cause a wrapped exception
   */
  protected StreamException(Exception cause) {
    super(cause);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    StreamException that = (StreamException) o;
    return Objects.equals(getMessage(), that.getMessage()) &&
        Objects.equals(getCause(), that.getCause());
  }

  @Override
  public int hashCode() {
    return Objects.hash(getMessage(), getCause());
  }
}
