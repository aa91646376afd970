package net.eventpush.eventsource;

/**
 * An exception indicating that the stream stopped because you explicitly closed it.
 * <p>
 * The background worker sees this when {@link EventSource#close()} is called from another
 * thread while it is blocked reading the stream.
 */
@SuppressWarnings("serial")
public class StreamClosedByCallerException extends StreamException {
  /**
   * Constructs an instance.
   */
  public StreamClosedByCallerException() {
    super("Stream closed by client");
  }

  @Override
  public boolean equals(Object o) {
    return o != null && getClass() == o.getClass();
  }

  @Override
  public int hashCode() {
    return 0;
  }
}
