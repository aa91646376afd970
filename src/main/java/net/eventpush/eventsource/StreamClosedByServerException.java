package net.eventpush.eventsource;

/**
 * An exception indicating that the remote end ended the stream.
 * <p>
 * EventSource does not reconnect; the background worker stops and the state becomes
 * {@link ReadyState#CLOSED}.
 */
@SuppressWarnings("serial")
public class StreamClosedByServerException extends StreamException {
  /**
   * Constructs an instance.
   */
  public StreamClosedByServerException() {
    super("Stream closed by server");
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
