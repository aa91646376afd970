package net.eventpush.eventsource;

import java.net.URI;
import java.util.Objects;

/**
 * Event information that is passed to {@link EventListener#onEvent(MessageEvent)}.
 * <p>
 * Instances are immutable, so the same object can safely be handed to every listener that
 * is registered for its event name.
 */
public final class MessageEvent {
  /**
   * The default value of {@link #getEventName()} for all SSE messages that did not have an {@code event}
   * field.
   */
  public static final String DEFAULT_EVENT_NAME = "message";

  private final String eventName;
  private final String data;
  private final URI origin;

  /**
   * Constructs a new instance.
   *
   * @param eventName the event name; if null, {@link #DEFAULT_EVENT_NAME} is used
   * @param data the event data; if null, will be changed to an empty string
   * @param origin the stream endpoint, or null
   */
  public MessageEvent(String eventName, String data, URI origin) {
    this.eventName = eventName == null ? DEFAULT_EVENT_NAME : eventName;
    this.data = data == null ? "" : data;
    this.origin = origin;
  }

  /**
   * Constructs a new instance with no origin.
   *
   * @param eventName the event name; if null, {@link #DEFAULT_EVENT_NAME} is used
   * @param data the event data; if null, will be changed to an empty string
   */
  public MessageEvent(String eventName, String data) {
    this(eventName, data, null);
  }

  /**
   * Constructs a new instance with the default event name and no origin.
   *
   * @param data the event data; if null, will be changed to an empty string
   */
  public MessageEvent(String data) {
    this(null, data, null);
  }

  /**
   * Returns the event name. This is the value of the {@code event} field in the SSE message, or, if
   * there was none, the constant {@link #DEFAULT_EVENT_NAME}.
   *
   * @return the event name
   */
  public String getEventName() {
    return eventName;
  }

  /**
   * Returns the event data: the value of the last {@code data} field in the SSE message.
   *
   * @return the data string, never null
   */
  public String getData() {
    return data;
  }

  /**
   * Returns the endpoint of the stream that produced this event.
   *
   * @return the origin URI, or null if unknown
   */
  public URI getOrigin() {
    return origin;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    MessageEvent that = (MessageEvent) o;
    return eventName.equals(that.eventName) &&
        data.equals(that.data) &&
        Objects.equals(origin, that.origin);
  }

  @Override
  public int hashCode() {
    return Objects.hash(eventName, data, origin);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("MessageEvent(eventName=").append(eventName)
        .append(",data=").append(data);
    if (origin != null) {
      sb.append(",origin=").append(origin);
    }
    return sb.append(")").toString();
  }
}
