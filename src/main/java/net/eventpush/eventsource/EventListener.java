package net.eventpush.eventsource;

/**
 * Interface for an object that receives SSE events of one event name.
 * <p>
 * Listeners are registered with {@link EventSource#addEventListener(String, EventListener)} or
 * {@link EventSource#onMessage(EventListener)}. They are called on the EventSource's background
 * thread, one event at a time, in the order the events appeared in the stream.
 */
public interface EventListener {
  /**
   * EventSource calls this method when it has received a complete event whose name matches the
   * one this listener was registered for.
   *
   * @param event the event
   * @throws Exception throwing an exception here will cause it to be logged; other listeners for
   *   the same event are still called
   */
  void onEvent(MessageEvent event) throws Exception;
}
