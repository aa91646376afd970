package net.eventpush.eventsource;

/**
 * Interface for an object that is notified once, when the stream's response headers have been
 * read and the EventSource becomes {@link ReadyState#OPEN}.
 *
 * @see EventSource#onOpen(OpenListener)
 */
public interface OpenListener {
  /**
   * EventSource calls this method on its background thread when the connection opens.
   *
   * @throws Exception throwing an exception here will cause it to be logged
   */
  void onOpen() throws Exception;
}
