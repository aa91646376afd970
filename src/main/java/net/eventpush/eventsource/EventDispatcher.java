package net.eventpush.eventsource;

import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;

/**
 * Calls the listeners in a {@link ListenerRegistry}.
 * <p>
 * Listeners are called synchronously on the calling thread, in registration order. An
 * exception from one listener is logged and does not stop the remaining listeners from
 * being called.
 */
final class EventDispatcher {
  private final ListenerRegistry registry;
  private final LDLogger logger;

  EventDispatcher(ListenerRegistry registry, LDLogger logger) {
    this.registry = registry;
    this.logger = logger;
  }

  /**
   * Passes an event to every listener registered for its event name. If there are none,
   * the event is dropped.
   *
   * @param event the event
   */
  void dispatch(MessageEvent event) {
    for (EventListener listener: registry.eventListeners(event.getEventName())) {
      try {
        listener.onEvent(event);
      } catch (Exception e) {
        logListenerError(e);
      }
    }
  }

  void dispatchOpen() {
    for (OpenListener listener: registry.openListeners()) {
      try {
        listener.onOpen();
      } catch (Exception e) {
        logListenerError(e);
      }
    }
  }

  private void logListenerError(Exception e) {
    logger.warn("Caught unexpected error from listener: {}", LogValues.exceptionSummary(e));
    logger.debug(LogValues.exceptionTrace(e));
  }
}
