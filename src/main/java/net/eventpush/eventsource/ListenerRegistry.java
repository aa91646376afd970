package net.eventpush.eventsource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds the listeners of one {@link EventSource}.
 * <p>
 * Event listeners are kept per event name (case-sensitive), and open listeners in a separate
 * list; in both cases the registration order is the order in which they will be called.
 * Listeners can be added from any thread at any time but never removed.
 * <p>
 * Lookups return a copy taken while holding the lock, so listeners are always called
 * without the lock held, and a listener that registers another listener does not affect
 * the dispatch that is in progress.
 */
final class ListenerRegistry {
  private final Object lock = new Object();
  private final Map<String, List<EventListener>> eventListeners = new HashMap<>();
  private final List<OpenListener> openListeners = new ArrayList<>();

  void addEventListener(String eventName, EventListener listener) {
    if (eventName == null) {
      throw new IllegalArgumentException("eventName must not be null");
    }
    if (listener == null) {
      throw new IllegalArgumentException("listener must not be null");
    }
    synchronized (lock) {
      List<EventListener> list = eventListeners.get(eventName);
      if (list == null) {
        list = new ArrayList<>();
        eventListeners.put(eventName, list);
      }
      list.add(listener);
    }
  }

  void addOpenListener(OpenListener listener) {
    if (listener == null) {
      throw new IllegalArgumentException("listener must not be null");
    }
    synchronized (lock) {
      openListeners.add(listener);
    }
  }

  List<EventListener> eventListeners(String eventName) {
    synchronized (lock) {
      List<EventListener> list = eventListeners.get(eventName);
      return list == null ? Collections.<EventListener>emptyList() : new ArrayList<>(list);
    }
  }

  List<OpenListener> openListeners() {
    synchronized (lock) {
      return new ArrayList<>(openListeners);
    }
  }
}
