/**
 * A client implementation for the
 * <a href="https://html.spec.whatwg.org/multipage/server-sent-events.html#server-sent-events">Server-Sent
 * Events</a> (SSE) protocol that pushes events to listeners.
 * <p>
 * The entry point for using this package is {@link net.eventpush.eventsource.EventSource}.
 */
package net.eventpush.eventsource;
