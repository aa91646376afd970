package net.eventpush.eventsource;

import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static net.eventpush.eventsource.Helpers.millisFromTimeUnit;
import static net.eventpush.eventsource.ReadyState.CLOSED;
import static net.eventpush.eventsource.ReadyState.CONNECTING;
import static net.eventpush.eventsource.ReadyState.OPEN;

import okhttp3.HttpUrl;

/**
 * The SSE client.
 * <p>
 * An EventSource is created already connected, by {@link #open(String)} or
 * {@link Builder#open()}. From then on a single background thread reads the stream: it
 * skips the response headers, reports the end of the headers to the listeners registered
 * with {@link #onOpen(OpenListener)}, and then passes each complete event to the listeners
 * registered for its event name. Events are delivered one at a time, in stream order, on
 * that background thread.
 * <p>
 * Listeners can be added from any thread at any time. A listener only receives what is
 * dispatched after it was added; nothing is replayed.
 * <pre><code>
 *   EventSource es = EventSource.open("http://localhost:8080/events");
 *   es.onOpen(() -&gt; System.out.println("connected"));
 *   es.onMessage(event -&gt; System.out.println(event.getData()));
 *   es.addEventListener("update", event -&gt; handleUpdate(event.getData()));
 *   // ...
 *   es.close();
 * </code></pre>
 * <p>
 * EventSource does not reconnect. If the stream ends or fails, the background thread stops
 * and {@link #getState()} becomes {@link ReadyState#CLOSED}; no error is reported to the
 * listeners, so callers that need to notice a lost connection should check the state.
 */
public class EventSource implements Closeable {
  /**
   * The default value for {@link Builder#readBufferSize(int)}.
   */
  public static final int DEFAULT_READ_BUFFER_SIZE = 1000;
  /**
   * The default value for {@link Builder#threadBaseName(String)}.
   */
  public static final String DEFAULT_THREAD_BASE_NAME = "EventSource";

  private final LDLogger logger;
  private final URI origin;
  private final ConnectStrategy.Client client;
  private final int readBufferSize;
  private final ListenerRegistry listeners = new ListenerRegistry();
  private final EventDispatcher dispatcher;
  private final ExecutorService streamExecutor;

  // Written by the stream thread (CONNECTING to OPEN, or to CLOSED when the stream ends)
  // and by any thread that calls close().
  private final AtomicReference<ReadyState> readyState = new AtomicReference<>(CONNECTING);
  private final AtomicReference<Closeable> connectionCloser;

  private EventSource(Builder builder, ConnectStrategy.Client client, ConnectStrategy.Client.Result result) {
    this.logger = builder.logger;
    this.client = client;
    this.origin = result.getOrigin() == null ? client.getOrigin() : result.getOrigin();
    this.readBufferSize = builder.readBufferSize;
    this.dispatcher = new EventDispatcher(listeners, logger);
    this.connectionCloser = new AtomicReference<>(result.getCloser());
    this.streamExecutor = Executors.newSingleThreadExecutor(
        makeDaemonThreadFactory("eventpush-eventsource-stream", builder.threadBaseName,
            builder.threadPriority));
  }

  /**
   * Connects to an endpoint using the default configuration, and starts reading the stream
   * on a background thread.
   * <p>
   * This is equivalent to {@code new EventSource.Builder(endpoint).open()}.
   *
   * @param endpoint the stream URL, which must be an absolute HTTP or HTTPS URL
   * @return an EventSource in the {@link ReadyState#CONNECTING} state
   * @throws InvalidEndpointException if the endpoint is malformed
   * @throws StreamException if the connection could not be made
   */
  public static EventSource open(String endpoint) throws StreamException {
    return new Builder(endpoint).open();
  }

  /**
   * Returns the stream URI.
   *
   * @return the stream URI
   */
  public URI getOrigin() {
    return origin;
  }

  /**
   * Returns the logger that this EventSource is using.
   *
   * @return the logger
   * @see Builder#logger(LDLogger)
   */
  public LDLogger getLogger() {
    return logger;
  }

  /**
   * Returns an enum indicating the current status of the connection.
   * <p>
   * Right after the EventSource is opened this is normally {@link ReadyState#CONNECTING},
   * even if the server has already sent data, until the background thread has read the
   * end of the response headers.
   *
   * @return a {@link ReadyState} value
   */
  public ReadyState getState() {
    return readyState.get();
  }

  /**
   * Adds a listener to be called when the response headers have been read and the
   * EventSource becomes {@link ReadyState#OPEN}.
   * <p>
   * Open listeners are called once, in the order they were added, before any event is
   * dispatched. A listener added after that point is never called.
   *
   * @param listener the listener
   * @throws IllegalArgumentException if the listener is null
   */
  public void onOpen(OpenListener listener) {
    listeners.addOpenListener(listener);
  }

  /**
   * Adds a listener for events that have no {@code event} field, or whose event name is
   * {@link MessageEvent#DEFAULT_EVENT_NAME}.
   * <p>
   * This is the same as {@code addEventListener("message", listener)}.
   *
   * @param listener the listener
   * @throws IllegalArgumentException if the listener is null
   */
  public void onMessage(EventListener listener) {
    addEventListener(MessageEvent.DEFAULT_EVENT_NAME, listener);
  }

  /**
   * Adds a listener for events with the specified event name.
   * <p>
   * Event names are case-sensitive. Listeners for the same name are called in the order
   * they were added; events whose name has no listeners are dropped.
   *
   * @param eventName the event name
   * @param listener the listener
   * @throws IllegalArgumentException if either argument is null
   */
  public void addEventListener(String eventName, EventListener listener) {
    listeners.addEventListener(eventName, listener);
  }

  /**
   * Permanently closes the connection.
   * <p>
   * This may be called from any thread, including from a listener. The state becomes
   * {@link ReadyState#CLOSED} immediately, the transport is shut down in both directions,
   * and the background thread stops at its next read. No further events are dispatched,
   * although a listener that is already running is allowed to finish.
   * <p>
   * Calling this method again has no effect.
   */
  @Override
  public void close() {
    ReadyState previousState = readyState.getAndSet(CLOSED);
    if (previousState == CLOSED) {
      return;
    }
    logger.info("Closing EventSource");
    closeConnection();
    streamExecutor.shutdown();
  }

  /**
   * Blocks until the background thread has terminated.
   * <p>
   * This only returns {@code true} after the stream has ended or {@link #close()} has been
   * called.
   *
   * @param timeout maximum time to wait, in whatever time unit is specified by {@code timeUnit}
   * @param timeUnit the time unit, or {@code TimeUnit.MILLISECONDS} if null
   * @return {@code true} if the thread terminated within the timeout, {@code false} otherwise
   * @throws InterruptedException if this thread is interrupted while blocking
   */
  public boolean awaitClosed(long timeout, TimeUnit timeUnit) throws InterruptedException {
    return streamExecutor.awaitTermination(millisFromTimeUnit(timeout, timeUnit), TimeUnit.MILLISECONDS);
  }

  private void start(final InputStream inputStream) {
    streamExecutor.execute(new Runnable() {
      @Override
      public void run() {
        readStream(inputStream);
      }
    });
  }

  private void readStream(InputStream inputStream) {
    logger.debug("Stream thread started");
    StreamParser parser = new StreamParser(
        new FrameReader(inputStream, readBufferSize),
        origin,
        new DispatchingSink(),
        logger
        );
    try {
      parser.run();
    } catch (StreamException e) {
      logStreamEnd(readyState.get() == CLOSED ? new StreamClosedByCallerException() : e);
    } finally {
      // Only this thread reads from the input stream, so it is the one that closes it.
      try {
        inputStream.close();
      } catch (IOException e) {
        logger.debug("Error closing input stream: {}", LogValues.exceptionSummary(e));
      }
      if (readyState.getAndSet(CLOSED) != CLOSED) {
        closeConnection();
      }
      streamExecutor.shutdown();
    }
  }

  private void logStreamEnd(StreamException e) {
    if (e instanceof StreamClosedByCallerException) {
      logger.debug("Stream closed by caller");
    } else if (e instanceof StreamClosedByServerException) {
      logger.info("Stream closed by server");
    } else {
      logger.warn("Stream failed: {}", LogValues.exceptionSummary(e));
    }
  }

  private void closeConnection() {
    Closeable closer = connectionCloser.getAndSet(null);
    if (closer != null) {
      try {
        closer.close();
        logger.debug("Closed connection");
      } catch (IOException e) {
        logger.warn("Unexpected error when closing connection: {}", LogValues.exceptionSummary(e));
      }
    }
    try {
      client.close();
    } catch (IOException e) {
      logger.warn("Unexpected error when closing client: {}", LogValues.exceptionSummary(e));
    }
  }

  private final class DispatchingSink implements StreamParser.Sink {
    @Override
    public void streamOpened() {
      if (!readyState.compareAndSet(CONNECTING, OPEN)) {
        return; // closed while we were reading the headers
      }
      logger.info("Connected to SSE stream");
      dispatcher.dispatchOpen();
    }

    @Override
    public void eventReceived(MessageEvent event) {
      if (readyState.get() == CLOSED) {
        logger.debug("Not dispatching {} because the stream is closed", event);
        return;
      }
      dispatcher.dispatch(event);
    }
  }

  private static ThreadFactory makeDaemonThreadFactory(
      String categoryName,
      String threadBaseName,
      final int threadPriority
      ) {
    final String baseName = categoryName + "[" + threadBaseName + "]";
    final AtomicInteger counter = new AtomicInteger(0);
    return new ThreadFactory() {
      @Override
      public Thread newThread(Runnable r) {
        Thread t = new Thread(r, baseName + "-" + counter.incrementAndGet());
        t.setDaemon(true);
        if (threadPriority > 0) {
          t.setPriority(threadPriority);
        }
        return t;
      }
    };
  }

  /**
   * Builder for configuring and opening an {@link EventSource}.
   */
  public static final class Builder {
    private final ConnectStrategy connectStrategy; // final because it's mandatory, set at constructor time
    private LDLogger logger = LDLogger.none();
    private int readBufferSize = DEFAULT_READ_BUFFER_SIZE;
    private String threadBaseName = DEFAULT_THREAD_BASE_NAME;
    private int threadPriority;

    /**
     * Creates a new builder, specifying how it will connect to a stream.
     * <pre><code>
     *     EventSource es = new EventSource.Builder(
     *       ConnectStrategy.http(myStreamUri)
     *         .header("Authorization", "xyz")
     *         .connectTimeout(10, TimeUnit.SECONDS)
     *     ).open();
     * </code></pre>
     *
     * @param connectStrategy the object that will provide the input stream; must not be null
     * @throws IllegalArgumentException if the argument is null
     */
    public Builder(ConnectStrategy connectStrategy) {
      if (connectStrategy == null) {
        throw new IllegalArgumentException("connectStrategy must not be null");
      }
      this.connectStrategy = connectStrategy;
    }

    /**
     * Creates a new builder that connects with {@link SocketConnectStrategy}, specifying only
     * the stream URL.
     * <p>
     * The endpoint is validated by {@link #open()}, not here.
     *
     * @param endpoint the stream URL
     */
    public Builder(String endpoint) {
      this(ConnectStrategy.socket(endpoint));
    }

    /**
     * Creates a new builder that connects with {@link SocketConnectStrategy}, specifying only
     * the stream URI.
     *
     * @param uri the stream URI
     * @throws IllegalArgumentException if the argument is null
     */
    public Builder(URI uri) {
      this(ConnectStrategy.socket(uri));
    }

    /**
     * Creates a new builder that connects with {@link SocketConnectStrategy}, specifying the
     * stream URL with the OkHttp type {@link HttpUrl}.
     *
     * @param url the stream URL
     * @throws IllegalArgumentException if the argument is null
     */
    public Builder(HttpUrl url) {
      this(ConnectStrategy.socket(url == null ? null : url.uri()));
    }

    /**
     * Specifies a custom logger to receive EventSource logging.
     * <p>
     * This method uses the {@link LDLogger} type from
     * <a href="https://github.com/launchdarkly/java-logging">com.launchdarkly.logging</a>, a
     * facade that provides several logging implementations as well as the option to forward
     * log output to SLF4J or another framework:
     * <pre><code>
     *   builder.logger(LDLogger.withAdapter(Logs.basic(), "EventSource"));
     * </code></pre>
     * <p>
     * If you do not provide a logger, the default is there is no log output.
     *
     * @param logger an {@link LDLogger} implementation, or null for no logging
     * @return the builder
     */
    public Builder logger(LDLogger logger) {
      this.logger = logger == null ? LDLogger.none() : logger;
      return this;
    }

    /**
     * Specifies the size of the buffer that EventSource uses when reading lines from the
     * stream. Lines longer than this are still read correctly, with extra copying.
     *
     * @param readBufferSize the buffer size
     * @return the builder
     * @throws IllegalArgumentException if the size is less than or equal to zero
     * @see EventSource#DEFAULT_READ_BUFFER_SIZE
     */
    public Builder readBufferSize(int readBufferSize) {
      if (readBufferSize <= 0) {
        throw new IllegalArgumentException("readBufferSize must be greater than zero");
      }
      this.readBufferSize = readBufferSize;
      return this;
    }

    /**
     * Sets the name used for the background thread.
     * <p>
     * This is mainly useful when multiple EventSource instances exist within the same process.
     *
     * @param threadBaseName a string to be used in the thread name, or null for
     *   {@link EventSource#DEFAULT_THREAD_BASE_NAME}
     * @return the builder
     */
    public Builder threadBaseName(String threadBaseName) {
      this.threadBaseName = threadBaseName == null ? DEFAULT_THREAD_BASE_NAME : threadBaseName;
      return this;
    }

    /**
     * Specifies the priority of the background thread.
     *
     * @param threadPriority the thread priority, or null to use the default
     * @return the builder
     */
    public Builder threadPriority(Integer threadPriority) {
      this.threadPriority = threadPriority == null ? 0 : threadPriority.intValue();
      return this;
    }

    /**
     * Connects to the stream and starts reading it on a background thread.
     * <p>
     * The connection is made on the calling thread. If it fails, the exception is thrown
     * here and no background thread is started. Otherwise, the returned EventSource is in
     * the {@link ReadyState#CONNECTING} state until the end of the response headers is read.
     *
     * @return the new EventSource
     * @throws InvalidEndpointException if the endpoint is malformed
     * @throws StreamException if the connection could not be made
     */
    public EventSource open() throws StreamException {
      ConnectStrategy.Client client = connectStrategy.createClient(logger);
      ConnectStrategy.Client.Result result;
      try {
        result = client.connect();
      } catch (StreamException e) {
        try {
          client.close();
        } catch (IOException closeError) {
          logger.debug("Error closing client after failed connection: {}",
              LogValues.exceptionSummary(closeError));
        }
        throw e;
      }
      EventSource eventSource = new EventSource(this, client, result);
      eventSource.start(result.getInputStream());
      return eventSource;
    }
  }
}
