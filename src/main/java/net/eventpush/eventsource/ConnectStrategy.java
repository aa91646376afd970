package net.eventpush.eventsource;

import com.launchdarkly.logging.LDLogger;

import java.io.Closeable;
import java.io.InputStream;
import java.net.URI;

import okhttp3.HttpUrl;

/**
 * An abstraction of how {@link EventSource} should obtain an input stream.
 * <p>
 * The stream that a strategy provides must contain the whole response as text lines: the
 * response headers, one blank line, and then the SSE body. {@link EventSource} skips
 * everything up to the first blank line before it starts parsing events.
 * <p>
 * The default implementation is {@link SocketConnectStrategy}, which sends a plain HTTP
 * request over a socket and reads the raw response. {@link HttpConnectStrategy} uses OkHttp
 * instead. To consume a stream from some other source, create your own subclass.
 * <p>
 * Instances of this class should be immutable and not contain any state that is specific
 * to one connection. The {@link ConnectStrategy.Client} that they produce belongs to a
 * single EventSource.
 */
public abstract class ConnectStrategy {
  /**
   * Creates a client instance.
   * <p>
   * This is called once when an EventSource is opened.
   *
   * @param logger the logger belonging to EventSource
   * @return a {@link Client} instance
   */
  public abstract Client createClient(LDLogger logger);

  /**
   * An object provided by {@link ConnectStrategy} that makes the connection for a single
   * {@link EventSource}.
   * <p>
   * The {@link #close()} method is called when the EventSource is closed or its stream
   * ends, and should release anything the client allocated.
   */
  public static abstract class Client implements Closeable {
    /**
     * The return type of {@link ConnectStrategy.Client#connect()}.
     */
    public static class Result {
      private final InputStream inputStream;
      private final URI origin;
      private final Closeable closer;

      /**
       * Creates an instance.
       *
       * @param inputStream see {@link #getInputStream()}
       * @param origin see {@link #getOrigin()}
       * @param closer see {@link #getCloser()}
       */
      public Result(InputStream inputStream, URI origin, Closeable closer) {
        this.inputStream = inputStream;
        this.origin = origin;
        this.closer = closer;
      }

      /**
       * The input stream that {@link EventSource} should read from, starting with the
       * response headers.
       *
       * @return the input stream (must not be null)
       */
      public InputStream getInputStream() {
        return inputStream;
      }

      /**
       * The origin URI that should be included in every {@link MessageEvent}.
       * <p>
       * If this value is null, it defaults to {@link Client#getOrigin()}.
       *
       * @return the stream URI
       */
      public URI getOrigin() {
        return origin;
      }

      /**
       * An object that {@link EventSource} uses to shut the connection down when
       * {@link EventSource#close()} is called. This may be called from any thread, and
       * must cause a read that is blocked on {@link #getInputStream()} to end.
       *
       * @return a Closeable object or null
       */
      public Closeable getCloser() {
        return closer;
      }
    }

    /**
     * Attempts to connect to a stream.
     *
     * @return the result if successful
     * @throws InvalidEndpointException if the endpoint is malformed
     * @throws StreamException if the connection could not be made
     */
    public abstract Result connect() throws StreamException;

    /**
     * Returns the expected URI of the stream, if known.
     *
     * @return the stream URI, or null if the endpoint is not a valid URI
     */
    public abstract URI getOrigin();
  }

  /**
   * Returns the default socket implementation, specifying the endpoint as a string.
   * <p>
   * The string is not validated until the stream is opened, so that a malformed endpoint
   * is reported as an {@link InvalidEndpointException} from {@link EventSource.Builder#open()}.
   *
   * @param endpoint the stream URL
   * @return a configurable {@link SocketConnectStrategy}
   */
  public static SocketConnectStrategy socket(String endpoint) {
    return new SocketConnectStrategy(endpoint);
  }

  /**
   * Returns the default socket implementation, specifying a stream URI.
   *
   * @param uri the stream URI
   * @return a configurable {@link SocketConnectStrategy}
   * @throws IllegalArgumentException if the argument is null
   */
  public static SocketConnectStrategy socket(URI uri) {
    if (uri == null) {
      throw new IllegalArgumentException("URI must not be null");
    }
    return new SocketConnectStrategy(uri.toString());
  }

  /**
   * Returns the OkHttp implementation, specifying the endpoint as a string.
   *
   * @param endpoint the stream URL
   * @return a configurable {@link HttpConnectStrategy}
   */
  public static HttpConnectStrategy http(String endpoint) {
    return new HttpConnectStrategy(endpoint);
  }

  /**
   * Returns the OkHttp implementation, specifying a stream URI.
   *
   * @param uri the stream URI
   * @return a configurable {@link HttpConnectStrategy}
   * @throws IllegalArgumentException if the argument is null
   */
  public static HttpConnectStrategy http(URI uri) {
    if (uri == null) {
      throw new IllegalArgumentException("URI must not be null");
    }
    return new HttpConnectStrategy(uri.toString());
  }

  /**
   * Returns the OkHttp implementation, specifying a stream URL with the OkHttp type
   * {@link HttpUrl}.
   *
   * @param url the stream URL
   * @return a configurable {@link HttpConnectStrategy}
   * @throws IllegalArgumentException if the argument is null
   */
  public static HttpConnectStrategy http(HttpUrl url) {
    if (url == null) {
      throw new IllegalArgumentException("URL must not be null");
    }
    return new HttpConnectStrategy(url.toString());
  }
}
