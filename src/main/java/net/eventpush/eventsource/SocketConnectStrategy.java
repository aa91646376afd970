package net.eventpush.eventsource;

import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.util.concurrent.TimeUnit;

import javax.net.SocketFactory;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;

import static net.eventpush.eventsource.Helpers.UTF8;
import static net.eventpush.eventsource.Helpers.millisFromTimeUnit;

import okhttp3.Headers;
import okhttp3.HttpUrl;

/**
 * The default way for {@link EventSource} to connect: a plain socket carrying a minimal
 * HTTP request.
 * <p>
 * The strategy opens a TCP connection (TLS for {@code https} endpoints) to the endpoint's
 * host and port, writes a {@code GET} request, and gives EventSource the socket's input
 * stream unchanged, so the status line and response headers are part of what EventSource
 * reads. The request uses HTTP/1.0 so that the server does not chunk-encode the body.
 * <p>
 * The class is immutable: each configuration method returns a new modified instance.
 * <pre><code>
 *   EventSource es = new EventSource.Builder(
 *     ConnectStrategy.socket("http://localhost:8080/events")
 *       .header("Authorization", "xyz")
 *       .connectTimeout(3, TimeUnit.SECONDS)
 *     )
 *     .open();
 * </code></pre>
 */
public final class SocketConnectStrategy extends ConnectStrategy {
  /**
   * The default value for {@link #connectTimeout(long, TimeUnit)}: 10 seconds.
   */
  public static final long DEFAULT_CONNECT_TIMEOUT_MILLIS = 10000;

  private static final Headers DEFAULT_HEADERS = new Headers.Builder()
      .add("Accept", "text/event-stream")
      .add("Cache-Control", "no-cache")
      .build();

  final String endpoint; // package-private visibility for tests
  final long connectTimeoutMillis;
  final Headers headers;
  private final SocketFactory socketFactory;

  SocketConnectStrategy(String endpoint) {
    this(endpoint, DEFAULT_CONNECT_TIMEOUT_MILLIS, DEFAULT_HEADERS, null);
  }

  private SocketConnectStrategy(
      String endpoint,
      long connectTimeoutMillis,
      Headers headers,
      SocketFactory socketFactory
      ) {
    this.endpoint = endpoint;
    this.connectTimeoutMillis = connectTimeoutMillis;
    this.headers = headers;
    this.socketFactory = socketFactory;
  }

  @Override
  public ConnectStrategy.Client createClient(LDLogger logger) {
    return new Client(logger);
  }

  /**
   * Specifies the connection timeout.
   *
   * @param connectTimeout the connection timeout, in whatever time unit is specified by
   *   {@code timeUnit}; zero or less means no timeout
   * @param timeUnit the time unit, or {@code TimeUnit.MILLISECONDS} if null
   * @return a new SocketConnectStrategy instance with this property modified
   * @see #DEFAULT_CONNECT_TIMEOUT_MILLIS
   */
  public SocketConnectStrategy connectTimeout(long connectTimeout, TimeUnit timeUnit) {
    return new SocketConnectStrategy(endpoint, millisFromTimeUnit(connectTimeout, timeUnit),
        headers, socketFactory);
  }

  /**
   * Sets a custom header to be included in the request.
   * <p>
   * Any existing header with the same name, including the default {@code Accept} and
   * {@code Cache-Control} headers, is overwritten.
   *
   * @param name the header name
   * @param value the header value
   * @return a new SocketConnectStrategy instance with this property modified
   */
  public SocketConnectStrategy header(String name, String value) {
    return new SocketConnectStrategy(endpoint, connectTimeoutMillis,
        headers.newBuilder().set(name, value).build(), socketFactory);
  }

  /**
   * Specifies the factory used to create the socket.
   * <p>
   * By default, {@link SSLSocketFactory#getDefault()} is used for {@code https} endpoints
   * and {@link SocketFactory#getDefault()} otherwise.
   *
   * @param socketFactory a socket factory, or null to use the default
   * @return a new SocketConnectStrategy instance with this property modified
   */
  public SocketConnectStrategy socketFactory(SocketFactory socketFactory) {
    return new SocketConnectStrategy(endpoint, connectTimeoutMillis, headers, socketFactory);
  }

  // Socket takes an int; anything from 2^31 ms up is pinned to the largest int.
  int connectTimeoutInt() {
    if (connectTimeoutMillis <= 0) {
      return 0;
    }
    return connectTimeoutMillis > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int)connectTimeoutMillis;
  }

  String buildRequest(HttpUrl url) {
    StringBuilder sb = new StringBuilder("GET ").append(url.encodedPath());
    if (url.encodedQuery() != null) {
      sb.append('?').append(url.encodedQuery());
    }
    sb.append(" HTTP/1.0\r\n");
    sb.append("Host: ").append(hostHeader(url)).append("\r\n");
    for (int i = 0; i < headers.size(); i++) {
      sb.append(headers.name(i)).append(": ").append(headers.value(i)).append("\r\n");
    }
    return sb.append("\r\n").toString();
  }

  private static String hostHeader(HttpUrl url) {
    String host = url.host().contains(":") ? "[" + url.host() + "]" : url.host();
    return url.port() == HttpUrl.defaultPort(url.scheme()) ? host : host + ":" + url.port();
  }

  private final class Client extends ConnectStrategy.Client {
    private final LDLogger logger;

    Client(LDLogger logger) {
      this.logger = logger;
    }

    @Override
    public Result connect() throws StreamException {
      HttpUrl url = Endpoints.parse(endpoint);
      logger.debug("Attempting to connect to SSE stream at {}", url);

      Socket socket = null;
      try {
        socket = createSocket(url);
        socket.connect(new InetSocketAddress(url.host(), url.port()), connectTimeoutInt());
        OutputStream out = socket.getOutputStream();
        out.write(buildRequest(url).getBytes(UTF8));
        out.flush();
        return new Result(socket.getInputStream(), url.uri(), new SocketCloser(socket));
      } catch (IOException e) {
        logger.info("Connection failed: {}", LogValues.exceptionSummary(e));
        if (socket != null) {
          try {
            socket.close();
          } catch (IOException closeError) {
            logger.debug("Error closing socket after failed connection: {}",
                LogValues.exceptionSummary(closeError));
          }
        }
        throw new StreamIOException(e);
      }
    }

    private Socket createSocket(HttpUrl url) throws IOException {
      SocketFactory factory = socketFactory != null ? socketFactory :
        url.isHttps() ? SSLSocketFactory.getDefault() : SocketFactory.getDefault();
      Socket socket = factory.createSocket();
      if (socket instanceof SSLSocket) {
        SSLParameters params = ((SSLSocket)socket).getSSLParameters();
        params.setEndpointIdentificationAlgorithm("HTTPS");
        ((SSLSocket)socket).setSSLParameters(params);
      }
      return socket;
    }

    @Override
    public URI getOrigin() {
      return Endpoints.uriOrNull(endpoint);
    }

    @Override
    public void close() {
      // Each connection owns its socket, which is released through its SocketCloser.
    }
  }

  private static final class SocketCloser implements Closeable {
    private final Socket socket;

    SocketCloser(Socket socket) {
      this.socket = socket;
    }

    @Override
    public void close() throws IOException {
      if (socket.isClosed()) {
        return;
      }
      try {
        // TLS sockets do not support half-close; closing them is enough to end a blocked read.
        if (!(socket instanceof SSLSocket)) {
          if (!socket.isInputShutdown()) {
            socket.shutdownInput();
          }
          if (!socket.isOutputShutdown()) {
            socket.shutdownOutput();
          }
        }
      } finally {
        socket.close();
      }
    }
  }
}
