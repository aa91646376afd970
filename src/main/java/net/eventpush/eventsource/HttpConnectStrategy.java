package net.eventpush.eventsource;

import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.net.URI;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

import static net.eventpush.eventsource.Helpers.UTF8;
import static net.eventpush.eventsource.Helpers.timeUnitOrDefault;

import okhttp3.Call;
import okhttp3.ConnectionPool;
import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Connects {@link EventSource} to a stream using OkHttp.
 * <p>
 * OkHttp consumes the response headers itself, so this strategy writes the status line and
 * headers of the response back in front of the body, followed by a blank line. EventSource
 * then reads the same shape of data that {@link SocketConnectStrategy} provides.
 * <p>
 * The class is immutable: each configuration method returns a new modified instance, and
 * an EventSource created with this configuration is not affected by later changes.
 * <pre><code>
 *   EventSource es = new EventSource.Builder(
 *     ConnectStrategy.http("https://example.com/stream")
 *       .header("Authorization", "xyz")
 *       .connectTimeout(3, TimeUnit.SECONDS)
 *     )
 *     .open();
 * </code></pre>
 */
public final class HttpConnectStrategy extends ConnectStrategy {
  /**
   * The default value for {@link #connectTimeout(long, TimeUnit)}: 10 seconds.
   */
  public static final long DEFAULT_CONNECT_TIMEOUT_MILLIS = 10000;
  /**
   * The default value for {@link #writeTimeout(long, TimeUnit)}: 5 seconds.
   */
  public static final long DEFAULT_WRITE_TIMEOUT_MILLIS = 5000;
  /**
   * The default value for {@link #readTimeout(long, TimeUnit)}: zero, meaning that a quiet
   * stream is never timed out.
   */
  public static final long DEFAULT_READ_TIMEOUT_MILLIS = 0;

  private static final Headers DEFAULT_HEADERS = new Headers.Builder()
      .add("Accept", "text/event-stream")
      .add("Cache-Control", "no-cache")
      .build();

  final String endpoint; // package-private visibility for tests
  private final ClientConfigurer clientConfigurer;
  private final OkHttpClient httpClient;
  final Headers headers;

  /**
   * An interface for use with {@link #clientBuilderActions(ClientConfigurer)}.
   */
  public static interface ClientConfigurer {
    /**
     * This method is called with the OkHttp {@link okhttp3.OkHttpClient.Builder}
     * that will be used for the EventSource, allowing you to call any configuration
     * methods you want.
     * @param builder the client builder
     */
    public void configure(OkHttpClient.Builder builder);
  }

  HttpConnectStrategy(String endpoint) {
    this(endpoint, null, null, DEFAULT_HEADERS);
  }

  private HttpConnectStrategy(
      String endpoint,
      ClientConfigurer clientConfigurer,
      OkHttpClient httpClient,
      Headers headers
      ) {
    this.endpoint = endpoint;
    this.clientConfigurer = clientConfigurer;
    this.httpClient = httpClient;
    this.headers = headers;
  }

  @Override
  public ConnectStrategy.Client createClient(LDLogger logger) {
    return new Client(logger);
  }

  // Chains together all actions that affect the HTTP client
  private HttpConnectStrategy addClientConfigurerAction(final ClientConfigurer addedAction) {
    if (addedAction == null) {
      return this;
    }
    ClientConfigurer compositeAction = clientConfigurer == null ? addedAction :
      new ClientConfigurer() {
        @Override
        public void configure(OkHttpClient.Builder builder) {
          clientConfigurer.configure(builder);
          addedAction.configure(builder);
        }
      };
    return new HttpConnectStrategy(endpoint, compositeAction, httpClient, headers);
  }

  /**
   * Specifies any type of configuration actions you want to perform on the
   * OkHttpClient builder.
   * <p>
   * If you call this method multiple times, or use it in combination with other client
   * configuration methods, the actions are performed in the same order as the calls.
   *
   * @param configurer a ClientConfigurer (or lambda) that will act on the HTTP client
   *   builder
   * @return a new HttpConnectStrategy instance with this property modified
   */
  public HttpConnectStrategy clientBuilderActions(ClientConfigurer configurer) {
    return addClientConfigurerAction(configurer);
  }

  /**
   * Specifies the connection timeout.
   *
   * @param connectTimeout the connection timeout, in whatever time unit is specified by
   *   {@code timeUnit}
   * @param timeUnit the time unit, or {@code TimeUnit.MILLISECONDS} if null
   * @return a new HttpConnectStrategy instance with this property modified
   * @see #DEFAULT_CONNECT_TIMEOUT_MILLIS
   */
  public HttpConnectStrategy connectTimeout(final long connectTimeout, final TimeUnit timeUnit) {
    return addClientConfigurerAction(new ClientConfigurer() {
      @Override
      public void configure(OkHttpClient.Builder builder) {
        builder.connectTimeout(connectTimeout, timeUnitOrDefault(timeUnit));
      }
    });
  }

  /**
   * Specifies the read timeout. If a read timeout happens, the stream ends and the
   * {@code EventSource} becomes {@link ReadyState#CLOSED}.
   *
   * @param readTimeout the read timeout, in whatever time unit is specified by {@code timeUnit};
   *   zero means no timeout
   * @param timeUnit the time unit, or {@code TimeUnit.MILLISECONDS} if null
   * @return a new HttpConnectStrategy instance with this property modified
   * @see #DEFAULT_READ_TIMEOUT_MILLIS
   */
  public HttpConnectStrategy readTimeout(final long readTimeout, final TimeUnit timeUnit) {
    return addClientConfigurerAction(new ClientConfigurer() {
      @Override
      public void configure(OkHttpClient.Builder builder) {
        builder.readTimeout(readTimeout, timeUnitOrDefault(timeUnit));
      }
    });
  }

  /**
   * Specifies the write timeout.
   *
   * @param writeTimeout the write timeout, in whatever time unit is specified by {@code timeUnit}
   * @param timeUnit the time unit, or {@code TimeUnit.MILLISECONDS} if null
   * @return a new HttpConnectStrategy instance with this property modified
   * @see #DEFAULT_WRITE_TIMEOUT_MILLIS
   */
  public HttpConnectStrategy writeTimeout(final long writeTimeout, final TimeUnit timeUnit) {
    return addClientConfigurerAction(new ClientConfigurer() {
      @Override
      public void configure(OkHttpClient.Builder builder) {
        builder.writeTimeout(writeTimeout, timeUnitOrDefault(timeUnit));
      }
    });
  }

  /**
   * Sets a custom header to be included in each request.
   * <p>
   * Any existing header with the same name is overwritten.
   *
   * @param name the header name
   * @param value the header value
   * @return a new HttpConnectStrategy instance with this property modified
   */
  public HttpConnectStrategy header(String name, String value) {
    return new HttpConnectStrategy(endpoint, clientConfigurer, httpClient,
        headers.newBuilder().set(name, value).build());
  }

  /**
   * Sets custom headers to be included in each request.
   * <p>
   * Any existing headers with the same names are overwritten.
   *
   * @param headers the headers to add
   * @return a new HttpConnectStrategy instance with this property modified
   */
  public HttpConnectStrategy headers(Headers headers) {
    Headers.Builder builder = this.headers.newBuilder();
    for (String name: headers.names()) {
      builder.removeAll(name);
      for (String value: headers.values(name)) {
        builder.add(name, value);
      }
    }
    return new HttpConnectStrategy(endpoint, clientConfigurer, httpClient, builder.build());
  }

  /**
   * Specifies that EventSource should use a specific instance of {@link OkHttpClient}.
   * <p>
   * EventSource will not shut the client down when it is closed; its lifecycle belongs to
   * the application. Options that configure the client builder are ignored if this is set.
   *
   * @param httpClient the HTTP client, or null to let EventSource create one
   * @return a new HttpConnectStrategy instance with this property modified
   */
  public HttpConnectStrategy httpClient(OkHttpClient httpClient) {
    return new HttpConnectStrategy(endpoint, clientConfigurer, httpClient, headers);
  }

  static String renderResponseHead(Response response) {
    StringBuilder sb = new StringBuilder()
        .append(response.protocol().toString().toUpperCase(Locale.ROOT))
        .append(' ').append(response.code());
    if (!response.message().isEmpty()) {
      sb.append(' ').append(response.message());
    }
    sb.append("\r\n");
    Headers headers = response.headers();
    for (int i = 0; i < headers.size(); i++) {
      sb.append(headers.name(i)).append(": ").append(headers.value(i)).append("\r\n");
    }
    return sb.append("\r\n").toString();
  }

  class Client extends ConnectStrategy.Client { // package-private visibility for tests
    final OkHttpClient httpClient; // package-private visibility for tests
    private final LDLogger logger;

    Client(LDLogger logger) {
      this.logger = logger;
      this.httpClient = createHttpClient();
    }

    @Override
    public Result connect() throws StreamException {
      HttpUrl url = Endpoints.parse(endpoint);
      logger.debug("Attempting to connect to SSE stream at {}", url);

      Request request = new Request.Builder().url(url).headers(headers).get().build();
      Call call = httpClient.newCall(request);

      Response response;
      try {
        response = call.execute();
      } catch (IOException e) {
        logger.info("Connection failed: {}", LogValues.exceptionSummary(e));
        throw new StreamIOException(e);
      }
      logger.debug("Server responded with HTTP status {}", response.code());

      ResponseBody body = response.body();
      InputStream head = new ByteArrayInputStream(renderResponseHead(response).getBytes(UTF8));
      InputStream stream = body == null ? head : new SequenceInputStream(head, body.byteStream());
      return new Result(stream, url.uri(), new RequestCloser(call));
    }

    @Override
    public URI getOrigin() {
      return Endpoints.uriOrNull(endpoint);
    }

    @Override
    public void close() {
      // Only shut down the HTTP client if it is one that we created.
      if (HttpConnectStrategy.this.httpClient == null) {
        httpClient.connectionPool().evictAll();
        httpClient.dispatcher().cancelAll();
        httpClient.dispatcher().executorService().shutdownNow();
      }
    }

    private OkHttpClient createHttpClient() {
      if (HttpConnectStrategy.this.httpClient != null) {
        return HttpConnectStrategy.this.httpClient;
      }
      OkHttpClient.Builder builder = new OkHttpClient.Builder()
          .connectionPool(new ConnectionPool(1, 1, TimeUnit.SECONDS))
          .connectTimeout(DEFAULT_CONNECT_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)
          .readTimeout(DEFAULT_READ_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)
          .writeTimeout(DEFAULT_WRITE_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)
          .retryOnConnectionFailure(false);
      if (clientConfigurer != null) {
        clientConfigurer.configure(builder);
      }
      return builder.build();
    }
  }

  private static class RequestCloser implements Closeable {
    private final Call call;

    RequestCloser(Call call) {
      this.call = call;
    }

    @Override
    public void close() throws IOException {
      // Cancelling makes a read that is blocked on the response body fail.
      call.cancel();
    }
  }
}
