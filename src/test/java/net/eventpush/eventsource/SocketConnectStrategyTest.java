package net.eventpush.eventsource;

import org.junit.Rule;
import org.junit.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URI;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static net.eventpush.eventsource.Helpers.UTF8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.fail;

import okhttp3.HttpUrl;

/**
 * Tests of SocketConnectStrategy's request and connection handling, against a raw TCP
 * server, without using EventSource.
 */
@SuppressWarnings("javadoc")
public class SocketConnectStrategyTest {
  @Rule public TestScopedLoggerRule testLogger = new TestScopedLoggerRule();

  @Test
  public void createWithUri() {
    URI uri = URI.create("http://test/uri");
    assertThat(ConnectStrategy.socket(uri).endpoint, equalTo(uri.toString()));
  }

  @Test(expected = IllegalArgumentException.class)
  public void createWithNullUri() {
    ConnectStrategy.socket((URI)null);
  }

  @Test
  public void defaultProperties() {
    SocketConnectStrategy s = ConnectStrategy.socket("http://test/uri");
    assertThat(s.connectTimeoutMillis, equalTo(SocketConnectStrategy.DEFAULT_CONNECT_TIMEOUT_MILLIS));
    assertThat(s.headers.get("Accept"), equalTo("text/event-stream"));
    assertThat(s.headers.get("Cache-Control"), equalTo("no-cache"));
  }

  @Test
  public void optionsReturnNewInstances() {
    SocketConnectStrategy base = ConnectStrategy.socket("http://test/uri");
    SocketConnectStrategy modified = base.connectTimeout(3, TimeUnit.SECONDS).header("Accept", "text/plain");

    assertThat(modified.connectTimeoutMillis, equalTo(3000L));
    assertThat(modified.headers.get("Accept"), equalTo("text/plain"));
    assertThat(base.connectTimeoutMillis, equalTo(SocketConnectStrategy.DEFAULT_CONNECT_TIMEOUT_MILLIS));
    assertThat(base.headers.get("Accept"), equalTo("text/event-stream"));
  }

  @Test
  public void connectTimeoutIsPinnedToIntRange() {
    SocketConnectStrategy base = ConnectStrategy.socket("http://test/uri");

    assertThat(base.connectTimeout(30, TimeUnit.DAYS).connectTimeoutInt(), equalTo(Integer.MAX_VALUE));
    assertThat(base.connectTimeout(Long.MAX_VALUE, null).connectTimeoutInt(), equalTo(Integer.MAX_VALUE));
    assertThat(base.connectTimeout(-5, null).connectTimeoutInt(), equalTo(0));
    assertThat(base.connectTimeout(1500, null).connectTimeoutInt(), equalTo(1500));
  }

  @Test
  public void veryLongConnectTimeoutStillConnects() throws Exception {
    try (FakeServer server = FakeServer.start()) {
      try (ConnectStrategy.Client client = ConnectStrategy.socket(server.getUri("/sub"))
          .connectTimeout(30, TimeUnit.DAYS)
          .createClient(testLogger.getLogger())) {
        ConnectStrategy.Client.Result result = client.connect();

        assertThat(server.awaitRequest().get(0), equalTo("GET /sub HTTP/1.0"));
        result.getCloser().close();
      }
    }
  }

  @Test
  public void requestFormat() {
    SocketConnectStrategy s = ConnectStrategy.socket("http://test/uri").header("Authorization", "xyz");
    String request = s.buildRequest(HttpUrl.get("http://example.com:8080/sub/path?a=1&b=2"));

    assertThat(request, equalTo(
        "GET /sub/path?a=1&b=2 HTTP/1.0\r\n" +
        "Host: example.com:8080\r\n" +
        "Accept: text/event-stream\r\n" +
        "Cache-Control: no-cache\r\n" +
        "Authorization: xyz\r\n" +
        "\r\n"));
  }

  @Test
  public void hostHeaderOmitsDefaultPort() {
    SocketConnectStrategy s = ConnectStrategy.socket("http://test/uri");

    assertThat(s.buildRequest(HttpUrl.get("http://example.com/")), equalTo(
        "GET / HTTP/1.0\r\nHost: example.com\r\nAccept: text/event-stream\r\nCache-Control: no-cache\r\n\r\n"));
    assertThat(s.buildRequest(HttpUrl.get("https://example.com/")).split("\r\n")[1],
        equalTo("Host: example.com"));
  }

  @Test
  public void hostHeaderBracketsIpv6Address() {
    String request = ConnectStrategy.socket("http://test/uri").buildRequest(HttpUrl.get("http://[::1]:9000/"));
    assertThat(request.split("\r\n")[1], equalTo("Host: [::1]:9000"));
  }

  @Test
  public void malformedEndpointIsRejectedOnConnect() throws Exception {
    for (String endpoint: new String[] { "127.0.0.1:1236/sub", "", "   ", "ftp://host/path", "not a url" }) {
      try (ConnectStrategy.Client client = ConnectStrategy.socket(endpoint).createClient(testLogger.getLogger())) {
        assertThat(client.getOrigin(), nullValue());
        client.connect();
        fail("expected exception for " + endpoint);
      } catch (InvalidEndpointException e) {
        assertThat(e.getEndpoint(), equalTo(endpoint));
      }
    }
  }

  @Test
  public void connectionRefused() throws Exception {
    FakeServer server = FakeServer.start();
    URI uri = server.getUri("/stream");
    server.close();

    try (ConnectStrategy.Client client = ConnectStrategy.socket(uri).createClient(testLogger.getLogger())) {
      client.connect();
      fail("expected exception");
    } catch (StreamIOException e) {
      // expected
    }
  }

  @Test
  public void sendsGetRequestAndReturnsRawResponse() throws Exception {
    try (FakeServer server = FakeServer.start()) {
      URI uri = server.getUri("/sub?x=1");
      try (ConnectStrategy.Client client = ConnectStrategy.socket(uri).createClient(testLogger.getLogger())) {
        ConnectStrategy.Client.Result result = client.connect();

        List<String> request = server.awaitRequest();
        assertThat(request.get(0), equalTo("GET /sub?x=1 HTTP/1.0"));
        assertThat(request, hasItem("Accept: text/event-stream"));
        assertThat(request, hasItem("Host: 127.0.0.1:" + uri.getPort()));
        assertThat(result.getOrigin(), equalTo(uri));

        server.send("HTTP/1.0 200 OK\r\n\r\ndata: x\n\n");
        BufferedReader reader = new BufferedReader(new InputStreamReader(result.getInputStream(), UTF8));
        assertThat(reader.readLine(), equalTo("HTTP/1.0 200 OK"));
        assertThat(reader.readLine(), equalTo(""));
        assertThat(reader.readLine(), equalTo("data: x"));

        result.getCloser().close();
        result.getCloser().close();
      }
    }
  }

  @Test
  public void closerEndsBlockedRead() throws Exception {
    try (FakeServer server = FakeServer.start()) {
      try (ConnectStrategy.Client client = ConnectStrategy.socket(server.getUri()).createClient(testLogger.getLogger())) {
        final ConnectStrategy.Client.Result result = client.connect();
        server.awaitRequest();

        Thread closer = new Thread(() -> {
          try {
            Thread.sleep(100);
            result.getCloser().close();
          } catch (Exception e) {
            throw new RuntimeException(e);
          }
        });
        closer.start();
        try {
          int b = result.getInputStream().read();
          assertThat(b, equalTo(-1));
        } catch (IOException e) {
          // a closed socket may also report an error
        }
        closer.join();
      }
    }
  }
}
