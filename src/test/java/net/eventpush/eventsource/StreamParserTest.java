package net.eventpush.eventsource;

import com.launchdarkly.logging.LDLogger;

import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import static net.eventpush.eventsource.Helpers.UTF8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.fail;

@SuppressWarnings("javadoc")
public class StreamParserTest {
  private static final URI ORIGIN = URI.create("http://test/stream");
  private static final String HEADERS = "HTTP/1.0 200 OK\nContent-Type: text/event-stream\n\n";

  private final RecordingSink sink = new RecordingSink();

  @Test
  public void headerLinesAreSkippedUntilBlankLine() {
    StreamParser parser = makeParser("");
    parser.processLine("HTTP/1.0 200 OK");
    parser.processLine("data: this is a header, not an event");
    parser.processLine("");

    assertThat(parser.getPhase(), equalTo(StreamParser.Phase.BODY));
    assertThat(sink.openCount, equalTo(1));
    assertThat(sink.events, empty());
  }

  @Test
  public void phaseStartsAsHeaders() {
    assertThat(makeParser("").getPhase(), equalTo(StreamParser.Phase.HEADERS));
  }

  @Test
  public void openIsReportedOnlyOnce() {
    StreamParser parser = makeParser("");
    parser.processLine("");
    parser.processLine("");
    parser.processLine("");

    assertThat(sink.openCount, equalTo(1));
    assertThat(sink.events, empty());
  }

  @Test
  public void simpleMessage() throws Exception {
    runParser(HEADERS + "data: hello\n\n");

    assertThat(sink.openCount, equalTo(1));
    assertThat(sink.events, contains(new MessageEvent("message", "hello", ORIGIN)));
  }

  @Test
  public void customEventName() throws Exception {
    runParser(HEADERS + "event: update\ndata: {\"a\":1}\n\n");

    assertThat(sink.events, contains(new MessageEvent("update", "{\"a\":1}", ORIGIN)));
  }

  @Test
  public void eventWithoutDataHasEmptyData() throws Exception {
    runParser(HEADERS + "event: ping\n\n");

    assertThat(sink.events, contains(new MessageEvent("ping", "", ORIGIN)));
  }

  @Test
  public void laterDataFieldReplacesEarlierOne() throws Exception {
    runParser(HEADERS + "data: first\ndata: second\n\n");

    assertThat(sink.events, contains(new MessageEvent("message", "second", ORIGIN)));
  }

  @Test
  public void valueIsSplitAtFirstColon() throws Exception {
    runParser(HEADERS + "data: a:b:c\n\n");

    assertThat(sink.events, contains(new MessageEvent("message", "a:b:c", ORIGIN)));
  }

  @Test
  public void leadingWhitespaceIsRemovedFromValue() throws Exception {
    runParser(HEADERS + "data:no-space\n\ndata:   \tspaces\n\n");

    assertThat(sink.events, contains(
        new MessageEvent("message", "no-space", ORIGIN),
        new MessageEvent("message", "spaces", ORIGIN)));
  }

  @Test
  public void lineWithoutColonIsFieldWithEmptyValue() throws Exception {
    runParser(HEADERS + "data\n\n");

    assertThat(sink.events, contains(new MessageEvent("message", "", ORIGIN)));
  }

  @Test
  public void commentsAreIgnored() throws Exception {
    runParser(HEADERS + ": comment\n:\ndata: x\n: another\n\n: trailing comment\n\n");

    assertThat(sink.events, contains(new MessageEvent("message", "x", ORIGIN)));
  }

  @Test
  public void blankLinesWithoutPendingEventDispatchNothing() throws Exception {
    runParser(HEADERS + "\n\n\ndata: x\n\n\n\n");

    assertThat(sink.events, contains(new MessageEvent("message", "x", ORIGIN)));
  }

  @Test
  public void unknownFieldsDoNotCreateEvent() throws Exception {
    runParser(HEADERS + "id: 1\nretry: 1000\n\nfoo: bar\ndata: y\n\n");

    assertThat(sink.events, contains(new MessageEvent("message", "y", ORIGIN)));
  }

  @Test
  public void fieldNamesAreCaseSensitive() throws Exception {
    runParser(HEADERS + "Data: x\nEVENT: y\n\n");

    assertThat(sink.events, empty());
  }

  @Test
  public void incompleteEventAtEndOfStreamIsDropped() throws Exception {
    runParser(HEADERS + "data: complete\n\nevent: partial\ndata: partial\n");

    assertThat(sink.events, contains(new MessageEvent("message", "complete", ORIGIN)));
  }

  @Test
  public void eventsAreReportedInStreamOrder() throws Exception {
    runParser(HEADERS + "event: a\ndata: 1\n\nevent: b\ndata: 2\n\ndata: 3\n\n");

    assertThat(sink.events, contains(
        new MessageEvent("a", "1", ORIGIN),
        new MessageEvent("b", "2", ORIGIN),
        new MessageEvent("message", "3", ORIGIN)));
  }

  @Test
  public void endOfStreamThrowsClosedByServer() throws Exception {
    try {
      makeParser(HEADERS).run();
      fail("expected exception");
    } catch (StreamClosedByServerException e) {
      assertThat(sink.openCount, equalTo(1));
    }
  }

  @Test
  public void readErrorThrowsStreamIOException() throws Exception {
    final IOException error = new IOException("broken");
    InputStream stream = new InputStream() {
      @Override
      public int read() throws IOException {
        throw error;
      }
    };
    StreamParser parser = new StreamParser(new FrameReader(stream, 100), ORIGIN, sink, LDLogger.none());
    try {
      parser.run();
      fail("expected exception");
    } catch (StreamIOException e) {
      assertThat(e.getIOException(), equalTo(error));
    }
  }

  private StreamParser makeParser(String input) {
    return new StreamParser(
        new FrameReader(new ByteArrayInputStream(input.getBytes(UTF8)), 100),
        ORIGIN,
        sink,
        LDLogger.none()
        );
  }

  private void runParser(String input) throws StreamException {
    try {
      makeParser(input).run();
      fail("expected end of stream");
    } catch (StreamClosedByServerException e) {
      // expected
    }
  }

  private static class RecordingSink implements StreamParser.Sink {
    int openCount;
    final List<MessageEvent> events = new ArrayList<>();

    @Override
    public void streamOpened() {
      openCount++;
    }

    @Override
    public void eventReceived(MessageEvent event) {
      events.add(event);
    }
  }
}
