package net.eventpush.eventsource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

import static net.eventpush.eventsource.Helpers.UTF8;

/**
 * Reads a UTF-8 stream one line at a time, where a line is terminated by any of CR (\r),
 * LF (\n), or CRLF.
 * <p>
 * Bytes are read from the stream into a fixed-size buffer; the bytes of the line being
 * assembled are copied into a second buffer, so a line may be longer than the read buffer
 * and may span any number of reads. A CR at the very end of one read is remembered, so
 * that an LF at the start of the next read is treated as part of the same CRLF.
 * <p>
 * Trailing bytes that are not followed by a terminator when the stream ends are not
 * returned as a line.
 * <p>
 * This class is not thread-safe; only the stream worker reads from it.
 */
final class FrameReader {
  private final InputStream stream;
  private final byte[] readBuffer;
  private final ByteArrayOutputStream lineBuffer;
  private int readPos;
  private int readLimit;
  private boolean skipNextLineFeed;

  FrameReader(InputStream stream, int bufferSize) {
    this.stream = stream;
    this.readBuffer = new byte[bufferSize];
    this.lineBuffer = new ByteArrayOutputStream(bufferSize);
  }

  /**
   * Blocks until a complete line is available.
   *
   * @return the line, not including the terminator; null if the stream has ended
   * @throws IOException if the stream threw an exception
   */
  String readLine() throws IOException {
    lineBuffer.reset();
    while (true) {
      if (readPos == readLimit && !fillBuffer()) {
        return null;
      }
      if (skipNextLineFeed) {
        skipNextLineFeed = false;
        if (readBuffer[readPos] == '\n') {
          readPos++;
          continue;
        }
      }
      int start = readPos;
      while (readPos < readLimit && readBuffer[readPos] != '\n' && readBuffer[readPos] != '\r') {
        readPos++;
      }
      lineBuffer.write(readBuffer, start, readPos - start);
      if (readPos < readLimit) {
        skipNextLineFeed = readBuffer[readPos] == '\r';
        readPos++;
        return lineBuffer.size() == 0 ? "" : new String(lineBuffer.toByteArray(), UTF8);
      }
    }
  }

  private boolean fillBuffer() throws IOException {
    while (true) {
      int count = stream.read(readBuffer, 0, readBuffer.length);
      if (count < 0) {
        return false;
      }
      if (count > 0) {
        readPos = 0;
        readLimit = count;
        return true;
      }
    }
  }
}
