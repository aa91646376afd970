package net.eventpush.eventsource;

import java.nio.charset.Charset;
import java.util.concurrent.TimeUnit;

abstract class Helpers {
  static final Charset UTF8 = Charset.forName("UTF-8"); // SSE streams must be UTF-8

  private Helpers() {}

  static long millisFromTimeUnit(long duration, TimeUnit timeUnit) {
    return timeUnitOrDefault(timeUnit).toMillis(duration);
  }

  static TimeUnit timeUnitOrDefault(TimeUnit timeUnit) {
    return timeUnit == null ? TimeUnit.MILLISECONDS : timeUnit;
  }
}
