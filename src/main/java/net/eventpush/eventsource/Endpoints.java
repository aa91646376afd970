package net.eventpush.eventsource;

import java.net.URI;

import okhttp3.HttpUrl;

abstract class Endpoints {
  private Endpoints() {}

  /**
   * Parses a stream endpoint, which must be an absolute HTTP or HTTPS URL.
   *
   * @param endpoint the endpoint string
   * @return the parsed URL
   * @throws InvalidEndpointException if the string is null or not a valid HTTP/HTTPS URL
   */
  static HttpUrl parse(String endpoint) throws InvalidEndpointException {
    HttpUrl url = parseOrNull(endpoint);
    if (url == null) {
      throw new InvalidEndpointException(endpoint);
    }
    return url;
  }

  static URI uriOrNull(String endpoint) {
    HttpUrl url = parseOrNull(endpoint);
    return url == null ? null : url.uri();
  }

  private static HttpUrl parseOrNull(String endpoint) {
    return endpoint == null ? null : HttpUrl.parse(endpoint.trim());
  }
}
