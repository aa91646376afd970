package net.eventpush.eventsource;

/**
 * An exception indicating that the endpoint given to {@link EventSource} is not a valid
 * absolute HTTP or HTTPS URL.
 * <p>
 * This is thrown by {@link EventSource#open(String)} and {@link EventSource.Builder#open()}
 * before any connection attempt is made. Retrying with the same endpoint will always fail.
 */
@SuppressWarnings("serial")
public final class InvalidEndpointException extends StreamException {
  private final String endpoint;

  /**
   * Constructs an instance.
   *
   * @param endpoint the endpoint string that could not be parsed
   */
  public InvalidEndpointException(String endpoint) {
    super("Invalid stream endpoint: " + endpoint);
    this.endpoint = endpoint;
  }

  /**
   * Returns the endpoint string that could not be parsed.
   *
   * @return the endpoint, possibly null
   */
  public String getEndpoint() {
    return endpoint;
  }
}
