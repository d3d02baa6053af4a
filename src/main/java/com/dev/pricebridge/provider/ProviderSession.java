package com.dev.pricebridge.provider;

import java.time.Duration;

/**
 * A live, stateful connection to the market data provider.
 *
 * <p>Sessions are single-use and single-threaded: one is created per price
 * lookup and stopped before the lookup returns. Implementations need not be
 * thread-safe.</p>
 */
public interface ProviderSession {

  /**
   * Connects to the provider.
   *
   * @return true when the session is up
   */
  boolean start();

  /**
   * Opens a provider service such as {@code //blp/refdata}.
   *
   * @param service service name
   * @return true when the service is available on this session
   */
  boolean openService(String service);

  /**
   * Submits a request. Responses arrive later through {@link #nextEvent}.
   *
   * @param request request to send
   * @return the correlation id stamped on every message answering this request
   */
  CorrelationId sendRequest(ReferenceDataRequest request);

  /**
   * Blocks until the next event is available or the timeout elapses.
   *
   * @param timeout maximum time to wait
   * @return the next event, or an event of type {@code TIMEOUT}
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  ProviderEvent nextEvent(Duration timeout) throws InterruptedException;

  /**
   * Disconnects and releases the session.
   */
  void stop();
}
