package com.dev.pricebridge.config;

import java.time.Duration;

/**
 * Connection and request settings for the market data provider.
 *
 * <p>Built once at startup by {@link ProviderConfig} and handed to the price
 * lookup service and to every session it opens.</p>
 */
public final class ProviderSettings {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 8194;
  public static final String DEFAULT_SERVICE = "//blp/refdata";
  public static final String DEFAULT_FIELD = "PX_LAST";
  public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofSeconds(5);

  private final String host;
  private final int port;
  private final String authOptions;
  private final String service;
  private final String field;
  private final Duration pollTimeout;

  /**
   * Creates validated provider settings.
   *
   * @param host provider host name
   * @param port provider port, 1..65535
   * @param authOptions provider authentication options, blank for none
   * @param service reference data service name
   * @param field field holding the last traded price
   * @param pollTimeout maximum wait per event poll, must be positive
   * @throws IllegalArgumentException if any value is invalid
   */
  public ProviderSettings(String host, int port, String authOptions,
                          String service, String field, Duration pollTimeout) {
    if (host == null || host.isBlank()) {
      throw new IllegalArgumentException("Provider host must not be blank");
    }
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("Provider port out of range: " + port);
    }
    if (service == null || service.isBlank()) {
      throw new IllegalArgumentException("Provider service must not be blank");
    }
    if (field == null || field.isBlank()) {
      throw new IllegalArgumentException("Price field must not be blank");
    }
    if (pollTimeout == null || pollTimeout.isZero() || pollTimeout.isNegative()) {
      throw new IllegalArgumentException("Poll timeout must be positive: " + pollTimeout);
    }
    this.host = host;
    this.port = port;
    this.authOptions = authOptions == null || authOptions.isBlank() ? null : authOptions;
    this.service = service;
    this.field = field;
    this.pollTimeout = pollTimeout;
  }

  /**
   * Settings for a local provider terminal with default service and field.
   */
  public static ProviderSettings defaults() {
    return new ProviderSettings(DEFAULT_HOST, DEFAULT_PORT, null,
            DEFAULT_SERVICE, DEFAULT_FIELD, DEFAULT_POLL_TIMEOUT);
  }

  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  /**
   * Returns the authentication options, or null when none are configured.
   */
  public String getAuthOptions() {
    return authOptions;
  }

  public boolean hasAuthOptions() {
    return authOptions != null;
  }

  public String getService() {
    return service;
  }

  public String getField() {
    return field;
  }

  public Duration getPollTimeout() {
    return pollTimeout;
  }

  public String endpoint() {
    return host + ":" + port;
  }

  // auth options are never printed
  @Override
  public String toString() {
    return "ProviderSettings[endpoint=" + endpoint()
            + ", service=" + service
            + ", field=" + field
            + ", pollTimeout=" + pollTimeout
            + ", auth=" + (hasAuthOptions() ? "configured" : "none") + "]";
  }
}
