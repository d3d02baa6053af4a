package com.dev.pricebridge.config;

import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the {@link ProviderSettings} bean from {@code application.properties}.
 *
 * <p>Host and port default to the {@code BLPAPI_SERVER_HOST} and
 * {@code BLPAPI_SERVER_PORT} environment variables, then to
 * {@code localhost:8194}.</p>
 */
@Configuration
public class ProviderConfig {

  /**
   * Creates the provider settings shared by every lookup.
   *
   * @param host provider host
   * @param port provider port
   * @param authOptions optional authentication options
   * @param service reference data service name
   * @param field price field name
   * @param pollTimeoutMs maximum wait per event poll in milliseconds
   * @return validated settings
   */
  @Bean
  public ProviderSettings providerSettings(
          @Value("${provider.host:localhost}") String host,
          @Value("${provider.port:8194}") int port,
          @Value("${provider.auth-options:}") String authOptions,
          @Value("${provider.service:" + ProviderSettings.DEFAULT_SERVICE + "}") String service,
          @Value("${provider.field:" + ProviderSettings.DEFAULT_FIELD + "}") String field,
          @Value("${provider.poll-timeout-ms:5000}") long pollTimeoutMs) {
    return new ProviderSettings(host, port, authOptions, service, field,
            Duration.ofMillis(pollTimeoutMs));
  }
}
