package com.dev.pricebridge.provider.fixture;

import com.dev.pricebridge.config.ProviderSettings;
import com.dev.pricebridge.provider.ProviderSession;
import com.dev.pricebridge.provider.ProviderSessionFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * Session factory that serves reference data from a JSON fixture instead of
 * a live provider terminal.
 *
 * <p>Active when {@code provider.mode=fixture} (the default). The fixture is
 * re-read by every session on start, so edits show up without a restart.</p>
 */
@Component
@ConditionalOnProperty(name = "provider.mode", havingValue = "fixture", matchIfMissing = true)
public class FixtureProviderSessionFactory implements ProviderSessionFactory {

  /** The only service a fixture session can open. */
  public static final String REFDATA_SERVICE = ProviderSettings.DEFAULT_SERVICE;

  private final Resource fixture;
  private final ObjectMapper mapper;

  /**
   * Creates the factory.
   *
   * @param fixture JSON document mapping provider symbols to {@link FixtureSecurity}
   * @param mapper Spring's ObjectMapper
   */
  @Autowired
  public FixtureProviderSessionFactory(
          @Value("${provider.fixture:classpath:fixtures/prices.json}") Resource fixture,
          ObjectMapper mapper) {
    this.fixture = fixture;
    this.mapper = mapper;
  }

  @Override
  public ProviderSession create(ProviderSettings settings) {
    return new FixtureProviderSession(fixture, mapper, settings);
  }
}
