package com.dev.pricebridge.provider;

import com.dev.pricebridge.config.ProviderSettings;

/**
 * Creates a fresh, unstarted {@link ProviderSession} for each lookup.
 */
public interface ProviderSessionFactory {

  ProviderSession create(ProviderSettings settings);
}
