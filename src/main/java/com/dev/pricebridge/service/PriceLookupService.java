package com.dev.pricebridge.service;

import com.dev.pricebridge.config.ProviderSettings;
import com.dev.pricebridge.model.NormalizedTicker;
import com.dev.pricebridge.model.PriceResult;
import com.dev.pricebridge.provider.CorrelationId;
import com.dev.pricebridge.provider.ProviderSession;
import com.dev.pricebridge.provider.ProviderSessionFactory;
import com.dev.pricebridge.provider.ReferenceDataRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * <p><b>Price lookup bridge</b>.</p>
 *
 * <p>Answers one "last traded price" question per call by running a full
 * provider session end to end:</p>
 * <ol>
 *   <li>Open a fresh session and the reference data service.</li>
 *   <li>Normalize the ticker with {@link TickerNormalizer}.</li>
 *   <li>Send a reference data request for the price field and poll events,
 *   each poll bounded by the configured timeout, until
 *   {@link ReferenceDataPoll} completes.</li>
 *   <li>Stop the session.</li>
 * </ol>
 *
 * <p><b>Errors:</b> nothing is thrown to the caller. Startup failures,
 * timeouts, provider errors and unexpected exceptions all end up as the
 * error string of the returned {@link PriceResult}. There is no retry.</p>
 *
 * <p><b>Sessions:</b> never pooled or shared. Each call creates its own and
 * stops it exactly once, on every exit path.</p>
 */
@Service
public class PriceLookupService {

  private static final Logger log = LoggerFactory.getLogger(PriceLookupService.class);

  static final String SESSION_START_FAILED = "Provider session start failed.";

  private final ProviderSessionFactory sessionFactory;
  private final ProviderSettings settings;

  /**
   * Creates the service.
   *
   * @param sessionFactory creates one provider session per lookup
   * @param settings provider endpoint, service, field and poll timeout
   */
  @Autowired
  public PriceLookupService(ProviderSessionFactory sessionFactory, ProviderSettings settings) {
    this.sessionFactory = sessionFactory;
    this.settings = settings;
    log.info("Price lookups will use {}", settings);
  }

  /**
   * Looks up the last traded price for a ticker.
   *
   * @param rawTicker ticker as received from the client, e.g. "MSFT" or "7203.T"
   * @return price and provider symbol on success, otherwise an error description
   */
  public PriceResult lookupPrice(String rawTicker) {
    if (rawTicker == null || rawTicker.isEmpty()) {
      return PriceResult.failure(null, "Ticker must not be empty.");
    }

    ProviderSession session;
    try {
      session = sessionFactory.create(settings);
    } catch (RuntimeException e) {
      log.error("Cannot create provider session for {}", settings.endpoint(), e);
      return PriceResult.failure(null, SESSION_START_FAILED + " " + e.getMessage());
    }

    String symbol = null;
    try {
      if (!session.start()) {
        log.warn("Failed to start provider session to {}", settings.endpoint());
        return PriceResult.failure(null, SESSION_START_FAILED);
      }

      if (!session.openService(settings.getService())) {
        String error = "Failed to open " + settings.getService() + " service.";
        log.warn(error);
        return PriceResult.failure(null, error);
      }

      NormalizedTicker ticker = TickerNormalizer.normalize(rawTicker);
      symbol = ticker.getSymbol();
      log.info("Using provider ticker {} for input {}", symbol, rawTicker);

      ReferenceDataRequest request = new ReferenceDataRequest(settings.getService())
              .addSecurity(symbol)
              .addField(settings.getField());
      log.debug("Sending {}", request);
      CorrelationId correlationId = session.sendRequest(request);

      ReferenceDataPoll poll = new ReferenceDataPoll(correlationId, symbol, settings.getField());
      while (poll.isPolling()) {
        poll.onEvent(session.nextEvent(settings.getPollTimeout()));
      }

      if (poll.getPrice() != null) {
        log.info("Price found for {}: {}", symbol, poll.getPrice());
      }
      if (poll.getError() != null) {
        log.warn(poll.getError());
      }
      return new PriceResult(poll.getPrice(), symbol, poll.getError());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      String error = "Interrupted while getting price for " + rawTicker + ".";
      log.warn(error);
      return PriceResult.failure(symbol, error);
    } catch (RuntimeException e) {
      String error = "Exception while getting price for " + rawTicker + ": " + e.getMessage();
      log.error(error, e);
      return PriceResult.failure(symbol, error);
    } finally {
      stop(session);
    }
  }

  private void stop(ProviderSession session) {
    try {
      session.stop();
    } catch (RuntimeException e) {
      log.warn("Error stopping provider session to {}: {}", settings.endpoint(), e.getMessage());
    }
  }
}
