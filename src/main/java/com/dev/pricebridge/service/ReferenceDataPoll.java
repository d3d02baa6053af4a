package com.dev.pricebridge.service;

import com.dev.pricebridge.provider.CorrelationId;
import com.dev.pricebridge.provider.FieldException;
import com.dev.pricebridge.provider.ProviderEvent;
import com.dev.pricebridge.provider.ProviderEvent.EventType;
import com.dev.pricebridge.provider.ProviderMessage;
import com.dev.pricebridge.provider.SecurityData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks one outstanding reference data request while its events are polled.
 *
 * <p>Two states, {@link State#POLLING} and {@link State#COMPLETED}. Any of
 * the four {@link Trigger}s moves the poll to COMPLETED; once completed,
 * further events are ignored. Messages that do not carry the request's
 * correlation id are skipped.</p>
 *
 * <p>Not thread-safe; owned by a single lookup.</p>
 */
final class ReferenceDataPoll {

  private static final Logger log = LoggerFactory.getLogger(ReferenceDataPoll.class);

  enum State {
    POLLING,
    COMPLETED
  }

  enum Trigger {
    /** No event arrived within the poll timeout. */
    TIMEOUT,
    /** The request as a whole was rejected. */
    RESPONSE_ERROR,
    /** A price or an error was read from the per-security records. */
    SECURITY_DATA_RESOLVED,
    /** The final event of the response stream was seen. */
    RESPONSE_END
  }

  private final CorrelationId correlationId;
  private final String symbol;
  private final String field;

  private State state = State.POLLING;
  private Trigger completedBy;
  private Double price;
  private String error;

  ReferenceDataPoll(CorrelationId correlationId, String symbol, String field) {
    this.correlationId = correlationId;
    this.symbol = symbol;
    this.field = field;
  }

  /**
   * Applies one provider event.
   *
   * @param event event returned by the session
   * @return the state after the event
   */
  State onEvent(ProviderEvent event) {
    if (state == State.COMPLETED) {
      return state;
    }

    if (event.getEventType() == EventType.TIMEOUT) {
      if (!hasOutcome()) {
        error = "Provider request timed out for " + symbol + ".";
      }
      return complete(Trigger.TIMEOUT);
    }

    for (ProviderMessage message : event.getMessages()) {
      log.debug("Provider message: {}", message);
      if (!message.isCorrelatedWith(correlationId)) {
        continue;
      }
      if (message.hasResponseError()) {
        error = "Response error for " + symbol + ": "
                + message.getResponseError().getMessage();
        return complete(Trigger.RESPONSE_ERROR);
      }
      readSecurityData(message);
      if (hasOutcome()) {
        return complete(Trigger.SECURITY_DATA_RESOLVED);
      }
    }

    if (event.getEventType() == EventType.RESPONSE) {
      return complete(Trigger.RESPONSE_END);
    }
    return state;
  }

  private void readSecurityData(ProviderMessage message) {
    for (SecurityData record : message.getSecurityData()) {
      String security = record.getSecurity();

      if (record.hasFieldExceptions()) {
        FieldException first = record.getFieldExceptions().get(0);
        error = "Field error for " + security + " (" + first.getFieldId() + "): "
                + first.getErrorInfo().getMessage();
        continue;
      }

      if (record.hasSecurityError()) {
        error = "Security error for " + security + ": "
                + record.getSecurityError().getMessage();
        continue;
      }

      if (!record.hasField(field)) {
        error = field + " field not found for " + symbol + ".";
      } else if (record.isNullValue(field)) {
        error = field + " is null for " + symbol + ".";
      } else {
        price = record.getFieldAsDouble(field);
      }
      // first record with field data decides
      return;
    }
  }

  private State complete(Trigger trigger) {
    state = State.COMPLETED;
    completedBy = trigger;
    return state;
  }

  private boolean hasOutcome() {
    return price != null || error != null;
  }

  boolean isPolling() {
    return state == State.POLLING;
  }

  State getState() {
    return state;
  }

  Trigger getCompletedBy() {
    return completedBy;
  }

  Double getPrice() {
    return price;
  }

  String getError() {
    return error;
  }
}
