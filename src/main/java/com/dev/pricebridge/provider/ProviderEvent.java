package com.dev.pricebridge.provider;

import java.util.List;

/**
 * A batch of messages delivered by one {@link ProviderSession#nextEvent} call.
 */
public class ProviderEvent {

  /**
   * Provider event kinds the bridge distinguishes.
   */
  public enum EventType {
    SESSION_STATUS,
    SERVICE_STATUS,
    REQUEST_STATUS,
    PARTIAL_RESPONSE,
    /** Final event of a request's response stream. */
    RESPONSE,
    /** No event arrived within the poll timeout. */
    TIMEOUT
  }

  private final EventType eventType;
  private final List<ProviderMessage> messages;

  public ProviderEvent(EventType eventType, List<ProviderMessage> messages) {
    this.eventType = eventType;
    this.messages = messages == null ? List.of() : List.copyOf(messages);
  }

  public static ProviderEvent timeout() {
    return new ProviderEvent(EventType.TIMEOUT, List.of());
  }

  public EventType getEventType() {
    return eventType;
  }

  public List<ProviderMessage> getMessages() {
    return messages;
  }

  @Override
  public String toString() {
    return "ProviderEvent[" + eventType + ", messages=" + messages + "]";
  }
}
