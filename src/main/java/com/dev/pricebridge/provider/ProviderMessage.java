package com.dev.pricebridge.provider;

import java.util.List;

/**
 * A single message inside a {@link ProviderEvent}.
 *
 * <p>Status messages (session started, service opened) carry no correlation
 * id. Reference data messages carry the id of the request they answer and
 * either a request-level {@code responseError} or a list of per-security
 * records.</p>
 */
public class ProviderMessage {

  private final String messageType;
  private final CorrelationId correlationId;
  private final ErrorInfo responseError;
  private final List<SecurityData> securityData;

  /**
   * Creates a message.
   *
   * @param messageType provider message type, e.g. ReferenceDataResponse
   * @param correlationId id of the originating request, or null for status messages
   * @param responseError request-level error, or null
   * @param securityData per-security records, may be empty
   */
  public ProviderMessage(String messageType,
                         CorrelationId correlationId,
                         ErrorInfo responseError,
                         List<SecurityData> securityData) {
    this.messageType = messageType;
    this.correlationId = correlationId;
    this.responseError = responseError;
    this.securityData = securityData == null ? List.of() : List.copyOf(securityData);
  }

  /**
   * Creates an uncorrelated status message.
   */
  public static ProviderMessage status(String messageType) {
    return new ProviderMessage(messageType, null, null, List.of());
  }

  public String getMessageType() {
    return messageType;
  }

  public CorrelationId getCorrelationId() {
    return correlationId;
  }

  public boolean isCorrelatedWith(CorrelationId id) {
    return correlationId != null && correlationId.equals(id);
  }

  public boolean hasResponseError() {
    return responseError != null;
  }

  public ErrorInfo getResponseError() {
    return responseError;
  }

  public List<SecurityData> getSecurityData() {
    return securityData;
  }

  @Override
  public String toString() {
    return messageType + "[correlationId=" + correlationId
            + ", responseError=" + responseError
            + ", securityData=" + securityData + "]";
  }
}
