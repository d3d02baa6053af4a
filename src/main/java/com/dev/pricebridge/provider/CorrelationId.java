package com.dev.pricebridge.provider;

/**
 * Identifier the provider stamps on every message produced for a request,
 * used to match asynchronous events back to the request that caused them.
 */
public final class CorrelationId {

  private final long value;

  public CorrelationId(long value) {
    this.value = value;
  }

  public long getValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CorrelationId)) {
      return false;
    }
    return value == ((CorrelationId) o).value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    return "CorrelationId[" + value + "]";
  }
}
