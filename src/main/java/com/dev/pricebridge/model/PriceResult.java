package com.dev.pricebridge.model;

/**
 * Outcome of one price lookup.
 *
 * <p>Every field is optional. A result with a price is a success even if an
 * error was also recorded for an earlier security record; a result without a
 * price always carries an error.</p>
 */
public final class PriceResult {

  private final Double price;
  private final String normalizedTicker;
  private final String error;

  /**
   * Creates a lookup outcome.
   *
   * @param price last traded price, or null
   * @param normalizedTicker provider symbol that was queried, or null if the
   *                         lookup failed before normalization
   * @param error error description, or null
   */
  public PriceResult(Double price, String normalizedTicker, String error) {
    this.price = price;
    this.normalizedTicker = normalizedTicker;
    this.error = error;
  }

  public static PriceResult failure(String normalizedTicker, String error) {
    return new PriceResult(null, normalizedTicker, error);
  }

  public Double getPrice() {
    return price;
  }

  public boolean hasPrice() {
    return price != null;
  }

  public String getNormalizedTicker() {
    return normalizedTicker;
  }

  public String getError() {
    return error;
  }

  @Override
  public String toString() {
    return "PriceResult[price=" + price
            + ", ticker=" + normalizedTicker
            + ", error=" + error + "]";
  }
}
