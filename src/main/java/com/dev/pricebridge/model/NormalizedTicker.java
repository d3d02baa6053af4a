package com.dev.pricebridge.model;

/**
 * A user-supplied ticker together with the provider symbol derived from it.
 */
public final class NormalizedTicker {

  private final String raw;
  private final String symbol;
  private final Market market;

  /**
   * Creates a normalized ticker.
   *
   * @param raw ticker as received, e.g. "7203.T"
   * @param symbol provider symbol, e.g. "7203 JT EQUITY"
   * @param market market inferred from the raw ticker
   */
  public NormalizedTicker(String raw, String symbol, Market market) {
    this.raw = raw;
    this.symbol = symbol;
    this.market = market;
  }

  public String getRaw() {
    return raw;
  }

  public String getSymbol() {
    return symbol;
  }

  public Market getMarket() {
    return market;
  }

  @Override
  public String toString() {
    return raw + " -> " + symbol + " (" + market + ")";
  }
}
