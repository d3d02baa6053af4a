package com.dev.pricebridge.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Successful price lookup: {@code {"ticker": "MSFT US EQUITY", "price": 312.5}}.
 */
@JsonPropertyOrder({"ticker", "price"})
public class CurrentPriceResponse {

  private final String ticker;
  private final double price;

  /**
   * Creates a price response.
   *
   * @param ticker provider symbol the price was read for
   * @param price last traded price
   */
  public CurrentPriceResponse(String ticker, double price) {
    this.ticker = ticker;
    this.price = price;
  }

  public String getTicker() {
    return ticker;
  }

  public double getPrice() {
    return price;
  }
}
