package com.dev.pricebridge.controller;

import com.dev.pricebridge.dto.CurrentPriceResponse;
import com.dev.pricebridge.exception.BadRequestException;
import com.dev.pricebridge.exception.NotFoundException;
import com.dev.pricebridge.model.PriceResult;
import com.dev.pricebridge.service.PriceLookupService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * <p>REST controller exposing the last traded price of a ticker.</p>
 *
 * <p>Base path: <code>/api</code></p>
 */
@RestController
@RequestMapping("/api")
public class PriceController {

  static final String TICKER_REQUIRED = "Ticker parameter is required";

  private final PriceLookupService priceLookupService;

  public PriceController(PriceLookupService priceLookupService) {
    this.priceLookupService = priceLookupService;
  }

  /**
   * GET /api/current_price?ticker={ticker}
   *
   * <p>Returns 200 with the provider symbol and price, 400 when the ticker is
   * missing, and 404 for every other failure.</p>
   *
   * @param ticker ticker as typed by the user, e.g. "MSFT", "7203" or "7203.T"
   * @return the price of the normalized ticker
   */
  @GetMapping("/current_price")
  public CurrentPriceResponse currentPrice(
          @RequestParam(value = "ticker", required = false) String ticker) {
    if (ticker == null || ticker.isBlank()) {
      throw new BadRequestException(TICKER_REQUIRED);
    }

    PriceResult result = priceLookupService.lookupPrice(ticker);
    String used = result.getNormalizedTicker();

    if (result.hasPrice()) {
      return new CurrentPriceResponse(used != null ? used : ticker, result.getPrice());
    }

    String message = result.getError() != null
            ? result.getError()
            : "Could not retrieve price for ticker " + ticker;
    if (used != null && !used.equals(ticker)) {
      message += " (used provider ticker: " + used + ")";
    }
    throw new NotFoundException(message);
  }
}
