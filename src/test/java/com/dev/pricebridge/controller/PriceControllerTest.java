package com.dev.pricebridge.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.dev.pricebridge.dto.CurrentPriceResponse;
import com.dev.pricebridge.exception.BadRequestException;
import com.dev.pricebridge.exception.NotFoundException;
import com.dev.pricebridge.model.PriceResult;
import com.dev.pricebridge.service.PriceLookupService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for PriceController with a mocked PriceLookupService.
 */
@ExtendWith(MockitoExtension.class)
class PriceControllerTest {

  @Mock
  private PriceLookupService priceLookupService;

  private PriceController priceController;

  @BeforeEach
  void setUp() {
    priceController = new PriceController(priceLookupService);
  }

  /**
   * Test a successful lookup - typical valid case.
   */
  @Test
  void testCurrentPrice_Success_TypicalCase() {
    when(priceLookupService.lookupPrice("MSFT"))
        .thenReturn(new PriceResult(312.5, "MSFT US EQUITY", null));

    CurrentPriceResponse response = priceController.currentPrice("MSFT");

    assertEquals("MSFT US EQUITY", response.getTicker());
    assertEquals(312.5, response.getPrice());
  }

  @Test
  void testCurrentPrice_PriceWithEarlierError_StillSucceeds() {
    when(priceLookupService.lookupPrice("MSFT"))
        .thenReturn(new PriceResult(1.0, "MSFT US EQUITY", "Security error for X: bad"));

    assertEquals(1.0, priceController.currentPrice("MSFT").getPrice());
  }

  @Test
  void testCurrentPrice_MissingTicker_InvalidCase() {
    BadRequestException ex = assertThrows(BadRequestException.class,
        () -> priceController.currentPrice(null));

    assertEquals("Ticker parameter is required", ex.getMessage());
    verify(priceLookupService, never()).lookupPrice(anyString());
  }

  @Test
  void testCurrentPrice_EmptyTicker_InvalidCase() {
    assertThrows(BadRequestException.class, () -> priceController.currentPrice(""));
  }

  @Test
  void testCurrentPrice_Error_AppendsProviderTicker() {
    when(priceLookupService.lookupPrice("MSFT"))
        .thenReturn(PriceResult.failure("MSFT US EQUITY",
            "Provider request timed out for MSFT US EQUITY."));

    NotFoundException ex = assertThrows(NotFoundException.class,
        () -> priceController.currentPrice("MSFT"));

    assertEquals("Provider request timed out for MSFT US EQUITY."
        + " (used provider ticker: MSFT US EQUITY)", ex.getMessage());
  }

  @Test
  void testCurrentPrice_NoErrorNoPrice_GenericMessage() {
    when(priceLookupService.lookupPrice("7203"))
        .thenReturn(new PriceResult(null, "7203 JT EQUITY", null));

    NotFoundException ex = assertThrows(NotFoundException.class,
        () -> priceController.currentPrice("7203"));

    assertEquals("Could not retrieve price for ticker 7203 (used provider ticker: 7203 JT EQUITY)",
        ex.getMessage());
  }

  @Test
  void testCurrentPrice_StartFailure_NoTickerSuffix() {
    when(priceLookupService.lookupPrice("MSFT"))
        .thenReturn(PriceResult.failure(null, "Provider session start failed."));

    NotFoundException ex = assertThrows(NotFoundException.class,
        () -> priceController.currentPrice("MSFT"));

    assertEquals("Provider session start failed.", ex.getMessage());
  }

  @Test
  void testCurrentPrice_SameTicker_NoSuffix() {
    when(priceLookupService.lookupPrice("MSFT US EQUITY"))
        .thenReturn(PriceResult.failure("MSFT US EQUITY", "boom"));

    NotFoundException ex = assertThrows(NotFoundException.class,
        () -> priceController.currentPrice("MSFT US EQUITY"));

    assertEquals("boom", ex.getMessage());
  }
}
