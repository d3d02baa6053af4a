package com.dev.pricebridge.service;

import com.dev.pricebridge.model.Market;
import com.dev.pricebridge.model.NormalizedTicker;
import java.util.Locale;

/**
 * Turns a loosely formatted ticker into a provider symbol.
 *
 * <p>Rules, first match wins:</p>
 * <ol>
 *   <li>Digits only ("7203"): Tokyo listing, {@code "7203 JT EQUITY"}.</li>
 *   <li>Contains a dot: the part after the first dot is the market suffix.
 *   {@code "7203.T"} becomes {@code "7203 JT EQUITY"}; any other suffix gives
 *   {@code "{code} EQUITY"} with no exchange code.</li>
 *   <li>Anything else ("msft"): US listing, {@code "MSFT US EQUITY"}.</li>
 * </ol>
 *
 * <p><b>Limitations:</b> this is a guess, not a symbol resolver. Listings
 * outside the US and Tokyo, and dotted suffixes other than {@code T}, come out
 * wrong or incomplete (e.g. "BP.L" becomes "BP EQUITY"). Changing the mapping
 * is a product decision.</p>
 */
public final class TickerNormalizer {

  static final String JAPAN_SUFFIX = " JT EQUITY";
  static final String US_SUFFIX = " US EQUITY";
  static final String EQUITY_SUFFIX = " EQUITY";
  static final String TOKYO_MARKET = "T";

  private TickerNormalizer() {
  }

  /**
   * Normalizes a raw ticker.
   *
   * @param raw non-empty ticker as received from the client
   * @return the provider symbol and the market it was assumed to trade on
   */
  public static NormalizedTicker normalize(String raw) {
    if (isAllDigits(raw)) {
      return new NormalizedTicker(raw, raw + JAPAN_SUFFIX, Market.JAPAN);
    }

    int dot = raw.indexOf('.');
    if (dot >= 0) {
      String code = raw.substring(0, dot);
      String suffix = raw.substring(dot + 1).toUpperCase(Locale.ROOT);
      if (TOKYO_MARKET.equals(suffix)) {
        return new NormalizedTicker(raw, code + JAPAN_SUFFIX, Market.JAPAN);
      }
      return new NormalizedTicker(raw, code + EQUITY_SUFFIX, Market.UNKNOWN);
    }

    return new NormalizedTicker(raw, raw.toUpperCase(Locale.ROOT) + US_SUFFIX, Market.US);
  }

  private static boolean isAllDigits(String s) {
    if (s.isEmpty()) {
      return false;
    }
    for (int i = 0; i < s.length(); i++) {
      if (!Character.isDigit(s.charAt(i))) {
        return false;
      }
    }
    return true;
  }
}
