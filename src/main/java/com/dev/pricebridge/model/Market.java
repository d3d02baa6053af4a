package com.dev.pricebridge.model;

/**
 * Market a ticker was assumed to trade on when it was normalized.
 */
public enum Market {
  JAPAN,
  US,
  /** Dotted ticker with a suffix the normalizer does not recognise. */
  UNKNOWN
}
