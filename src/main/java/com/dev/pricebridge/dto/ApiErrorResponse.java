package com.dev.pricebridge.dto;

/**
 * Error payload returned by the price API: {@code {"error": "..."}}.
 */
public class ApiErrorResponse {

  private final String error;

  /**
   * Creates a new API error response.
   *
   * @param error human-readable error description
   */
  public ApiErrorResponse(String error) {
    this.error = error;
  }

  public String getError() {
    return error;
  }
}
