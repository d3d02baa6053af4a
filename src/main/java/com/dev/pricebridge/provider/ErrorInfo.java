package com.dev.pricebridge.provider;

/**
 * Error details attached by the provider to a response, a security or a field.
 */
public class ErrorInfo {

  private final String category;
  private final String message;

  /**
   * Creates provider error details.
   *
   * @param category provider error category (e.g. BAD_SEC, BAD_FLD), may be null
   * @param message human-readable message
   */
  public ErrorInfo(String category, String message) {
    this.category = category;
    this.message = message;
  }

  public String getCategory() {
    return category;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return "ErrorInfo[category=" + category + ", message=" + message + "]";
  }
}
