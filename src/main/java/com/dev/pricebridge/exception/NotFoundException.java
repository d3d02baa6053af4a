package com.dev.pricebridge.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when no price could be obtained for a ticker.
 */
@ResponseStatus(HttpStatus.NOT_FOUND)
public class NotFoundException extends RuntimeException {

  /**
   * Constructs a NotFoundException with the specified detail message.
   *
   * @param message the detail message
   */
  public NotFoundException(String message) {
    super(message);
  }
}
