package com.dev.pricebridge.controller;

import com.dev.pricebridge.dto.ApiErrorResponse;
import com.dev.pricebridge.exception.BadRequestException;
import com.dev.pricebridge.exception.NotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Centralized exception handling for REST controllers.
 *
 * <p>Every failure is reported as {@code {"error": "..."}} with the matching
 * HTTP status.</p>
 */
@ControllerAdvice
public class GlobalExceptionHandler {

  /**
   * Maps {@link BadRequestException} to HTTP 400 Bad Request.
   */
  @ExceptionHandler(BadRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleBadRequestException(BadRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ex.getMessage()));
  }

  /**
   * Maps {@link NotFoundException} to HTTP 404 Not Found.
   */
  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFoundException(NotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ex.getMessage()));
  }
}
