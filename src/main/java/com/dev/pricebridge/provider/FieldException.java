package com.dev.pricebridge.provider;

/**
 * Provider-reported failure scoped to one requested field of one security.
 */
public class FieldException {

  private final String fieldId;
  private final ErrorInfo errorInfo;

  public FieldException(String fieldId, ErrorInfo errorInfo) {
    this.fieldId = fieldId;
    this.errorInfo = errorInfo;
  }

  public String getFieldId() {
    return fieldId;
  }

  public ErrorInfo getErrorInfo() {
    return errorInfo;
  }

  @Override
  public String toString() {
    return "FieldException[" + fieldId + ": " + errorInfo + "]";
  }
}
