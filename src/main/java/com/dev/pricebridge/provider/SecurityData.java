package com.dev.pricebridge.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One per-security record of a reference data response.
 *
 * <p>A record carries either a security-level error, or field data together
 * with any field-level exceptions. Field data may hold a field whose value is
 * present but null; {@link #hasField(String)} and {@link #isNullValue(String)}
 * tell the two cases apart.</p>
 */
public class SecurityData {

  private final String security;
  private final List<FieldException> fieldExceptions;
  private final ErrorInfo securityError;
  private final Map<String, Double> fieldData;

  /**
   * Creates a per-security record.
   *
   * @param security provider symbol this record is about
   * @param fieldExceptions field-level errors, may be empty
   * @param securityError security-level error, or null
   * @param fieldData field values keyed by field name; values may be null
   */
  public SecurityData(String security,
                      List<FieldException> fieldExceptions,
                      ErrorInfo securityError,
                      Map<String, Double> fieldData) {
    this.security = security;
    this.fieldExceptions = fieldExceptions == null
            ? List.of() : List.copyOf(fieldExceptions);
    this.securityError = securityError;
    // LinkedHashMap: Map.copyOf rejects null values
    this.fieldData = fieldData == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fieldData));
  }

  public String getSecurity() {
    return security;
  }

  public List<FieldException> getFieldExceptions() {
    return fieldExceptions;
  }

  public boolean hasFieldExceptions() {
    return !fieldExceptions.isEmpty();
  }

  public ErrorInfo getSecurityError() {
    return securityError;
  }

  public boolean hasSecurityError() {
    return securityError != null;
  }

  public boolean hasField(String field) {
    return fieldData.containsKey(field);
  }

  public boolean isNullValue(String field) {
    return fieldData.containsKey(field) && fieldData.get(field) == null;
  }

  /**
   * Returns the numeric value of a field.
   *
   * @param field field name, e.g. PX_LAST
   * @return the value
   * @throws IllegalStateException if the field is absent or null
   */
  public double getFieldAsDouble(String field) {
    Double value = fieldData.get(field);
    if (value == null) {
      throw new IllegalStateException("Field " + field + " has no value for " + security);
    }
    return value;
  }

  @Override
  public String toString() {
    return "SecurityData[security=" + security
            + ", fieldExceptions=" + fieldExceptions
            + ", securityError=" + securityError
            + ", fieldData=" + fieldData + "]";
  }
}
