package com.dev.pricebridge.provider.fixture;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canned reference data for one security, as read from the fixture file.
 *
 * <pre>
 * "MSFT US EQUITY": { "fields": { "PX_LAST": 312.5 } },
 * "NODATA US EQUITY": { "fields": { "PX_LAST": null } },
 * "DELISTED US EQUITY": { "securityError": "Security is no longer active" },
 * "SLOW US EQUITY": { "silent": true }
 * </pre>
 */
public class FixtureSecurity {

  private Map<String, Double> fields = new LinkedHashMap<>();
  private Map<String, String> fieldExceptions = new LinkedHashMap<>();
  private String securityError;
  private boolean silent;

  public FixtureSecurity() {
    // For Jackson
  }

  public Map<String, Double> getFields() {
    return fields;
  }

  public void setFields(Map<String, Double> fields) {
    this.fields = fields == null ? new LinkedHashMap<>() : fields;
  }

  public Map<String, String> getFieldExceptions() {
    return fieldExceptions;
  }

  public void setFieldExceptions(Map<String, String> fieldExceptions) {
    this.fieldExceptions = fieldExceptions == null ? new LinkedHashMap<>() : fieldExceptions;
  }

  public String getSecurityError() {
    return securityError;
  }

  public void setSecurityError(String securityError) {
    this.securityError = securityError;
  }

  /**
   * A silent security never gets a response, so polling for it times out.
   */
  public boolean isSilent() {
    return silent;
  }

  public void setSilent(boolean silent) {
    this.silent = silent;
  }
}
