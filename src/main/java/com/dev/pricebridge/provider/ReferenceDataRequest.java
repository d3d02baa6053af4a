package com.dev.pricebridge.provider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Request for the current values of named fields on named securities.
 */
public class ReferenceDataRequest {

  private final String service;
  private final List<String> securities = new ArrayList<>();
  private final List<String> fields = new ArrayList<>();

  /**
   * Creates an empty request against a provider service.
   *
   * @param service service the request is sent to, e.g. //blp/refdata
   */
  public ReferenceDataRequest(String service) {
    this.service = service;
  }

  public ReferenceDataRequest addSecurity(String security) {
    securities.add(security);
    return this;
  }

  public ReferenceDataRequest addField(String field) {
    fields.add(field);
    return this;
  }

  public String getService() {
    return service;
  }

  public List<String> getSecurities() {
    return Collections.unmodifiableList(securities);
  }

  public List<String> getFields() {
    return Collections.unmodifiableList(fields);
  }

  @Override
  public String toString() {
    return "ReferenceDataRequest[service=" + service
            + ", securities=" + securities + ", fields=" + fields + "]";
  }
}
