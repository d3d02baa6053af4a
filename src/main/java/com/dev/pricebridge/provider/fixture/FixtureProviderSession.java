package com.dev.pricebridge.provider.fixture;

import com.dev.pricebridge.config.ProviderSettings;
import com.dev.pricebridge.provider.CorrelationId;
import com.dev.pricebridge.provider.ErrorInfo;
import com.dev.pricebridge.provider.FieldException;
import com.dev.pricebridge.provider.ProviderEvent;
import com.dev.pricebridge.provider.ProviderEvent.EventType;
import com.dev.pricebridge.provider.ProviderMessage;
import com.dev.pricebridge.provider.ProviderSession;
import com.dev.pricebridge.provider.ReferenceDataRequest;
import com.dev.pricebridge.provider.SecurityData;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

/**
 * Provider session that answers reference data requests from a JSON fixture.
 *
 * <p>Events are queued the way a live session delivers them: a session status
 * event on start, a service status event on open, then one {@code RESPONSE}
 * event per request. When the queue is empty {@link #nextEvent} waits out the
 * timeout and returns a {@code TIMEOUT} event.</p>
 */
class FixtureProviderSession implements ProviderSession {

  private static final Logger log = LoggerFactory.getLogger(FixtureProviderSession.class);

  private static final TypeReference<Map<String, FixtureSecurity>> FIXTURE_TYPE =
          new TypeReference<>() { };

  static final String UNKNOWN_SECURITY = "Unknown/Invalid security";

  private final Resource fixture;
  private final ObjectMapper mapper;
  private final ProviderSettings settings;

  private final Deque<ProviderEvent> pending = new ArrayDeque<>();
  private Map<String, FixtureSecurity> securities = Map.of();
  private boolean started;
  private boolean serviceOpen;
  private boolean stopped;
  private long nextCorrelationId = 1;

  FixtureProviderSession(Resource fixture, ObjectMapper mapper, ProviderSettings settings) {
    this.fixture = fixture;
    this.mapper = mapper;
    this.settings = settings;
  }

  @Override
  public boolean start() {
    if (stopped) {
      return false;
    }
    try (InputStream in = fixture.getInputStream()) {
      Map<String, FixtureSecurity> loaded = mapper.readValue(in, FIXTURE_TYPE);
      securities = loaded == null ? Map.of() : loaded;
    } catch (IOException e) {
      log.warn("Cannot load provider fixture {} for {}: {}",
              fixture.getDescription(), settings.endpoint(), e.getMessage());
      return false;
    }
    started = true;
    pending.add(statusEvent(EventType.SESSION_STATUS, "SessionStarted"));
    log.debug("Fixture session started for {} with {} securities",
            settings.endpoint(), securities.size());
    return true;
  }

  @Override
  public boolean openService(String service) {
    if (!started || stopped || !FixtureProviderSessionFactory.REFDATA_SERVICE.equals(service)) {
      return false;
    }
    serviceOpen = true;
    pending.add(statusEvent(EventType.SERVICE_STATUS, "ServiceOpened"));
    return true;
  }

  @Override
  public CorrelationId sendRequest(ReferenceDataRequest request) {
    if (!serviceOpen || stopped) {
      throw new IllegalStateException("Service " + request.getService() + " is not open");
    }
    CorrelationId correlationId = new CorrelationId(nextCorrelationId++);

    if (request.getSecurities().isEmpty()) {
      ProviderMessage message = new ProviderMessage("ReferenceDataResponse", correlationId,
              new ErrorInfo("BAD_ARGS", "No securities specified"), List.of());
      pending.add(new ProviderEvent(EventType.RESPONSE, List.of(message)));
      return correlationId;
    }

    List<SecurityData> records = new ArrayList<>();
    for (String security : request.getSecurities()) {
      FixtureSecurity canned = securities.get(security);
      if (canned != null && canned.isSilent()) {
        // the whole request goes unanswered
        return correlationId;
      }
      records.add(toSecurityData(security, canned, request.getFields()));
    }
    ProviderMessage message =
            new ProviderMessage("ReferenceDataResponse", correlationId, null, records);
    pending.add(new ProviderEvent(EventType.RESPONSE, List.of(message)));
    return correlationId;
  }

  @Override
  public ProviderEvent nextEvent(Duration timeout) throws InterruptedException {
    ProviderEvent next = pending.poll();
    if (next != null) {
      return next;
    }
    TimeUnit.MILLISECONDS.sleep(timeout.toMillis());
    return ProviderEvent.timeout();
  }

  @Override
  public void stop() {
    stopped = true;
    started = false;
    serviceOpen = false;
    pending.clear();
  }

  boolean isStopped() {
    return stopped;
  }

  private static SecurityData toSecurityData(String security, FixtureSecurity canned,
                                             List<String> requestedFields) {
    if (canned == null) {
      return new SecurityData(security, List.of(),
              new ErrorInfo("BAD_SEC", UNKNOWN_SECURITY), null);
    }
    if (canned.getSecurityError() != null) {
      return new SecurityData(security, List.of(),
              new ErrorInfo("BAD_SEC", canned.getSecurityError()), null);
    }

    List<FieldException> fieldExceptions = new ArrayList<>();
    Map<String, Double> fieldData = new LinkedHashMap<>();
    for (String field : requestedFields) {
      String fieldError = canned.getFieldExceptions().get(field);
      if (fieldError != null) {
        fieldExceptions.add(new FieldException(field, new ErrorInfo("BAD_FLD", fieldError)));
      } else if (canned.getFields().containsKey(field)) {
        fieldData.put(field, canned.getFields().get(field));
      }
    }
    return new SecurityData(security, fieldExceptions, null, fieldData);
  }

  private static ProviderEvent statusEvent(EventType type, String messageType) {
    return new ProviderEvent(type, List.of(ProviderMessage.status(messageType)));
  }
}
