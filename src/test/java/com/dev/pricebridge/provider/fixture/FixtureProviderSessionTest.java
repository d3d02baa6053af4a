package com.dev.pricebridge.provider.fixture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dev.pricebridge.config.ProviderSettings;
import com.dev.pricebridge.provider.CorrelationId;
import com.dev.pricebridge.provider.ProviderEvent;
import com.dev.pricebridge.provider.ProviderEvent.EventType;
import com.dev.pricebridge.provider.ProviderMessage;
import com.dev.pricebridge.provider.ProviderSession;
import com.dev.pricebridge.provider.ReferenceDataRequest;
import com.dev.pricebridge.provider.SecurityData;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

/**
 * Unit tests for the fixture-backed provider session.
 */
class FixtureProviderSessionTest {

  private static final Duration SHORT = Duration.ofMillis(10);
  private static final String REFDATA = "//blp/refdata";

  private FixtureProviderSessionFactory factory;
  private ProviderSettings settings;

  @BeforeEach
  void setUp() {
    factory = new FixtureProviderSessionFactory(
        new ClassPathResource("fixtures/prices-test.json"), new ObjectMapper());
    settings = ProviderSettings.defaults();
  }

  private ProviderSession startedSession() {
    ProviderSession session = factory.create(settings);
    assertTrue(session.start());
    assertTrue(session.openService(REFDATA));
    return session;
  }

  private SecurityData requestOne(ProviderSession session, String security)
      throws InterruptedException {
    CorrelationId id = session.sendRequest(
        new ReferenceDataRequest(REFDATA).addSecurity(security).addField("PX_LAST"));
    ProviderEvent event;
    do {
      event = session.nextEvent(SHORT);
    } while (event.getEventType() != EventType.RESPONSE);
    ProviderMessage message = event.getMessages().get(0);
    assertTrue(message.isCorrelatedWith(id));
    return message.getSecurityData().get(0);
  }

  @Test
  void testStart_EmitsStatusEventsBeforeResponses() throws Exception {
    ProviderSession session = startedSession();

    assertEquals(EventType.SESSION_STATUS, session.nextEvent(SHORT).getEventType());
    assertEquals(EventType.SERVICE_STATUS, session.nextEvent(SHORT).getEventType());
  }

  @Test
  void testRequest_KnownPrice() throws Exception {
    SecurityData data = requestOne(startedSession(), "MSFT US EQUITY");

    assertTrue(data.hasField("PX_LAST"));
    assertEquals(312.5, data.getFieldAsDouble("PX_LAST"));
  }

  @Test
  void testRequest_NullPrice() throws Exception {
    SecurityData data = requestOne(startedSession(), "NULLPX US EQUITY");

    assertTrue(data.isNullValue("PX_LAST"));
  }

  @Test
  void testRequest_FieldException() throws Exception {
    SecurityData data = requestOne(startedSession(), "BADFLD US EQUITY");

    assertTrue(data.hasFieldExceptions());
    assertEquals("PX_LAST", data.getFieldExceptions().get(0).getFieldId());
  }

  @Test
  void testRequest_UnknownSecurity() throws Exception {
    SecurityData data = requestOne(startedSession(), "NOPE US EQUITY");

    assertTrue(data.hasSecurityError());
    assertEquals(FixtureProviderSession.UNKNOWN_SECURITY, data.getSecurityError().getMessage());
  }

  @Test
  void testRequest_SilentSecurity_TimesOut() throws Exception {
    ProviderSession session = startedSession();
    session.sendRequest(new ReferenceDataRequest(REFDATA)
        .addSecurity("SLOW US EQUITY").addField("PX_LAST"));

    session.nextEvent(SHORT);
    session.nextEvent(SHORT);
    assertEquals(EventType.TIMEOUT, session.nextEvent(SHORT).getEventType());
  }

  @Test
  void testRequest_NoSecurities_ResponseError() throws Exception {
    ProviderSession session = startedSession();
    session.sendRequest(new ReferenceDataRequest(REFDATA).addField("PX_LAST"));

    session.nextEvent(SHORT);
    session.nextEvent(SHORT);
    ProviderEvent event = session.nextEvent(SHORT);
    assertTrue(event.getMessages().get(0).hasResponseError());
  }

  @Test
  void testOpenService_UnknownService() {
    ProviderSession session = factory.create(settings);
    assertTrue(session.start());

    assertFalse(session.openService("//blp/mktdata"));
  }

  @Test
  void testSendRequest_WithoutService_Throws() {
    ProviderSession session = factory.create(settings);
    session.start();

    assertThrows(IllegalStateException.class, () -> session.sendRequest(
        new ReferenceDataRequest(REFDATA).addSecurity("MSFT US EQUITY")));
  }

  @Test
  void testStart_UnreadableFixture_ReturnsFalse() {
    FixtureProviderSessionFactory broken = new FixtureProviderSessionFactory(
        new ByteArrayResource("not json".getBytes(StandardCharsets.UTF_8)), new ObjectMapper());

    assertFalse(broken.create(settings).start());
  }

  @Test
  void testStart_MissingFixture_ReturnsFalse() {
    FixtureProviderSessionFactory missing = new FixtureProviderSessionFactory(
        new ClassPathResource("fixtures/does-not-exist.json"), new ObjectMapper());

    assertFalse(missing.create(settings).start());
  }

  @Test
  void testStop_NoRestart() {
    FixtureProviderSession session = (FixtureProviderSession) factory.create(settings);
    session.start();
    session.stop();

    assertTrue(session.isStopped());
    assertFalse(session.start());
  }

  @Test
  void testSecurityData_AbsentField() throws Exception {
    SecurityData data = requestOne(startedSession(), "NOPX US EQUITY");

    assertFalse(data.hasField("PX_LAST"));
    assertFalse(data.hasSecurityError());
    assertNull(data.getSecurityError());
  }
}
