package com.dev.pricebridge.controller;

import com.dev.pricebridge.config.ProviderSettings;
import com.dev.pricebridge.provider.ProviderSession;
import com.dev.pricebridge.provider.ProviderSessionFactory;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Controller for system health checks.
 * Probes the market data provider with a throwaway session.
 */
@RestController
@RequestMapping("/health")
public class HealthController {

  private static final Logger log = LoggerFactory.getLogger(HealthController.class);

  private final ProviderSessionFactory sessionFactory;
  private final ProviderSettings settings;

  /**
   * Constructor with dependency injection.
   *
   * @param sessionFactory creates the probe session
   * @param settings provider endpoint and service
   */
  @Autowired
  public HealthController(ProviderSessionFactory sessionFactory, ProviderSettings settings) {
    this.sessionFactory = sessionFactory;
    this.settings = settings;
  }

  /**
   * Health check endpoint.
   * The provider is healthy when a session starts and the reference data
   * service opens. The probe session is always stopped.
   *
   * @return ResponseEntity with the health status
   */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, String> components = new HashMap<>();
    boolean healthy = probeProvider();
    components.put("providerSession", healthy ? "healthy" : "unhealthy");
    components.put("providerEndpoint", settings.endpoint());

    Map<String, Object> health = new HashMap<>();
    health.put("status", healthy ? "ok" : "degraded");
    health.put("timestamp", Instant.now().toString());
    health.put("components", components);
    health.put("version", "0.0.1-SNAPSHOT");

    return ResponseEntity.ok(health);
  }

  private boolean probeProvider() {
    ProviderSession session;
    try {
      session = sessionFactory.create(settings);
    } catch (RuntimeException e) {
      log.warn("Health probe could not create a provider session: {}", e.getMessage());
      return false;
    }
    try {
      return session.start() && session.openService(settings.getService());
    } catch (RuntimeException e) {
      log.warn("Health probe failed against {}: {}", settings.endpoint(), e.getMessage());
      return false;
    } finally {
      try {
        session.stop();
      } catch (RuntimeException e) {
        log.warn("Health probe could not stop its session: {}", e.getMessage());
      }
    }
  }
}
