package com.flagship.escrow_engine.health;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import com.flagship.escrow_engine.gateway.GatewayProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness/readiness probe for the load balancer.
 *
 * Only the database decides UP or DOWN. An open gateway circuit is reported
 * but keeps the instance in rotation: contract work and webhooks still run.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final CircuitBreaker gatewayCircuitBreaker;
    private final GatewayProperties gatewayProperties;
    private final Clock clock;

    public HealthController(DataSource dataSource,
                            @Qualifier("gatewayCircuitBreaker") CircuitBreaker gatewayCircuitBreaker,
                            GatewayProperties gatewayProperties,
                            Clock clock) {
        this.dataSource = dataSource;
        this.gatewayCircuitBreaker = gatewayCircuitBreaker;
        this.gatewayProperties = gatewayProperties;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        boolean dbHealthy = checkDatabase();
        response.put("status", dbHealthy ? "UP" : "DOWN");
        response.put("timestamp", clock.instant().toString());
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("gateway", Map.of(
                "provider", gatewayProperties.getProvider(),
                "circuit", gatewayCircuitBreaker.getState().name()));

        if (!dbHealthy) {
            return ResponseEntity.status(503).body(response);
        }
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }
}
