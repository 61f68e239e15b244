package com.libragraph.sift.core.health;

import com.libragraph.sift.core.scan.ScanService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Ready once the parser registry is frozen and scans are accepted.
 */
@Readiness
@ApplicationScoped
public class ScanServiceHealthCheck implements HealthCheck {

    @Inject
    ScanService scanService;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder response = HealthCheckResponse.named(scanService.serviceId())
                .withData("state", scanService.state().name())
                .withData("since", scanService.since().toString());
        if (!scanService.isRunning()) {
            scanService.failure().ifPresent(e -> response.withData("error", String.valueOf(e.getMessage())));
            return response.down().build();
        }
        return response
                .withData("parsers", scanService.registry().size())
                .up()
                .build();
    }
}
