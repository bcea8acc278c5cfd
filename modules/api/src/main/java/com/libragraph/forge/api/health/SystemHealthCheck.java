package com.libragraph.forge.api.health;

import com.libragraph.forge.core.status.Outcome;
import com.libragraph.forge.core.status.StatusRegister;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class SystemHealthCheck implements HealthCheck {

    @Inject
    StatusRegister statusRegister;

    @Override
    public HealthCheckResponse call() {
        Outcome outcome = statusRegister.get();
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("system")
                .withData("components", String.join(",", outcome.system().names()));

        if (outcome instanceof Outcome.Unhealthy unhealthy) {
            return builder.down()
                    .withData("error", String.valueOf(unhealthy.error().getMessage()))
                    .withData("failingKey", unhealthy.failingKey().orElse(""))
                    .build();
        }
        return builder.up().build();
    }
}
