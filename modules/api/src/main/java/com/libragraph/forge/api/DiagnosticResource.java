package com.libragraph.forge.api;

import com.libragraph.forge.core.lifecycle.LifecycleSupervisor;
import com.libragraph.forge.core.status.Outcome;
import com.libragraph.forge.core.system.SystemMap;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-level diagnostics. Answers even while the system is unhealthy.
 */
@Path("/api/diagnostic")
@Produces(MediaType.APPLICATION_JSON)
public class DiagnosticResource {

    @ConfigProperty(name = "quarkus.application.name")
    String appName;

    @ConfigProperty(name = "quarkus.application.version")
    String appVersion;

    @ConfigProperty(name = "quarkus.profile", defaultValue = "prod")
    String profile;

    @ConfigProperty(name = "forge.development", defaultValue = "false")
    boolean development;

    @Inject
    LifecycleSupervisor supervisor;

    /** Liveness of the process plus a one-word system state. */
    @GET
    @Path("/ping")
    public Map<String, String> ping() {
        Outcome outcome = supervisor.status().get();
        return Map.of(
                "status", "ok",
                "system", outcome.isHealthy() ? StatusView.HEALTHY : StatusView.UNHEALTHY
        );
    }

    @GET
    @Path("/info")
    public Map<String, Object> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", appName);
        info.put("version", appVersion);
        info.put("java", System.getProperty("java.version"));
        info.put("profile", profile);
        info.put("development", development);
        info.put("defaultConstructor", supervisor.hasDefaultConstructor());
        info.put("transitionInProgress", supervisor.isTransitionInProgress());
        info.put("components", supervisor.current().map(SystemMap::names).orElse(List.of()));
        return info;
    }
}
