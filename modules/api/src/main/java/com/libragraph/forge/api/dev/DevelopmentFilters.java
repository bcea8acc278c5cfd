package com.libragraph.forge.api.dev;

import com.libragraph.forge.core.status.Outcome;
import com.libragraph.forge.core.status.StatusRegister;
import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;
import org.jboss.resteasy.reactive.server.ServerResponseFilter;

import java.util.Optional;

/**
 * Development-mode request/response filters. Inactive unless {@code forge.development=true}.
 * <ul>
 *   <li>While the status is unhealthy, application requests fail with the stored error,
 *       rendered by {@link ErrorPages}. Forge's own endpoints stay reachable.</li>
 *   <li>HTML string responses get the {@link RefreshScript} appended.</li>
 * </ul>
 */
public class DevelopmentFilters {

    @Inject
    StatusRegister statusRegister;

    @ConfigProperty(name = "forge.development", defaultValue = "false")
    boolean development;

    @ServerRequestFilter
    public Optional<Response> failWhileUnhealthy(ContainerRequestContext request) {
        if (!development || isForgePath(request.getUriInfo().getPath())) {
            return Optional.empty();
        }
        Outcome outcome = statusRegister.get();
        if (outcome instanceof Outcome.Unhealthy unhealthy) {
            boolean html = ErrorPages.acceptsHtml(request.getHeaderString(HttpHeaders.ACCEPT));
            return Optional.of(ErrorPages.serverError(unhealthy.error(), html));
        }
        return Optional.empty();
    }

    @ServerResponseFilter
    public void appendRefreshScript(ContainerResponseContext response) {
        if (!development) {
            return;
        }
        MediaType type = response.getMediaType();
        if (type == null || !type.isCompatible(MediaType.TEXT_HTML_TYPE)) {
            return;
        }
        if (response.getEntity() instanceof String body && !RefreshScript.isPresent(body)) {
            response.setEntity(body + RefreshScript.tag());
        }
    }

    /** Paths served by Forge itself or by Quarkus, exempt from the unhealthy gate. */
    static boolean isForgePath(String path) {
        String normalized = path.startsWith("/") ? path.substring(1) : path;
        return normalized.startsWith("api/") || normalized.startsWith("q/");
    }
}
