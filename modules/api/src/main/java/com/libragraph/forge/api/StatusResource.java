package com.libragraph.forge.api;

import com.libragraph.forge.core.status.StatusRegister;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

/**
 * Publishes the {@link StatusRegister}: the current outcome, and a long-poll
 * that completes on the next change. Browsers in development mode use the
 * long-poll to reload pages after a reset.
 */
@Path("/api/status")
@Produces(MediaType.APPLICATION_JSON)
public class StatusResource {

    private static final Logger log = Logger.getLogger(StatusResource.class);

    @Inject
    StatusRegister statusRegister;

    @ConfigProperty(name = "forge.status.await-timeout", defaultValue = "PT5M")
    Duration awaitTimeout;

    @GET
    public StatusView current() {
        return StatusView.from(statusRegister.get());
    }

    /**
     * Completes with 204 once the status changes, or 408 after
     * {@code forge.status.await-timeout}. Either way the waiter is released.
     */
    @GET
    @Path("/next")
    public CompletionStage<Response> next() {
        return statusRegister.nextChange()
                .orTimeout(awaitTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((outcome, error) -> {
                    if (error != null) {
                        log.debugf("Status long-poll ended without change: %s", error.toString());
                        return Response.status(Response.Status.REQUEST_TIMEOUT)
                                .header("Access-Control-Allow-Origin", "*")
                                .build();
                    }
                    return Response.noContent()
                            .header("Access-Control-Allow-Origin", "*")
                            .build();
                });
    }
}
