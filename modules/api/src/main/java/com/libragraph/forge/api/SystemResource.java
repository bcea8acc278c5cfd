package com.libragraph.forge.api;

import com.libragraph.forge.core.lifecycle.LifecycleSupervisor;
import com.libragraph.forge.core.lifecycle.SystemLifecycleException;
import com.libragraph.forge.core.status.StatusRegister;
import jakarta.inject.Inject;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Development-only controls for the {@link LifecycleSupervisor}. Responds with
 * the resulting {@link StatusView}: 200 on success, 500 when the transition failed.
 */
@Path("/api/system")
@Produces(MediaType.APPLICATION_JSON)
public class SystemResource {

    private static final Logger log = Logger.getLogger(SystemResource.class);

    @Inject
    LifecycleSupervisor supervisor;

    @Inject
    StatusRegister statusRegister;

    @ConfigProperty(name = "forge.development", defaultValue = "false")
    boolean development;

    @POST
    @Path("/reset")
    public Response reset() {
        return transition("reset", supervisor::reset);
    }

    @POST
    @Path("/stop")
    public Response stop() {
        return transition("stop", supervisor::stop);
    }

    private Response transition(String name, Supplier<?> action) {
        if (!development) {
            return Response.status(Response.Status.FORBIDDEN)
                    .entity(Map.of("error", "system " + name + " is only available in development mode"))
                    .build();
        }
        try {
            action.get();
            return Response.ok(StatusView.from(statusRegister.get())).build();
        } catch (SystemLifecycleException | IllegalStateException e) {
            log.warnf("System %s via API failed: %s", name, e.getMessage());
            return Response.serverError()
                    .entity(StatusView.from(statusRegister.get()))
                    .build();
        }
    }
}
