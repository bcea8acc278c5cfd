package com.libragraph.forge.api.dev;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Maps unhandled exceptions to a 500. Clients accepting HTML get the stack-trace
 * page with the refresh script in development mode; everyone else gets a JSON body.
 */
public class ErrorMapper {

    private static final Logger log = Logger.getLogger(ErrorMapper.class);

    @ConfigProperty(name = "forge.development", defaultValue = "false")
    boolean development;

    @ServerExceptionMapper
    public Response mapException(Exception error, HttpHeaders headers) {
        if (error instanceof WebApplicationException webError) {
            return webError.getResponse();
        }
        log.errorf(error, "Unhandled exception: %s", error.getMessage());
        if (development && ErrorPages.acceptsHtml(headers.getHeaderString(HttpHeaders.ACCEPT))) {
            // mapped responses bypass the response filters
            return ErrorPages.refreshingServerError(error);
        }
        return ErrorPages.serverError(error, false);
    }
}
