package com.libragraph.forge.app;

import com.libragraph.forge.core.status.Outcome;
import com.libragraph.forge.core.status.StatusRegister;
import com.libragraph.forge.util.Html;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@Path("/")
public class HomeResource {

    @Inject
    StatusRegister statusRegister;

    @ConfigProperty(name = "forge.development", defaultValue = "false")
    boolean development;

    @GET
    public Response home() {
        Outcome outcome = statusRegister.get();
        StringBuilder items = new StringBuilder();
        for (String name : outcome.system().names()) {
            items.append("<li>").append(Html.escape(name)).append("</li>");
        }
        String html = "<!doctype html>"
                + "<html><head><meta charset='utf-8' /><title>Forge</title></head>"
                + "<body>"
                + "<h1>Forge</h1>"
                + "<p>Status: <strong id='status'>" + (outcome.isHealthy() ? "healthy" : "unhealthy") + "</strong>"
                + " (recorded " + Html.escape(outcome.recordedAt().toString()) + ")</p>"
                + "<p>Development mode: " + development + "</p>"
                + "<ul id='components'>" + items + "</ul>"
                + "</body></html>";
        return Response.ok(html, MediaType.TEXT_HTML_TYPE.withCharset("UTF-8")).build();
    }
}
