package com.libragraph.forge.api.dev;

import com.libragraph.forge.core.lifecycle.SystemLifecycleException;
import com.libragraph.forge.util.Html;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Renders exceptions as an HTML stack-trace page (development) or a small JSON body.
 */
public final class ErrorPages {

    private static final String STYLE = """
            body { margin: 0; background: #fdfdfd; }
            .errors { margin: 0; padding: 1rem; font-family: monospace; line-height: 1.4; }
            .error-header { margin: 0 0 0.5rem; font-size: 1.2rem; color: #b00020; }
            .error-data { margin: 0 0 0.5rem; font-size: 1rem; color: #555; }
            .frame { display: block; color: #333; }
            .frame.app { color: darkcyan; }
            .caused-by { display: block; margin-top: 1rem; color: #888; }
            """;

    private ErrorPages() {
    }

    /** Whether an {@code Accept} header value admits an HTML response. */
    public static boolean acceptsHtml(String accept) {
        return accept != null && (accept.contains("text/html") || accept.contains("*/*"));
    }

    /** 500 response: the HTML page when {@code html} is set, otherwise JSON. */
    public static Response serverError(Throwable error, boolean html) {
        if (html) {
            return htmlError(render(error));
        }
        return Response.serverError()
                .type(MediaType.APPLICATION_JSON_TYPE)
                .entity(Map.of(
                        "error", error.getClass().getName(),
                        "message", String.valueOf(error.getMessage())))
                .build();
    }

    /** HTML 500 page that reloads itself after the next status change. */
    public static Response refreshingServerError(Throwable error) {
        return htmlError(render(error) + RefreshScript.tag());
    }

    private static Response htmlError(String page) {
        return Response.serverError()
                .type(MediaType.TEXT_HTML_TYPE.withCharset("UTF-8"))
                .entity(page)
                .build();
    }

    /** Full HTML document for {@code error} and its cause chain. */
    public static String render(Throwable error) {
        return "<!doctype html>"
                + "<html>"
                + "<head>"
                + "<meta charset='utf-8' />"
                + "<title>Error Stacktrace</title>"
                + "<style>" + STYLE + "</style>"
                + "<link rel='icon' href='data:;base64,=' />"
                + "</head>"
                + "<body>"
                + "<pre class='errors'>" + markup(error) + "</pre>"
                + "</body>"
                + "</html>";
    }

    static String markup(Throwable error) {
        StringBuilder sb = new StringBuilder();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = error;
        boolean first = true;
        while (current != null && seen.add(current)) {
            if (!first) {
                sb.append("<span class='caused-by'>Caused by:</span>");
            }
            appendThrowable(sb, current);
            for (Throwable suppressed : current.getSuppressed()) {
                sb.append("<span class='caused-by'>Suppressed:</span>");
                appendThrowable(sb, suppressed);
            }
            first = false;
            current = current.getCause();
        }
        return sb.toString();
    }

    private static void appendThrowable(StringBuilder sb, Throwable error) {
        sb.append("<h1 class='error-header'>")
                .append(Html.escape(error.getClass().getName()))
                .append(": ")
                .append(Html.escape(error.getMessage()))
                .append("</h1>");

        if (error instanceof SystemLifecycleException lifecycle) {
            sb.append("<h2 class='error-data'>")
                    .append("failing component: ")
                    .append(Html.escape(lifecycle.failingKey().orElse("none")))
                    .append(", partial system: ")
                    .append(Html.escape(lifecycle.partialSystem().names().toString()))
                    .append("</h2>");
        }

        for (StackTraceElement frame : error.getStackTrace()) {
            boolean app = frame.getClassName().startsWith("com.libragraph.");
            sb.append("<span class='frame").append(app ? " app" : "").append("'>")
                    .append("    at ")
                    .append(Html.escape(frame.toString()))
                    .append("</span>");
        }
    }
}
