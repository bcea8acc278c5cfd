package com.libragraph.forge.api.dev;

import com.libragraph.forge.util.Html;

/**
 * Builds the script injected into HTML pages in development mode. The script
 * long-polls the status endpoint and reloads the page when the status changes,
 * i.e. after every reset or stop.
 */
public final class RefreshScript {

    static final String STATUS_PATH = "/api/status/next";

    private RefreshScript() {
    }

    public static String render() {
        return """
                (function forgeAwaitStatus() {
                  fetch('%s')
                    .then(res => {
                      if (res.ok) window.location.reload()
                      else if (res.status === 408) forgeAwaitStatus()
                      else return Promise.reject(res.status)
                    })
                    .catch(() => {
                      %s
                    })
                })()
                """.formatted(STATUS_PATH,
                warning("Lost connection to status server. Consider refreshing."));
    }

    /** The script wrapped in a {@code <script>} element, ready to append to a page. */
    public static String tag() {
        return "<script>" + render() + "</script>";
    }

    /** Whether {@code html} already carries the script. */
    static boolean isPresent(String html) {
        return html.contains("fetch('" + STATUS_PATH + "')");
    }

    /** Script that logs {@code text} and shows it in a dismissable popup. */
    static String warning(String text) {
        return "console.warn('" + Html.jsString(text) + "')\n"
                + "document.body.insertAdjacentHTML('beforeend', '" + Html.jsString(popup(text)) + "')";
    }

    private static String popup(String text) {
        return "<div id='forgeRefreshContainer' style='"
                + "position: fixed; bottom: 1rem; left: 1rem; margin-right: 1rem; padding: 0; "
                + "font-family: monospace; display: flex; flex-direction: row; align-items: stretch; "
                + "background-color: lightgoldenrodyellow; box-shadow: 0 0 3px -1px gray;'>"
                + "<span style='padding: 1rem'>" + Html.escape(text) + "</span>"
                + "<button onclick='forgeRefreshContainer.remove()' style='"
                + "padding: 1rem; cursor: pointer; font-family: inherit; font-size: inherit; "
                + "border: none; background-color: khaki;'>"
                + "Close"
                + "</button>"
                + "</div>";
    }
}
