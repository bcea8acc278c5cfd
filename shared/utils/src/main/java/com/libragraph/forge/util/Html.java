package com.libragraph.forge.util;

/**
 * Minimal escaping for text placed into HTML markup or single-quoted JavaScript strings.
 */
public final class Html {

    private Html() {
    }

    /** Replaces {@code & < > " '} with character entities. Null yields an empty string. */
    public static String escape(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&apos;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /** Escapes backslashes, single quotes and line breaks for a {@code '...'} JavaScript literal. */
    public static String jsString(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\\", "\\\\")
                .replace("'", "\\'")
                .replace("\n", "\\n")
                .replace("\r", "");
    }
}
