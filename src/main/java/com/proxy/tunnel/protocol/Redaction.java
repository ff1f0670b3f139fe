package com.proxy.tunnel.protocol;

/**
 * Marks internal diagnostic text inside error messages so that it can be stripped before a
 * message crosses the trust boundary to the client.
 *
 * <p>
 * Hidden text is enclosed between two invisible characters ({@code U+2062} and
 * {@code U+2063}). {@link #clean(String)} removes the enclosed text together with the markers,
 * {@link #reveal(String)} removes only the markers, for logs.
 */
public final class Redaction {

    public static final char BEGIN = '\u2062';
    public static final char END = '\u2063';

    private Redaction() {}

    public static String hide(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return BEGIN + strip(text) + END;
    }

    /**
     * Removes every hidden segment. An unterminated segment hides everything after its marker.
     */
    public static String clean(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(text.length());
        boolean hidden = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == BEGIN) {
                hidden = true;
            } else if (c == END) {
                hidden = false;
            } else if (!hidden) {
                out.append(c);
            }
        }
        return out.toString();
    }

    public static String reveal(String text) {
        return text == null ? "" : strip(text);
    }

    private static String strip(String text) {
        return text.replace(String.valueOf(BEGIN), "").replace(String.valueOf(END), "");
    }
}
