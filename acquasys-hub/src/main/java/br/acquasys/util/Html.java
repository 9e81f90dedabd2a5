package br.acquasys.util;

/**
 * Escaping for text embedded in Telegram HTML parse-mode messages.
 */
public final class Html {

    private Html() {}

    /**
     * Escape {@code &}, {@code <} and {@code >}. Null becomes the empty string.
     */
    public static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
