package org.dxworks.rfcmark.renderer;

import java.util.regex.Pattern;

/**
 * Escaping of prose so that it reads as text, not markup.
 */
public final class MarkdownEscaper {

    private static final Pattern ENTITY = Pattern.compile("&(#[0-9]{1,7}|#[xX][0-9a-fA-F]{1,6}|[A-Za-z][A-Za-z0-9]{1,31});");
    private static final Pattern ORDERED_MARKER = Pattern.compile("\\d{1,9}[.)]");
    private static final Pattern UNSAFE_START = Pattern.compile(
            "#{1,6}|[-+:|]|\\d{1,9}[.)]|=+|-+|(```|~~~).*");

    private MarkdownEscaper() {
    }

    /** Backslash-escapes the inline markup characters and turns angle brackets into entities. */
    public static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\', '*', '_', '`', '[', ']' -> sb.append('\\').append(c);
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '&' -> sb.append(ENTITY.matcher(text).region(i, text.length()).lookingAt() ? "&amp;" : "&");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * True when a line starting with this word would open a block: a heading, a list item,
     * a setext underline or thematic break, a fence, a table row or a definition.
     */
    public static boolean isUnsafeLineStart(String word) {
        return UNSAFE_START.matcher(word).matches();
    }

    /** Makes a word that would open a block read as text at the start of a line. */
    public static String escapeLineStart(String word) {
        if (!isUnsafeLineStart(word) || word.startsWith("```")) {
            // backtick runs at a line start only come from code spans
            return word;
        }
        if (ORDERED_MARKER.matcher(word).matches()) {
            int last = word.length() - 1;
            return word.substring(0, last) + "\\" + word.charAt(last);
        }
        return "\\" + word;
    }

    /** Heading text ending in '#' would lose it as a closing sequence. */
    public static String escapeHeadingEnd(String text) {
        if (text.endsWith("#") && !text.endsWith("\\#")) {
            return text.substring(0, text.length() - 1) + "\\#";
        }
        return text;
    }
}
