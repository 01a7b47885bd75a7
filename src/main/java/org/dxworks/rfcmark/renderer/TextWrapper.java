package org.dxworks.rfcmark.renderer;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy word wrapping of rendered inline Markdown.
 *
 * Lines break at spaces only. A break is never placed before a word that would start a
 * block at the beginning of a line, so such a line runs past the width instead.
 */
public class TextWrapper {

    static final int MIN_WIDTH = 20;

    private final int width;

    /** A width of 0 or less keeps the text on one line. */
    public TextWrapper(int width) {
        this.width = width;
    }

    /** Wrapper for content indented by the given number of columns. */
    public TextWrapper indented(int indent) {
        if (width <= 0) {
            return this;
        }
        return new TextWrapper(Math.max(MIN_WIDTH, width - indent));
    }

    public int getWidth() {
        return width;
    }

    public List<String> wrap(String text) {
        List<String> words = new ArrayList<>();
        for (String word : text.split(" ")) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        if (words.isEmpty()) {
            return List.of();
        }
        if (width <= 0) {
            return List.of(String.join(" ", words));
        }

        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder(words.get(0));
        for (int i = 1; i < words.size(); i++) {
            String word = words.get(i);
            boolean fits = line.length() + 1 + word.length() <= width;
            if (fits || MarkdownEscaper.isUnsafeLineStart(word)) {
                line.append(' ').append(word);
            } else {
                lines.add(line.toString());
                line = new StringBuilder(word);
            }
        }
        lines.add(line.toString());
        return lines;
    }
}
