package org.dxworks.rfcmark;

/**
 * Immutable options of a single conversion.
 */
public final class ConversionOptions {

    public static final int DEFAULT_MAX_HEADING_LEVEL = 6;
    public static final int DEFAULT_REFLOW_WIDTH = 0;

    /** Visible text of a resolved cross-reference without text content of its own. */
    public enum XrefText {
        NUMBER,
        TITLE
    }

    private final int maxHeadingLevel;
    private final int reflowWidth;
    private final boolean numberingInHeadings;
    private final boolean tolerateUnknown;
    private final XrefText xrefText;
    private final boolean frontMatter;

    private ConversionOptions(Builder builder) {
        this.maxHeadingLevel = Math.max(1, Math.min(DEFAULT_MAX_HEADING_LEVEL, builder.maxHeadingLevel));
        this.reflowWidth = Math.max(0, builder.reflowWidth);
        this.numberingInHeadings = builder.numberingInHeadings;
        this.tolerateUnknown = builder.tolerateUnknown;
        this.xrefText = builder.xrefText != null ? builder.xrefText : XrefText.NUMBER;
        this.frontMatter = builder.frontMatter;
    }

    public static ConversionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxHeadingLevel(maxHeadingLevel)
                .reflowWidth(reflowWidth)
                .numberingInHeadings(numberingInHeadings)
                .tolerateUnknown(tolerateUnknown)
                .xrefText(xrefText)
                .frontMatter(frontMatter);
    }

    public int getMaxHeadingLevel() {
        return maxHeadingLevel;
    }

    /** Column at which paragraphs are wrapped; 0 keeps every paragraph on one line. */
    public int getReflowWidth() {
        return reflowWidth;
    }

    public boolean isNumberingInHeadings() {
        return numberingInHeadings;
    }

    public boolean isTolerateUnknown() {
        return tolerateUnknown;
    }

    public XrefText getXrefText() {
        return xrefText;
    }

    public boolean isFrontMatter() {
        return frontMatter;
    }

    public static final class Builder {
        private int maxHeadingLevel = DEFAULT_MAX_HEADING_LEVEL;
        private int reflowWidth = DEFAULT_REFLOW_WIDTH;
        private boolean numberingInHeadings = true;
        private boolean tolerateUnknown = false;
        private XrefText xrefText = XrefText.NUMBER;
        private boolean frontMatter = true;

        private Builder() {
        }

        public Builder maxHeadingLevel(int maxHeadingLevel) {
            this.maxHeadingLevel = maxHeadingLevel;
            return this;
        }

        public Builder reflowWidth(int reflowWidth) {
            this.reflowWidth = reflowWidth;
            return this;
        }

        public Builder numberingInHeadings(boolean numberingInHeadings) {
            this.numberingInHeadings = numberingInHeadings;
            return this;
        }

        public Builder tolerateUnknown(boolean tolerateUnknown) {
            this.tolerateUnknown = tolerateUnknown;
            return this;
        }

        public Builder xrefText(XrefText xrefText) {
            this.xrefText = xrefText;
            return this;
        }

        public Builder frontMatter(boolean frontMatter) {
            this.frontMatter = frontMatter;
            return this;
        }

        public ConversionOptions build() {
            return new ConversionOptions(this);
        }
    }
}
