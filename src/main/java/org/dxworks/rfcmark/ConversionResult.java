package org.dxworks.rfcmark;

import java.util.List;

/**
 * Markdown produced for one document, with the warnings collected on the way.
 */
public class ConversionResult {

    private final String markdown;
    private final List<ConversionWarning> warnings;

    public ConversionResult(String markdown, List<ConversionWarning> warnings) {
        this.markdown = markdown;
        this.warnings = List.copyOf(warnings);
    }

    public String getMarkdown() {
        return markdown;
    }

    /** Unknown elements that were passed through, then unresolved references, each in document order. */
    public List<ConversionWarning> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
