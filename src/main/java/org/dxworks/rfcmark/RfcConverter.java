package org.dxworks.rfcmark;

import org.dxworks.rfcmark.builder.ModelBuilder;
import org.dxworks.rfcmark.loader.XmlTreeLoader;
import org.dxworks.rfcmark.model.doc.RfcDocument;
import org.dxworks.rfcmark.model.xml.XmlElement;
import org.dxworks.rfcmark.renderer.MarkdownRenderer;
import org.dxworks.rfcmark.resolver.ReferenceResolver;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts one xml2rfc v3 document to Markdown: load, build, resolve, render.
 *
 * Each stage runs to completion before the next starts and every call gets fresh stage
 * instances, so one converter can be shared by threads converting different documents.
 */
public class RfcConverter {

    private final ConversionOptions options;

    public RfcConverter() {
        this(ConversionOptions.defaults());
    }

    public RfcConverter(ConversionOptions options) {
        this.options = options;
    }

    public ConversionOptions getOptions() {
        return options;
    }

    public ConversionResult convert(String sourceText) throws ConversionException {
        return convert(new XmlTreeLoader().load(sourceText));
    }

    /** Converts a document read as bytes; its XML declaration decides the encoding. */
    public ConversionResult convert(byte[] source) throws ConversionException {
        return convert(new XmlTreeLoader().load(source));
    }

    private ConversionResult convert(XmlElement root) throws ConversionException {
        ModelBuilder builder = new ModelBuilder(options);
        RfcDocument document = builder.build(root);

        List<ConversionWarning> warnings = new ArrayList<>(builder.getWarnings());
        warnings.addAll(new ReferenceResolver().resolve(document));

        String markdown = new MarkdownRenderer(options).render(document);
        return new ConversionResult(markdown, warnings);
    }
}
