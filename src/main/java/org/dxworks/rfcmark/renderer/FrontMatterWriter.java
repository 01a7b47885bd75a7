package org.dxworks.rfcmark.renderer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.dxworks.rfcmark.RenderException;
import org.dxworks.rfcmark.model.doc.FrontMatter;

/**
 * Writes the document metadata as a YAML block delimited by {@code ---} lines.
 */
public class FrontMatterWriter {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .build());

    /** The delimited block, or an empty string when there is no metadata at all. */
    public String write(FrontMatter frontMatter) throws RenderException {
        String yaml;
        try {
            yaml = YAML_MAPPER.writeValueAsString(frontMatter);
        } catch (JsonProcessingException e) {
            throw new RenderException("Cannot write front matter: " + e.getOriginalMessage());
        }
        if (yaml.isBlank() || yaml.trim().equals("{}")) {
            return "";
        }
        if (!yaml.endsWith("\n")) {
            yaml = yaml + "\n";
        }
        return "---\n" + yaml + "---\n";
    }
}
