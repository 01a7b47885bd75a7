package org.dxworks.rfcmark;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

public class RfcmarkConfig {

    public static final String CONFIG_FILE_NAME = "rfcmark-config.yml";
    public static final String DEFAULT_SOURCE_URL_PATTERN = "https://www.rfc-editor.org/rfc/rfc%d.xml";
    private static final boolean DEFAULT_PARALLEL = true;

    private final ConversionOptions options;
    private final boolean parallel;
    private final String sourceUrlPattern;

    private RfcmarkConfig(ConversionOptions options, boolean parallel, String sourceUrlPattern) {
        this.options = options;
        this.parallel = parallel;
        this.sourceUrlPattern = sourceUrlPattern;
    }

    public ConversionOptions getOptions() {
        return options;
    }

    public boolean isParallel() {
        return parallel;
    }

    /** {@link String#format} pattern turning a document number into its download URL. */
    public String getSourceUrlPattern() {
        return sourceUrlPattern;
    }

    public static RfcmarkConfig defaults() {
        return new RfcmarkConfig(ConversionOptions.defaults(), DEFAULT_PARALLEL, DEFAULT_SOURCE_URL_PATTERN);
    }

    public static RfcmarkConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static RfcmarkConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return fromYaml(yamlConfig);
            }
        } catch (IOException e) {
            System.err.println("Warning: could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    private static RfcmarkConfig fromYaml(YamlConfig yamlConfig) {
        ConversionOptions.Builder options = ConversionOptions.builder();
        if (yamlConfig.maxHeadingLevel != null && yamlConfig.maxHeadingLevel > 0) {
            options.maxHeadingLevel(yamlConfig.maxHeadingLevel);
        }
        if (yamlConfig.reflowWidth != null) {
            options.reflowWidth(yamlConfig.reflowWidth);
        }
        if (yamlConfig.numberingInHeadings != null) {
            options.numberingInHeadings(yamlConfig.numberingInHeadings);
        }
        if (yamlConfig.tolerateUnknown != null) {
            options.tolerateUnknown(yamlConfig.tolerateUnknown);
        }
        if (yamlConfig.xrefText != null) {
            options.xrefText(parseXrefText(yamlConfig.xrefText));
        }
        if (yamlConfig.frontMatter != null) {
            options.frontMatter(yamlConfig.frontMatter);
        }

        boolean effectiveParallel = yamlConfig.parallel != null ? yamlConfig.parallel : DEFAULT_PARALLEL;
        String effectivePattern = (yamlConfig.sourceUrlPattern != null && !yamlConfig.sourceUrlPattern.isBlank())
                ? yamlConfig.sourceUrlPattern
                : DEFAULT_SOURCE_URL_PATTERN;

        return new RfcmarkConfig(options.build(), effectiveParallel, effectivePattern);
    }

    private static ConversionOptions.XrefText parseXrefText(String value) {
        try {
            return ConversionOptions.XrefText.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            System.err.println("Warning: unknown xref-text '" + value + "', using number");
            return ConversionOptions.XrefText.NUMBER;
        }
    }

    private static class YamlConfig {
        @JsonProperty("max-heading-level")
        public Integer maxHeadingLevel;
        @JsonProperty("reflow-width")
        public Integer reflowWidth;
        @JsonProperty("numbering-in-headings")
        public Boolean numberingInHeadings;
        @JsonProperty("tolerate-unknown")
        public Boolean tolerateUnknown;
        @JsonProperty("xref-text")
        public String xrefText;
        @JsonProperty("front-matter")
        public Boolean frontMatter;
        public Boolean parallel;
        @JsonProperty("source-url-pattern")
        public String sourceUrlPattern;
    }
}
