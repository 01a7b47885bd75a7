package org.dxworks.rfcmark;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class RfcmarkConfigTest {

    @TempDir
    Path directory;

    @Test
    void load_missingFileGivesDefaults() {
        RfcmarkConfig config = RfcmarkConfig.load(directory.resolve(RfcmarkConfig.CONFIG_FILE_NAME));

        assertEquals(ConversionOptions.DEFAULT_MAX_HEADING_LEVEL, config.getOptions().getMaxHeadingLevel());
        assertEquals(0, config.getOptions().getReflowWidth());
        assertTrue(config.getOptions().isNumberingInHeadings());
        assertFalse(config.getOptions().isTolerateUnknown());
        assertTrue(config.getOptions().isFrontMatter());
        assertTrue(config.isParallel());
        assertEquals(RfcmarkConfig.DEFAULT_SOURCE_URL_PATTERN, config.getSourceUrlPattern());
    }

    @Test
    void load_readsEverySetting() throws IOException {
        Path file = write("max-heading-level: 3\n"
                + "reflow-width: 72\n"
                + "numbering-in-headings: false\n"
                + "tolerate-unknown: true\n"
                + "xref-text: title\n"
                + "front-matter: false\n"
                + "parallel: false\n"
                + "source-url-pattern: \"http://mirror.example/rfc%d.xml\"\n"
                + "something-else: ignored\n");

        RfcmarkConfig config = RfcmarkConfig.load(file);

        ConversionOptions options = config.getOptions();
        assertEquals(3, options.getMaxHeadingLevel());
        assertEquals(72, options.getReflowWidth());
        assertFalse(options.isNumberingInHeadings());
        assertTrue(options.isTolerateUnknown());
        assertEquals(ConversionOptions.XrefText.TITLE, options.getXrefText());
        assertFalse(options.isFrontMatter());
        assertFalse(config.isParallel());
        assertEquals("http://mirror.example/rfc%d.xml", config.getSourceUrlPattern());
    }

    @Test
    void load_clampsOutOfRangeValues() throws IOException {
        RfcmarkConfig config = RfcmarkConfig.load(write("max-heading-level: 9\nreflow-width: -5\n"));

        assertEquals(6, config.getOptions().getMaxHeadingLevel());
        assertEquals(0, config.getOptions().getReflowWidth());
    }

    @Test
    void load_unknownXrefTextFallsBackToNumber() throws IOException {
        RfcmarkConfig config = RfcmarkConfig.load(write("xref-text: bogus\n"));

        assertEquals(ConversionOptions.XrefText.NUMBER, config.getOptions().getXrefText());
    }

    @Test
    void load_unreadableFileGivesDefaults() throws IOException {
        assertEquals(0, RfcmarkConfig.load(write("reflow-width: [1, 2\n")).getOptions().getReflowWidth());
        assertTrue(RfcmarkConfig.load(write("")).isParallel());
    }

    private Path write(String yaml) throws IOException {
        Path file = directory.resolve(RfcmarkConfig.CONFIG_FILE_NAME);
        Files.writeString(file, yaml, StandardCharsets.UTF_8);
        return file;
    }
}
