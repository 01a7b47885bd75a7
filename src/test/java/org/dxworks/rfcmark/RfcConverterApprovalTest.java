package org.dxworks.rfcmark;

import org.approvaltests.Approvals;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

public class RfcConverterApprovalTest {
    private static final String SAMPLES_BASE_PATH = "src/test/resources/samples/rfc/";

    @Test
    void convert_sampleDocument() throws IOException, ConversionException {
        String source = Files.readString(Paths.get(SAMPLES_BASE_PATH + "rfc9999-orig.xml"), StandardCharsets.UTF_8);
        ConversionResult result = new RfcConverter(ConversionOptions.builder().frontMatter(false).build()).convert(source);
        Approvals.verify(result.getMarkdown());
    }
}
