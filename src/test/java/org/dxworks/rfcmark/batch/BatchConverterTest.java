package org.dxworks.rfcmark.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.rfcmark.ConversionException;
import org.dxworks.rfcmark.ConversionOptions;
import org.dxworks.rfcmark.RfcConverter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class BatchConverterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String GOOD = "<rfc><middle><section anchor=\"a\"><name>A</name>"
            + "<t>See <xref target=\"nowhere\"/>.</t></section></middle></rfc>";

    @TempDir
    Path directory;

    private final RfcConverter converter = new RfcConverter(ConversionOptions.builder().frontMatter(false).build());

    @Test
    void run_recordsEveryDocumentAndKeepsGoingAfterFailures() throws IOException, ConversionException {
        Files.writeString(directory.resolve("rfc1-orig.xml"), GOOD, StandardCharsets.UTF_8);
        Files.writeString(directory.resolve("rfc2-orig.xml"), "<rfc><middle>", StandardCharsets.UTF_8);
        Files.writeString(directory.resolve("rfc2.md"), "left over from an earlier run", StandardCharsets.UTF_8);

        BatchReport report = new BatchConverter(converter, new FileDocumentSource(directory), directory, false).run(1, 3);

        assertEquals(1, report.getConvertedCount());
        assertEquals(2, report.getFailedCount());
        assertEquals(1, report.getWarningCount());
        assertFalse(report.isSuccessful());

        List<DocumentOutcome> outcomes = report.getOutcomes();
        assertEquals(List.of(1, 2, 3), outcomes.stream().map(o -> o.rfc).collect(Collectors.toList()));
        assertTrue(outcomes.get(0).isConverted());
        assertTrue(outcomes.get(1).error.startsWith("MalformedInputException"));
        assertTrue(outcomes.get(2).error.startsWith("DocumentNotFoundException"));

        assertEquals(converter.convert(GOOD).getMarkdown(),
                Files.readString(directory.resolve("rfc1.md"), StandardCharsets.UTF_8));
        assertFalse(Files.exists(directory.resolve("rfc2.md")));
        assertFalse(Files.exists(directory.resolve("rfc3.md")));
    }

    @Test
    void run_writesAJsonLinesReport() throws IOException {
        Files.writeString(directory.resolve("rfc7-orig.xml"), GOOD, StandardCharsets.UTF_8);

        new BatchConverter(converter, new FileDocumentSource(directory), directory, false).run(7, 8);

        List<String> lines = Files.readAllLines(directory.resolve(BatchConverter.REPORT_FILE_NAME), StandardCharsets.UTF_8);
        assertEquals(4, lines.size());

        JsonNode run = MAPPER.readTree(lines.get(0));
        assertEquals("run", run.get("kind").asText());
        assertEquals(7, run.get("first").asInt());
        assertEquals(8, run.get("last").asInt());

        JsonNode converted = MAPPER.readTree(lines.get(1));
        assertEquals("converted", converted.get("kind").asText());
        assertEquals(7, converted.get("rfc").asInt());
        assertEquals(1, converted.get("warnings").size());
        assertFalse(converted.has("error"));

        JsonNode failed = MAPPER.readTree(lines.get(2));
        assertEquals("failed", failed.get("kind").asText());
        assertFalse(failed.has("output"));

        JsonNode done = MAPPER.readTree(lines.get(3));
        assertEquals("done", done.get("kind").asText());
        assertEquals(1, done.get("converted").asInt());
        assertEquals(1, done.get("failed").asInt());
    }

    @Test
    void run_inParallelGivesTheSameFiles() throws IOException {
        for (int id = 10; id <= 15; id++) {
            Files.writeString(directory.resolve("rfc" + id + "-orig.xml"),
                    "<rfc><middle><section><name>Doc " + id + "</name></section></middle></rfc>", StandardCharsets.UTF_8);
        }

        BatchReport report = new BatchConverter(converter, new FileDocumentSource(directory), directory, true).run(10, 15);

        assertTrue(report.isSuccessful());
        assertEquals(6, report.getConvertedCount());
        for (int id = 10; id <= 15; id++) {
            assertEquals("# 1. Doc " + id + "\n",
                    Files.readString(directory.resolve("rfc" + id + ".md"), StandardCharsets.UTF_8));
        }
        try (Stream<Path> files = Files.list(directory)) {
            assertTrue(files.noneMatch(path -> path.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void run_stripsAByteOrderMark() throws IOException {
        Files.writeString(directory.resolve("rfc4-orig.xml"), "\uFEFF" + GOOD, StandardCharsets.UTF_8);

        BatchReport report = new BatchConverter(converter, new FileDocumentSource(directory), directory, false).run(4, 4);

        assertTrue(report.isSuccessful());
    }

    @Test
    void run_deeplyNestedDocumentFailsAlone() throws IOException {
        Files.writeString(directory.resolve("rfc1-orig.xml"),
                "<rfc><middle><section><name>S</name>" + "<blockquote>".repeat(20000) + "x"
                        + "</blockquote>".repeat(20000) + "</section></middle></rfc>",
                StandardCharsets.UTF_8);
        Files.writeString(directory.resolve("rfc2-orig.xml"), GOOD, StandardCharsets.UTF_8);

        BatchReport report = new BatchConverter(converter, new FileDocumentSource(directory), directory, false).run(1, 2);

        assertEquals(1, report.getFailedCount());
        assertTrue(report.getOutcomes().get(0).error.startsWith("MalformedInputException"));
        assertTrue(Files.exists(directory.resolve("rfc2.md")));
    }

    @Test
    void run_survivesAStackOverflowInOneDocument() throws IOException {
        DocumentSource source = new DocumentSource() {
            @Override
            public byte[] fetch(int documentId) {
                if (documentId == 1) {
                    throw new StackOverflowError();
                }
                return GOOD.getBytes(StandardCharsets.UTF_8);
            }

            @Override
            public String locate(int documentId) {
                return "memory:" + documentId;
            }
        };

        BatchReport report = new BatchConverter(converter, source, directory, false).run(1, 2);

        assertEquals(1, report.getConvertedCount());
        assertTrue(report.getOutcomes().get(0).error.startsWith("StackOverflowError"));
        assertTrue(Files.exists(directory.resolve("rfc2.md")));
        List<String> lines = Files.readAllLines(directory.resolve(BatchConverter.REPORT_FILE_NAME), StandardCharsets.UTF_8);
        assertEquals("done", MAPPER.readTree(lines.get(lines.size() - 1)).get("kind").asText());
    }

    @Test
    void run_decodesAsTheXmlDeclarationSays() throws IOException {
        Files.write(directory.resolve("rfc1-orig.xml"), new byte[]{'<', 'r', 'f', 'c', '>', 'c', 'a', 'f', (byte) 0xC3, '(',
                '<', '/', 'r', 'f', 'c', '>'});
        Files.write(directory.resolve("rfc2-orig.xml"), ("<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?>"
                + "<rfc><middle><section><name>S</name><t>caf\u00E9</t></section></middle></rfc>")
                .getBytes(StandardCharsets.ISO_8859_1));

        BatchReport report = new BatchConverter(converter, new FileDocumentSource(directory), directory, false).run(1, 2);

        assertEquals(1, report.getConvertedCount());
        assertTrue(report.getOutcomes().get(0).error.startsWith("MalformedInputException"));
        assertEquals("# 1. S\n\ncaf\u00E9\n", Files.readString(directory.resolve("rfc2.md"), StandardCharsets.UTF_8));
    }

    @Test
    void run_rejectsAnEmptyRange() {
        BatchConverter batch = new BatchConverter(converter, new FileDocumentSource(directory), directory, false);

        assertThrows(IllegalArgumentException.class, () -> batch.run(5, 4));
    }

    @Test
    void outputPathOf() {
        BatchConverter batch = new BatchConverter(converter, new FileDocumentSource(directory), directory, false);

        assertEquals(directory.resolve("rfc8446.md"), batch.outputPathOf(8446));
    }
}
