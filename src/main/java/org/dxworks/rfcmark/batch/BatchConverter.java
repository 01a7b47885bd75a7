package org.dxworks.rfcmark.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.rfcmark.ConversionResult;
import org.dxworks.rfcmark.ConversionWarning;
import org.dxworks.rfcmark.RfcConverter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Converts an inclusive range of RFC numbers, one Markdown file per document.
 *
 * Documents are independent: each one runs the whole pipeline on its own, a failure is
 * recorded and the batch moves on. A failed document leaves no output file behind.
 * Progress goes to the console and every outcome to a JSON Lines report in the output
 * directory.
 */
public class BatchConverter {

    public static final String OUTPUT_FILE_PATTERN = "rfc%d.md";
    public static final String REPORT_FILE_NAME = "rfcmark-report.jsonl";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final RfcConverter converter;
    private final DocumentSource source;
    private final Path outputDirectory;
    private final boolean parallel;

    public BatchConverter(RfcConverter converter, DocumentSource source, Path outputDirectory, boolean parallel) {
        this.converter = converter;
        this.source = source;
        this.outputDirectory = outputDirectory;
        this.parallel = parallel;
    }

    public Path outputPathOf(int documentId) {
        return outputDirectory.resolve(String.format(OUTPUT_FILE_PATTERN, documentId));
    }

    public BatchReport run(int first, int last) throws IOException {
        if (last < first) {
            throw new IllegalArgumentException("Empty range: " + first + ".." + last);
        }
        Files.createDirectories(outputDirectory);
        List<Integer> ids = IntStream.rangeClosed(first, last).boxed().collect(Collectors.toList());

        Instant startTime = Instant.now();
        AtomicInteger progressCounter = new AtomicInteger(0);
        List<DocumentOutcome> outcomes = Collections.synchronizedList(new ArrayList<>());

        try (BufferedWriter writer = Files.newBufferedWriter(outputDirectory.resolve(REPORT_FILE_NAME), StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("first", first);
            runInfo.put("last", last);
            runInfo.put("parallel", parallel);
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            (parallel ? ids.parallelStream() : ids.stream()).forEach(id -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + ids.size() + "] Converting RFC " + id
                            + " from " + source.locate(id));
                }

                DocumentOutcome outcome = convertOne(id);
                outcomes.add(outcome);
                try {
                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(outcome));
                        writer.newLine();
                        writer.flush();
                    }
                } catch (IOException e) {
                    synchronized (System.err) {
                        System.err.println("Failed to write report entry for RFC " + id + ": " + e.getMessage());
                    }
                }
            });

            BatchReport report = new BatchReport(outcomes);
            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("converted", report.getConvertedCount());
            doneInfo.put("failed", report.getFailedCount());
            doneInfo.put("warnings", report.getWarningCount());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
            return report;
        }
    }

    /** Runs one document through the pipeline. Never throws, so one document cannot stop the batch. */
    DocumentOutcome convertOne(int id) {
        Path output = outputPathOf(id);
        try {
            ConversionResult result = converter.convert(source.fetch(id));
            AtomicFileWriter.write(output, result.getMarkdown());

            List<String> warnings = new ArrayList<>();
            for (ConversionWarning warning : result.getWarnings()) {
                warnings.add(warning.toString());
            }
            if (!warnings.isEmpty()) {
                synchronized (System.err) {
                    for (String warning : warnings) {
                        System.err.println("  Warning in RFC " + id + ", " + warning);
                    }
                }
            }
            return DocumentOutcome.converted(id, output.toString(), warnings);
        } catch (Exception | StackOverflowError e) {
            removeStaleOutput(output);
            synchronized (System.err) {
                System.err.println("  Error converting RFC " + id + ": " + e);
            }
            return DocumentOutcome.failed(id, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    // a file left over from an earlier run would pass for this run's output
    private static void removeStaleOutput(Path output) {
        try {
            Files.deleteIfExists(output);
        } catch (IOException e) {
            synchronized (System.err) {
                System.err.println("  Could not remove stale " + output + ": " + e.getMessage());
            }
        }
    }
}
