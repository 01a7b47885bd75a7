package org.dxworks.rfcmark;

import org.dxworks.rfcmark.batch.AtomicFileWriter;
import org.dxworks.rfcmark.batch.BatchConverter;
import org.dxworks.rfcmark.batch.BatchReport;
import org.dxworks.rfcmark.batch.DocumentSource;
import org.dxworks.rfcmark.batch.FileDocumentSource;
import org.dxworks.rfcmark.batch.HttpDocumentSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public class App {

    static final int FILL_WIDTH = 120;

    public static void main(String[] args) throws IOException {
        int status = run(args, RfcmarkConfig.load());
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args, RfcmarkConfig config) throws IOException {
        List<String> positional = new ArrayList<>();
        boolean batch = false;
        boolean fetch = false;
        boolean fill = false;
        for (String arg : args) {
            switch (arg) {
                case "--batch" -> batch = true;
                case "--fetch" -> fetch = true;
                case "--fill" -> fill = true;
                default -> {
                    if (arg.startsWith("--")) {
                        System.err.println("Unknown option: " + arg);
                        printUsage();
                        return 2;
                    }
                    positional.add(arg);
                }
            }
        }

        ConversionOptions options = config.getOptions();
        if (fill && options.getReflowWidth() == 0) {
            options = options.toBuilder().reflowWidth(FILL_WIDTH).build();
        }
        RfcConverter converter = new RfcConverter(options);

        if (batch) {
            if (positional.size() != 3) {
                printUsage();
                return 2;
            }
            int first;
            int last;
            try {
                first = Integer.parseInt(positional.get(0));
                last = Integer.parseInt(positional.get(1));
            } catch (NumberFormatException e) {
                System.err.println("Error: RFC numbers must be integers: " + e.getMessage());
                printUsage();
                return 2;
            }
            if (last < first) {
                System.err.println("Error: the last RFC number is smaller than the first");
                return 2;
            }
            return runBatch(converter, config, first, last, Paths.get(positional.get(2)), fetch);
        }

        if (fetch || positional.size() != 2) {
            printUsage();
            return 2;
        }
        return convertFile(converter, Paths.get(positional.get(0)), Paths.get(positional.get(1)));
    }

    private static int convertFile(RfcConverter converter, Path input, Path output) throws IOException {
        if (!Files.isRegularFile(input)) {
            System.err.println("Error: Input file does not exist: " + input);
            return 1;
        }

        byte[] source = Files.readAllBytes(input);

        ConversionResult result;
        try {
            result = converter.convert(source);
        } catch (ConversionException e) {
            System.err.println("Error converting " + input + ": " + e.getMessage());
            return 1;
        }

        AtomicFileWriter.write(output, result.getMarkdown());
        for (ConversionWarning warning : result.getWarnings()) {
            System.err.println("Warning: " + warning);
        }
        System.out.println("Output written to: " + output.toAbsolutePath());
        return 0;
    }

    private static int runBatch(RfcConverter converter, RfcmarkConfig config, int first, int last,
                                Path directory, boolean fetch) throws IOException {
        DocumentSource source = fetch
                ? new HttpDocumentSource(config.getSourceUrlPattern())
                : new FileDocumentSource(directory);

        System.out.println("Starting conversion of RFC " + first + " to RFC " + last + "...");
        System.out.println("Output: " + directory.toAbsolutePath());

        BatchReport report = new BatchConverter(converter, source, directory, config.isParallel()).run(first, last);

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete!");
        System.out.println("Converted: " + report.getConvertedCount() + " documents");
        if (report.getWarningCount() > 0) {
            System.out.println("Warnings: " + report.getWarningCount());
        }
        if (report.getFailedCount() > 0) {
            System.out.println("Failed: " + report.getFailedCount());
        }
        System.out.println("Report written to: " + directory.resolve(BatchConverter.REPORT_FILE_NAME).toAbsolutePath());
        System.out.println("=".repeat(60));
        return report.isSuccessful() ? 0 : 1;
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar rfcmark.jar <input.xml> <output.md> [--fill]");
        System.err.println("       java -jar rfcmark.jar --batch <first> <last> <directory> [--fetch] [--fill]");
        System.err.println("  <input.xml>:  RFC in the xml2rfc v3 format");
        System.err.println("  <output.md>:  Markdown file to write");
        System.err.println("  --batch:      convert rfc<N>-orig.xml to rfc<N>.md in <directory> for every N in the range");
        System.err.println("  --fetch:      download the documents from " + RfcmarkConfig.DEFAULT_SOURCE_URL_PATTERN
                + " (see " + RfcmarkConfig.CONFIG_FILE_NAME + ")");
        System.err.println("  --fill:       wrap paragraphs at " + FILL_WIDTH + " columns");
    }
}
