package com.nana.reconcile.dataset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Writes a {@link Dataset} as RFC 4180 CSV.
 *
 * <p>RFC 4180 RULES APPLIED:
 * <ul>
 *   <li>Fields containing commas, double quotes, CR or LF are quoted.</li>
 *   <li>Double quotes inside a quoted field are doubled.</li>
 *   <li>Each record ends with CRLF.</li>
 *   <li>The first record is the header row.</li>
 * </ul>
 *
 * <p>Files are written as UTF-8 with a BOM so spreadsheet tools detect the
 * encoding. {@link #toCsv(Dataset)} produces the same text without a BOM.
 */
public class CsvDatasetWriter {

    private static final Logger log = LoggerFactory.getLogger(CsvDatasetWriter.class);

    private static final String CRLF = "\r\n";

    private static final byte[] UTF8_BOM = new byte[]{
            (byte) 0xEF, (byte) 0xBB, (byte) 0xBF
    };

    /**
     * Writes the dataset to a file, replacing any existing content.
     * Parent directories are created when missing.
     *
     * @param dataset    the data to write
     * @param outputPath the target file
     * @throws IOException if any write fails
     */
    public void write(Dataset dataset, Path outputPath) throws IOException {
        Path parent = outputPath.getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
            log.debug("Created export directory: {}", parent);
        }

        // BOM goes out as raw bytes before the text writer opens in append mode
        Files.write(outputPath, UTF8_BOM,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING);

        try (BufferedWriter writer = Files.newBufferedWriter(
                outputPath,
                StandardCharsets.UTF_8,
                StandardOpenOption.APPEND)) {
            write(dataset, writer);
        }
        log.info("CSV written: {} rows, {} columns, to '{}'.",
                dataset.size(), dataset.getHeaders().size(), outputPath);
    }

    /**
     * Writes header and rows to a character stream. The writer is not closed.
     *
     * @param dataset the data to write
     * @param writer  the destination
     * @throws IOException if a write fails
     */
    public void write(Dataset dataset, Writer writer) throws IOException {
        writeRecord(writer, dataset.getHeaders());
        for (List<String> row : dataset.getData()) {
            writeRecord(writer, row);
        }
        writer.flush();
    }

    /**
     * @param dataset the data to render
     * @return the CSV text, CRLF separated, without BOM
     */
    public String toCsv(Dataset dataset) {
        StringWriter out = new StringWriter();
        try {
            write(dataset, out);
        } catch (IOException ex) {
            throw new IllegalStateException("StringWriter failed", ex);
        }
        return out.toString();
    }

    private void writeRecord(Writer writer, List<String> values) throws IOException {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(escapeCsvField(values.get(i)));
        }
        writer.write(sb.toString());
        writer.write(CRLF);
    }

    /**
     * Applies RFC 4180 escaping to one field.
     *
     * <pre>
     *   escapeCsvField("John")           = John
     *   escapeCsvField("Smith, Jr.")     = "Smith, Jr."
     *   escapeCsvField("He said \"hi\"") = "He said ""hi"""
     *   escapeCsvField(null)             = (empty)
     * </pre>
     *
     * @param value the raw value
     * @return the escaped value, quoted when needed
     */
    public static String escapeCsvField(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        boolean needsQuoting = value.contains(",")
                || value.contains("\"")
                || value.contains("\r")
                || value.contains("\n");
        if (!needsQuoting) {
            return value;
        }
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }
}
