package com.nana.reconcile.dataset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads RFC 4180 CSV into a {@link Dataset}.
 *
 * <p>The parser handles:
 * <ul>
 *   <li>Quoted fields, including commas and line breaks inside quotes</li>
 *   <li>Escaped quotes ({@code ""} inside a quoted field)</li>
 *   <li>A UTF-8 BOM at the start of the input</li>
 *   <li>CRLF and LF record separators</li>
 *   <li>Blank lines and {@code #} comment lines, which are skipped</li>
 * </ul>
 *
 * <p>The first record that is not blank or a comment is the header.
 * Header names are trimmed. Data records longer than the header lose their
 * extra cells; shorter records keep only the columns they have.
 */
public class CsvDatasetReader {

    private static final Logger log = LoggerFactory.getLogger(CsvDatasetReader.class);

    private static final char BOM = '\uFEFF';

    /**
     * Reads a CSV file.
     *
     * @param path the file to read
     * @return the parsed dataset
     * @throws IOException if the file is missing, unreadable, or has no header
     */
    public Dataset read(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Not a regular file: " + path.toAbsolutePath());
        }
        if (!Files.isReadable(path)) {
            throw new IOException("File is not readable (check permissions): " + path);
        }
        log.info("Reading CSV dataset from '{}'.", path);
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    /**
     * Parses CSV text held in memory.
     *
     * @param csv the CSV text
     * @return the parsed dataset
     * @throws IOException if the text has no header record
     */
    public Dataset parse(String csv) throws IOException {
        return read(new StringReader(csv));
    }

    /**
     * Reads CSV from a character stream. The reader is not closed.
     *
     * @param reader the source
     * @return the parsed dataset
     * @throws IOException on read failure or when no header record exists
     * @throws IllegalArgumentException if a quoted field is never closed
     */
    public Dataset read(Reader reader) throws IOException {
        RecordParser parser = new RecordParser(reader);

        List<String> headers = null;
        Dataset dataset = null;
        List<String> record;
        while ((record = parser.next()) != null) {
            if (isSkippable(record, parser.lastRecordWasQuoted())) {
                continue;
            }
            if (headers == null) {
                headers = new ArrayList<>();
                for (String h : record) {
                    headers.add(h.trim());
                }
                dataset = new Dataset(headers);
                log.debug("Header row: {}", headers);
                continue;
            }
            if (record.size() > headers.size()) {
                log.debug("Record at line {} has {} cells, keeping the first {}.",
                        parser.recordStartLine(), record.size(), headers.size());
                record = record.subList(0, headers.size());
            }
            dataset.append(record);
        }

        if (dataset == null) {
            throw new IOException("No header row found in CSV input.");
        }
        log.debug("Parsed {} data rows.", dataset.size());
        return dataset;
    }

    /**
     * Parses a single CSV line into its fields.
     *
     * @param line one record without its line terminator
     * @return the field values, quotes removed
     * @throws IllegalArgumentException if a quoted field is not closed
     */
    public List<String> parseLine(String line) {
        try {
            List<String> fields = new RecordParser(new StringReader(line)).next();
            return fields == null ? new ArrayList<>() : fields;
        } catch (IOException ex) {
            throw new IllegalStateException("StringReader failed", ex);
        }
    }

    private boolean isSkippable(List<String> record, boolean quoted) {
        if (quoted) {
            return false;
        }
        if (record.size() == 1 && record.get(0).isBlank()) {
            return true;
        }
        return !record.isEmpty() && record.get(0).startsWith("#");
    }

    // -----------------------------------------------------------------------
    // RECORD PARSER
    // -----------------------------------------------------------------------

    /**
     * Character state machine producing one record per call. Tracks whether
     * it is inside a quoted field so separators and line breaks there are
     * kept as data.
     */
    private static final class RecordParser {

        private final Reader in;
        private int line = 1;
        private int startLine = 1;
        private boolean quotedRecord;
        private boolean first = true;
        private int pushback = -1;

        RecordParser(Reader in) {
            this.in = in;
        }

        int recordStartLine() { return startLine; }

        boolean lastRecordWasQuoted() { return quotedRecord; }

        private int read() throws IOException {
            if (pushback != -1) {
                int c = pushback;
                pushback = -1;
                return c;
            }
            int c = in.read();
            if (first) {
                first = false;
                if (c == BOM) {
                    log.debug("UTF-8 BOM detected and stripped.");
                    c = in.read();
                }
            }
            return c;
        }

        List<String> next() throws IOException {
            int c = read();
            if (c == -1) {
                return null;
            }
            startLine = line;
            quotedRecord = false;

            List<String> fields = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            boolean inQuotes = false;

            while (c != -1) {
                if (inQuotes) {
                    if (c == '"') {
                        int peek = read();
                        if (peek == '"') {
                            current.append('"');
                        } else {
                            inQuotes = false;
                            pushback = peek;
                        }
                    } else {
                        if (c == '\n') {
                            line++;
                        }
                        current.append((char) c);
                    }
                } else if (c == '"') {
                    inQuotes = true;
                    quotedRecord = true;
                } else if (c == ',') {
                    fields.add(current.toString());
                    current.setLength(0);
                } else if (c == '\r') {
                    int peek = read();
                    if (peek != '\n') {
                        pushback = peek;
                    }
                    line++;
                    break;
                } else if (c == '\n') {
                    line++;
                    break;
                } else {
                    current.append((char) c);
                }
                c = read();
            }

            if (inQuotes) {
                throw new IllegalArgumentException(
                        "Unclosed quoted field in record starting at line " + startLine);
            }
            fields.add(current.toString());
            return fields;
        }
    }
}
