package com.nana.reconcile.dataset;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Dataset structure plus CSV reading and writing.
 */
class CsvDatasetTest {

    private final CsvDatasetReader reader = new CsvDatasetReader();
    private final CsvDatasetWriter writer = new CsvDatasetWriter();

    // ======================================================================
    // DATASET & ROW
    // ======================================================================

    @Nested
    @DisplayName("Dataset")
    class DatasetTests {

        @Test
        @DisplayName("Rows are numbered from 1 in insertion order")
        void rowsAreNumberedFromOne() {
            Dataset dataset = Dataset.withHeaders("id", "name")
                    .append("1", "a")
                    .append("2", "b");

            int expected = 1;
            for (Row row : dataset) {
                assertEquals(expected++, row.getNumber());
            }
            assertEquals("b", dataset.getRow(1).get("name"));
        }

        @Test
        @DisplayName("Short records leave trailing columns absent, not empty")
        void shortRecord_omitsColumns() {
            Row row = Dataset.withHeaders("id", "name", "price").append("1", "").getRow(0);

            assertTrue(row.containsColumn("name"));
            assertEquals("", row.get("name"));
            assertFalse(row.containsColumn("price"));
            assertNull(row.get("price"));
        }

        @Test
        @DisplayName("Duplicate headers are rejected")
        void duplicateHeaders_rejected() {
            assertThrows(IllegalArgumentException.class, () -> Dataset.withHeaders("id", "id"));
        }

        @Test
        @DisplayName("A record longer than the header is rejected")
        void longRecord_rejected() {
            Dataset dataset = Dataset.withHeaders("id");
            assertThrows(IllegalArgumentException.class, () -> dataset.append("1", "extra"));
        }

        @Test
        @DisplayName("Row cells cannot be modified")
        void rowIsImmutable() {
            Row row = Dataset.withHeaders("id").append("1").getRow(0);
            assertThrows(UnsupportedOperationException.class, () -> row.asMap().put("id", "2"));
        }
    }

    // ======================================================================
    // READER
    // ======================================================================

    @Nested
    @DisplayName("CsvDatasetReader")
    class ReaderTests {

        @Test
        @DisplayName("parseLine splits on unquoted commas only")
        void parseLine_splitsOnUnquotedCommas() {
            assertEquals(List.of("a", "b", "c"), reader.parseLine("a,b,c"));
            assertEquals(List.of("a, b", "c"), reader.parseLine("\"a, b\",c"));
            assertEquals(List.of("a", "", "c"), reader.parseLine("a,,c"));
            assertEquals(List.of(""), reader.parseLine("\"\""));
        }

        @Test
        @DisplayName("Doubled quotes inside a quoted field become one quote")
        void escapedQuotes_areUnescaped() {
            List<String> fields = reader.parseLine("\"He said \"\"hi\"\"\",x");
            assertEquals(List.of("He said \"hi\"", "x"), fields);
        }

        @Test
        @DisplayName("Line breaks inside quotes stay in the field")
        void quotedNewline_isData() throws IOException {
            Dataset dataset = reader.parse("id,notes\r\n1,\"line one\nline two\"\r\n2,plain\r\n");

            assertEquals(2, dataset.size());
            assertEquals("line one\nline two", dataset.getRow(0).get("notes"));
            assertEquals("plain", dataset.getRow(1).get("notes"));
        }

        @Test
        @DisplayName("BOM, blank lines and comment lines are ignored")
        void bomBlankAndComments_skipped() throws IOException {
            Dataset dataset = reader.parse("\uFEFF# exported catalog\n id , name \n\n1,Dune\n#2,Skipped\n");

            assertEquals(List.of("id", "name"), dataset.getHeaders());
            assertEquals(1, dataset.size());
            assertEquals("Dune", dataset.getRow(0).get("name"));
        }

        @Test
        @DisplayName("Extra cells beyond the header are dropped")
        void extraCells_truncated() throws IOException {
            Dataset dataset = reader.parse("id,name\n1,Dune,overflow\n");
            assertEquals(List.of("1", "Dune"), dataset.getData().get(0));
        }

        @Test
        @DisplayName("Unclosed quote is rejected")
        void unclosedQuote_rejected() {
            assertThrows(IllegalArgumentException.class, () -> reader.parse("id,name\n1,\"Dune\n"));
        }

        @Test
        @DisplayName("Input without a header record is rejected")
        void emptyInput_rejected() {
            assertThrows(IOException.class, () -> reader.parse("\n# nothing here\n"));
        }

        @Test
        @DisplayName("Missing file is reported as an IOException")
        void missingFile_rejected(@TempDir Path dir) {
            assertThrows(IOException.class, () -> reader.read(dir.resolve("absent.csv")));
        }
    }

    // ======================================================================
    // WRITER
    // ======================================================================

    @Nested
    @DisplayName("CsvDatasetWriter")
    class WriterTests {

        @ParameterizedTest(name = "[{index}] \"{0}\" -> {1}")
        @CsvSource(delimiter = '|', value = {
                "John       | John",
                "'Smith, Jr.' | '\"Smith, Jr.\"'"
        }, quoteCharacter = '\'')
        @DisplayName("Fields with separators are quoted")
        void escapeCsvField_quotesWhenNeeded(String raw, String expected) {
            assertEquals(expected, CsvDatasetWriter.escapeCsvField(raw));
        }

        @Test
        @DisplayName("Null and empty fields render as nothing")
        void escapeCsvField_nullIsEmpty() {
            assertEquals("", CsvDatasetWriter.escapeCsvField(null));
            assertEquals("", CsvDatasetWriter.escapeCsvField(""));
        }

        @Test
        @DisplayName("Records end with CRLF")
        void toCsv_usesCrlf() {
            Dataset dataset = Dataset.withHeaders("id", "name").append("1", "a \"quoted\" name");

            assertEquals("id,name\r\n1,\"a \"\"quoted\"\" name\"\r\n", writer.toCsv(dataset));
        }

        @Test
        @DisplayName("Files start with a UTF-8 BOM and parent directories are created")
        void write_addsBomAndDirectories(@TempDir Path dir) throws IOException {
            Path target = dir.resolve("exports/books.csv");

            writer.write(Dataset.withHeaders("id").append("1"), target);

            byte[] bytes = Files.readAllBytes(target);
            assertEquals((byte) 0xEF, bytes[0]);
            assertEquals((byte) 0xBB, bytes[1]);
            assertEquals((byte) 0xBF, bytes[2]);
            assertEquals("id\r\n1\r\n", new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("A written file reads back to the same cells")
        void writeThenRead_preservesCells(@TempDir Path dir) throws IOException {
            Dataset original = Dataset.withHeaders("id", "notes")
                    .append("1", "comma, quote \" and\nnewline")
                    .append("2", "");
            Path target = dir.resolve("round.csv");

            writer.write(original, target);
            Dataset read = reader.read(target);

            assertEquals(original.getHeaders(), read.getHeaders());
            assertEquals(original.getData(), read.getData());
        }
    }
}
