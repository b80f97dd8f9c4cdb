package com.casesentinel.cli;

import com.casesentinel.core.model.CellValue;
import com.casesentinel.core.model.ColumnNames;
import com.casesentinel.core.model.Dataset;
import com.casesentinel.core.model.RecordStore;
import com.casesentinel.core.model.Row;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Loads every {@code *.csv} file of a directory into a {@link RecordStore}.
 *
 * <h3>Per file</h3>
 * <ul>
 * <li>The first record is the header. Column names are normalized; blank
 * names become {@code unnamed_<n>} and repeated names get a numeric
 * suffix.</li>
 * <li>UTF-8 is tried first, then ISO-8859-1. A leading byte-order mark is
 * dropped from the first header.</li>
 * <li>Blank cells are null, plain decimal numbers are numeric, everything
 * else is text. Short records are padded with nulls; surplus cells are
 * dropped.</li>
 * <li>The dataset is stored under the file name without its extension.</li>
 * </ul>
 * <p>
 * A file that cannot be read is logged and skipped; the remaining files are
 * still ingested.
 * </p>
 *
 * @since 1.0.0
 */
public class CsvIngester {

    private static final Logger LOG = LoggerFactory.getLogger(CsvIngester.class);

    private static final String CSV_SUFFIX = ".csv";
    private static final List<Charset> CHARSETS = List.of(StandardCharsets.UTF_8, StandardCharsets.ISO_8859_1);
    private static final Pattern NUMBER = Pattern.compile("[+-]?\\d+(\\.\\d+)?");
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final ObjectReader reader;

    public CsvIngester() {
        CsvMapper mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.reader = mapper.readerFor(String[].class);
    }

    /**
     * Ingest every CSV file in {@code directory}, in file-name order.
     *
     * @param directory the input directory
     * @return the loaded datasets, possibly empty
     * @throws IllegalArgumentException if the directory does not exist
     */
    public RecordStore ingestAll(Path directory) {
        Objects.requireNonNull(directory, "Input directory must not be null");
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Input directory not found: " + directory);
        }

        List<Path> files = discover(directory);
        LOG.info("Found {} CSV file(s) in {}", files.size(), directory);

        RecordStore.Builder store = RecordStore.builder();
        for (Path file : files) {
            String source = sourceName(file);
            try {
                Dataset dataset = load(file);
                store.add(source, dataset);
                LOG.info("  Loaded {}: {} rows, {} columns", source, dataset.size(), dataset.getColumns().size());
            } catch (IOException | RuntimeException e) {
                LOG.error("Failed to load {} – skipping", file, e);
            }
        }
        return store.build();
    }

    /**
     * Load one CSV file.
     *
     * @param file the file
     * @return its dataset
     * @throws IOException if no supported encoding can read the file
     */
    public Dataset load(Path file) throws IOException {
        IOException last = null;
        for (Charset charset : CHARSETS) {
            try (Reader in = Files.newBufferedReader(file, charset)) {
                return toDataset(readRecords(in));
            } catch (IOException | UncheckedIOException e) {
                last = e instanceof UncheckedIOException u ? u.getCause() : (IOException) e;
                LOG.debug("Could not read {} as {}: {}", file, charset, e.getMessage());
            }
        }
        throw last;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<String[]> readRecords(Reader in) throws IOException {
        try (MappingIterator<String[]> it = reader.readValues(in)) {
            return it.readAll();
        }
    }

    static Dataset toDataset(List<String[]> records) {
        if (records.isEmpty()) {
            return Dataset.empty();
        }
        List<String> columns = headerColumns(records.get(0));
        List<Row> rows = new ArrayList<>(records.size() - 1);
        int dropped = 0;
        for (int r = 1; r < records.size(); r++) {
            String[] record = records.get(r);
            Map<String, CellValue> cells = new LinkedHashMap<>();
            for (int c = 0; c < columns.size(); c++) {
                cells.put(columns.get(c), c < record.length ? typed(record[c]) : CellValue.nullValue());
            }
            if (record.length > columns.size()) {
                dropped++;
            }
            rows.add(new Row(cells));
        }
        if (dropped > 0) {
            LOG.warn("{} record(s) had more cells than the header; surplus cells dropped", dropped);
        }
        return new Dataset(columns, rows);
    }

    private static List<String> headerColumns(String[] header) {
        List<String> columns = new ArrayList<>(header.length);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < header.length; i++) {
            String raw = header[i] != null ? header[i] : "";
            if (i == 0 && !raw.isEmpty() && raw.charAt(0) == BYTE_ORDER_MARK) {
                raw = raw.substring(1);
            }
            String name = ColumnNames.normalize(raw);
            if (name.isEmpty()) {
                name = "unnamed_" + i;
            }
            String unique = name;
            for (int n = 1; !seen.add(unique); n++) {
                unique = name + "_" + n;
            }
            columns.add(unique);
        }
        return columns;
    }

    static CellValue typed(String raw) {
        if (raw == null || raw.isBlank()) {
            return CellValue.nullValue();
        }
        String trimmed = raw.trim();
        if (NUMBER.matcher(trimmed).matches()) {
            return CellValue.number(new BigDecimal(trimmed));
        }
        return CellValue.text(raw);
    }

    private static List<Path> discover(Path directory) {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(CSV_SUFFIX))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + directory, e);
        }
    }

    private static String sourceName(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - CSV_SUFFIX.length());
    }
}
