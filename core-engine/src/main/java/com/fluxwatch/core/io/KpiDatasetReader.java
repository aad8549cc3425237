package com.fluxwatch.core.io;

import com.fluxwatch.core.model.Observation;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Reads a labelled multi-KPI CSV dataset.
 *
 * <h3>Format</h3>
 * <p>
 * A header row naming at least the columns {@code timestamp}, {@code value},
 * {@code label}, {@code KPI ID}, {@code missing} and {@code is_test}. Column
 * order does not matter. {@code label}, {@code missing} and {@code is_test}
 * are 0/1 flags. Rows are grouped by KPI and sorted by timestamp; the
 * training length of a KPI is its number of {@code is_test == 0} rows.
 * </p>
 *
 * @since 1.0.0
 */
public final class KpiDatasetReader {

    private static final Logger LOG = LoggerFactory.getLogger(KpiDatasetReader.class);

    public static final String COL_TIMESTAMP = "timestamp";
    public static final String COL_VALUE = "value";
    public static final String COL_LABEL = "label";
    public static final String COL_KPI_ID = "KPI ID";
    public static final String COL_MISSING = "missing";
    public static final String COL_IS_TEST = "is_test";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();

    private KpiDatasetReader() {
        // utility class
    }

    /**
     * @param path CSV file
     * @return series keyed and ordered by KPI id
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if a row is malformed
     */
    public static Map<String, KpiSeries> read(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        LOG.info("Loading KPI dataset from {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static Map<String, KpiSeries> read(Reader reader) throws IOException {
        Objects.requireNonNull(reader, "reader must not be null");
        Map<String, List<Row>> grouped = new TreeMap<>();
        try (CSVParser parser = new CSVParser(reader, FORMAT)) {
            for (CSVRecord record : parser) {
                Row row = parse(record);
                grouped.computeIfAbsent(row.kpiId, k -> new ArrayList<>()).add(row);
            }
        }

        Map<String, KpiSeries> series = new TreeMap<>();
        for (Map.Entry<String, List<Row>> entry : grouped.entrySet()) {
            series.put(entry.getKey(), toSeries(entry.getKey(), entry.getValue()));
        }
        LOG.info("Loaded {} KPI(s)", series.size());
        return series;
    }

    private static Row parse(CSVRecord record) {
        try {
            return new Row(
                    record.get(COL_KPI_ID),
                    parseTimestamp(record.get(COL_TIMESTAMP)),
                    Double.parseDouble(record.get(COL_VALUE)),
                    parseFlag(record.get(COL_LABEL)),
                    parseFlag(record.get(COL_MISSING)),
                    parseFlag(record.get(COL_IS_TEST)));
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new IllegalArgumentException("Malformed dataset row " + record.getRecordNumber() + ": "
                    + e.getMessage(), e);
        }
    }

    /** Accepts integral values written in floating-point notation. */
    private static long parseTimestamp(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            return (long) Double.parseDouble(raw);
        }
    }

    private static boolean parseFlag(String raw) {
        return switch (raw) {
            case "0", "0.0", "false", "False" -> false;
            case "1", "1.0", "true", "True" -> true;
            default -> throw new IllegalArgumentException("expected a 0/1 flag, got '" + raw + "'");
        };
    }

    private static KpiSeries toSeries(String kpiId, List<Row> rows) {
        rows.sort(Comparator.comparingLong(row -> row.timestamp));
        List<Observation> observations = new ArrayList<>(rows.size());
        boolean[] labels = new boolean[rows.size()];
        int trainLength = 0;
        for (int i = 0; i < rows.size(); i++) {
            Row row = rows.get(i);
            observations.add(new Observation(row.timestamp, row.value, row.missing));
            labels[i] = row.label;
            if (!row.test) {
                trainLength++;
            }
        }
        LOG.debug("KPI '{}': {} row(s), train length {}", kpiId, rows.size(), trainLength);
        return new KpiSeries(kpiId, observations, labels, trainLength);
    }

    private static final class Row {
        private final String kpiId;
        private final long timestamp;
        private final double value;
        private final boolean label;
        private final boolean missing;
        private final boolean test;

        Row(String kpiId, long timestamp, double value, boolean label, boolean missing, boolean test) {
            this.kpiId = kpiId;
            this.timestamp = timestamp;
            this.value = value;
            this.label = label;
            this.missing = missing;
            this.test = test;
        }
    }
}
