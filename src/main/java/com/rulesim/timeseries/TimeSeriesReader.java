package com.rulesim.timeseries;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import com.rulesim.domain.model.TimeSeriesRow;
import com.rulesim.exception.DataFormatException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads one asset's comma-separated feature file.
 *
 * <p>The header names the binary attribute columns plus {@code X} (realized percentage
 * change, float) and {@code T} (timestamp). Every column other than X and T is an
 * attribute. Attribute cells are read as integers; anything other than 1 is stored as 0.
 * Rows must already be in chronological order; gaps are the producer's responsibility.
 */
public class TimeSeriesReader {

    static final String X_COLUMN = "X";
    static final String T_COLUMN = "T";

    /**
     * @throws DataFormatException if X or T is missing, a value cannot be parsed, or rows go
     *     backwards in time
     */
    public TimeSeries read(String asset, Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
                CSVReader csvReader = new CSVReaderBuilder(reader).build()) {
            String[] header = csvReader.readNext();
            if (header == null) {
                throw new DataFormatException(path, "empty time-series file");
            }

            int xColumn = -1;
            int tColumn = -1;
            Map<Integer, String> attributeColumns = new HashMap<>();
            Set<String> attributeNames = new LinkedHashSet<>();
            for (int i = 0; i < header.length; i++) {
                String name = header[i].trim();
                if (X_COLUMN.equals(name)) {
                    xColumn = i;
                } else if (T_COLUMN.equals(name)) {
                    tColumn = i;
                } else if (!name.isEmpty()) {
                    attributeColumns.put(i, name);
                    attributeNames.add(name);
                }
            }
            if (xColumn < 0 || tColumn < 0) {
                throw new DataFormatException(path, "header must contain X and T columns");
            }

            List<TimeSeriesRow> rows = new ArrayList<>();
            LocalDateTime previous = null;
            String[] cells;
            int lineNo = 1;
            while ((cells = csvReader.readNext()) != null) {
                lineNo++;
                if (cells.length == 1 && cells[0].isBlank()) {
                    continue;
                }
                if (cells.length < header.length) {
                    throw new DataFormatException(path, "line " + lineNo + ": expected " + header.length
                            + " cells, got " + cells.length);
                }

                LocalDateTime timestamp = parseTimestamp(path, cells[tColumn], lineNo);
                if (previous != null && timestamp.isBefore(previous)) {
                    throw new DataFormatException(path, "line " + lineNo + ": timestamp " + timestamp
                            + " precedes " + previous);
                }
                previous = timestamp;

                Map<String, Integer> attributes = new HashMap<>(attributeColumns.size() * 2);
                for (Map.Entry<Integer, String> column : attributeColumns.entrySet()) {
                    attributes.put(column.getValue(), parseFlag(path, cells[column.getKey()], lineNo));
                }

                rows.add(TimeSeriesRow.builder()
                        .timestamp(timestamp)
                        .attributes(attributes)
                        .x(parseDouble(path, cells[xColumn], lineNo))
                        .build());
            }
            return new TimeSeries(asset, rows, attributeNames);
        } catch (IOException | CsvValidationException e) {
            throw new DataFormatException(path, "cannot read time-series file", e);
        }
    }

    private static LocalDateTime parseTimestamp(Path path, String cell, int lineNo) {
        try {
            return TimestampParser.parse(cell);
        } catch (DateTimeParseException e) {
            throw new DataFormatException(path, "line " + lineNo + ": bad timestamp '" + cell + "'", e);
        }
    }

    private static int parseFlag(Path path, String cell, int lineNo) {
        String trimmed = cell.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        try {
            return Double.parseDouble(trimmed) == 1.0 ? 1 : 0;
        } catch (NumberFormatException e) {
            throw new DataFormatException(path, "line " + lineNo + ": bad attribute value '" + cell + "'", e);
        }
    }

    private static double parseDouble(Path path, String cell, int lineNo) {
        try {
            return Double.parseDouble(cell.trim());
        } catch (NumberFormatException e) {
            throw new DataFormatException(path, "line " + lineNo + ": bad X value '" + cell + "'", e);
        }
    }
}
