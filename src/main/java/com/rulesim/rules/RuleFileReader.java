package com.rulesim.rules;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import com.rulesim.domain.enums.RuleDirection;
import com.rulesim.domain.enums.RuleSortKey;
import com.rulesim.domain.model.Rule;
import com.rulesim.domain.vo.ConditionParseResult;
import com.rulesim.exception.DataFormatException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads one tab-separated rule pool file written by the rule miner.
 *
 * <p>Layout: a header row, then one row per rule with condition columns
 * {@code Attr1..Attr8} (each {@code 0} or {@code <attr>(t-<lag>)}), the statistics
 * {@code X_mean}, {@code X_sigma}, {@code support_count}, {@code support_rate}, and
 * optionally {@code ExtremeScore}, {@code SNR}, {@code Extremeness},
 * {@code SignalStrength}. Newer miner builds name the statistics {@code X(t+1)_mean} and
 * {@code X(t+1)_sigma}; both spellings are accepted.
 *
 * <p>Rows are ranked by the requested key (descending, stable, so ties keep file order),
 * truncated to {@code topN}, and only then parsed into rules. A condition that fails to
 * parse is dropped from its rule with a warning; a rule left without conditions is
 * discarded. A truncated pool can therefore hold fewer than {@code topN} rules.
 */
public class RuleFileReader {

    private static final Logger log = LoggerFactory.getLogger(RuleFileReader.class);

    static final int MAX_CONDITION_COLUMNS = 8;

    private static final String SUPPORT_COUNT = "support_count";
    private static final String SUPPORT_RATE = "support_rate";
    private static final List<String> MEAN_COLUMNS = List.of("X_mean", "X(t+1)_mean");
    private static final List<String> SIGMA_COLUMNS = List.of("X_sigma", "X(t+1)_sigma");

    private int droppedConditions;
    private int discardedRules;

    /**
     * Parses the rule file.
     *
     * @param path      rule file location (must exist)
     * @param direction direction every rule in this file is tagged with
     * @param topN      rules to keep after ranking, 0 for all
     * @param sortBy    ranking key
     * @return parsed rules in ranked order
     * @throws DataFormatException if the header lacks a required column or a statistic is not numeric
     */
    public List<Rule> read(Path path, RuleDirection direction, int topN, RuleSortKey sortBy) {
        droppedConditions = 0;
        discardedRules = 0;

        List<String[]> lines = readLines(path);
        if (lines.isEmpty()) {
            throw new DataFormatException(path, "rule file has no header row");
        }

        Map<String, Integer> header = indexHeader(lines.get(0));
        int meanColumn = requireColumn(path, header, MEAN_COLUMNS);
        int sigmaColumn = requireColumn(path, header, SIGMA_COLUMNS);
        int supportCountColumn = requireColumn(path, header, List.of(SUPPORT_COUNT));
        int supportRateColumn = requireColumn(path, header, List.of(SUPPORT_RATE));
        List<Integer> conditionColumns = new ArrayList<>();
        for (int i = 1; i <= MAX_CONDITION_COLUMNS; i++) {
            Integer column = header.get("Attr" + i);
            if (column != null) {
                conditionColumns.add(column);
            }
        }
        if (conditionColumns.isEmpty()) {
            throw new DataFormatException(path, "no Attr1..Attr8 condition columns in header");
        }

        Integer sortColumn = null;
        if (sortBy.getColumn() != null) {
            sortColumn = header.get(sortBy.getColumn());
            if (sortColumn == null) {
                throw new DataFormatException(path, "ranking column " + sortBy.getColumn() + " not present");
            }
        }

        List<RuleRow> rows = new ArrayList<>();
        int ordinal = 0;
        for (int lineNo = 1; lineNo < lines.size(); lineNo++) {
            String[] cells = lines.get(lineNo);
            if (isBlank(cells)) {
                continue;
            }
            double sortValue = sortColumn == null ? 0 : number(path, cells, sortColumn, lineNo);
            rows.add(new RuleRow(ordinal++, lineNo, cells, sortValue));
        }

        if (sortColumn != null) {
            rows.sort(Comparator.comparingDouble(RuleRow::sortValue).reversed());
        }
        if (topN > 0 && rows.size() > topN) {
            rows = rows.subList(0, topN);
        }

        List<Rule> rules = new ArrayList<>(rows.size());
        for (RuleRow row : rows) {
            Rule.RuleBuilder builder = Rule.builder()
                    .id(row.ordinal())
                    .direction(direction)
                    .xMean(number(path, row.cells(), meanColumn, row.lineNo()))
                    .xSigma(number(path, row.cells(), sigmaColumn, row.lineNo()))
                    .supportCount((int) Math.round(number(path, row.cells(), supportCountColumn, row.lineNo())))
                    .supportRate(number(path, row.cells(), supportRateColumn, row.lineNo()))
                    .extremeScore(optionalNumber(path, header, row, "ExtremeScore"))
                    .snr(optionalNumber(path, header, row, "SNR"))
                    .extremeness(optionalNumber(path, header, row, "Extremeness"))
                    .signalStrength(optionalNumber(path, header, row, "SignalStrength"));

            int conditionCount = 0;
            for (int column : conditionColumns) {
                String cell = cell(row.cells(), column);
                if (ConditionParser.isAbsent(cell)) {
                    continue;
                }
                ConditionParseResult result = ConditionParser.parse(cell);
                if (result.isOk()) {
                    builder.condition(result.condition());
                    conditionCount++;
                } else {
                    droppedConditions++;
                    log.warn(
                            "Dropping malformed condition '{}' of {} rule {} in {}: {}",
                            result.rawToken(), direction.getKey(), row.ordinal(), path, result.error());
                }
            }

            if (conditionCount == 0) {
                discardedRules++;
                log.warn("Discarding {} rule {} in {}: no valid conditions", direction.getKey(), row.ordinal(), path);
                continue;
            }
            rules.add(builder.build());
        }
        return rules;
    }

    /** Conditions dropped during the last {@link #read} call. */
    public int getDroppedConditions() {
        return droppedConditions;
    }

    /** Rules discarded for having no valid condition during the last {@link #read} call. */
    public int getDiscardedRules() {
        return discardedRules;
    }

    private List<String[]> readLines(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
                CSVReader csvReader = new CSVReaderBuilder(reader)
                        .withCSVParser(new CSVParserBuilder()
                                .withSeparator('\t')
                                .withIgnoreQuotations(true)
                                .build())
                        .build()) {
            return csvReader.readAll();
        } catch (IOException | CsvException e) {
            throw new DataFormatException(path, "cannot read rule file", e);
        }
    }

    private static Map<String, Integer> indexHeader(String[] headerCells) {
        Map<String, Integer> header = new HashMap<>();
        for (int i = 0; i < headerCells.length; i++) {
            header.putIfAbsent(headerCells[i].trim(), i);
        }
        return header;
    }

    private static int requireColumn(Path path, Map<String, Integer> header, List<String> candidates) {
        for (String candidate : candidates) {
            Integer column = header.get(candidate);
            if (column != null) {
                return column;
            }
        }
        throw new DataFormatException(path, "missing column " + String.join(" / ", candidates));
    }

    private static double optionalNumber(Path path, Map<String, Integer> header, RuleRow row, String column) {
        Integer index = header.get(column);
        if (index == null) {
            return 0;
        }
        String cell = cell(row.cells(), index);
        return cell.isEmpty() ? 0 : number(path, row.cells(), index, row.lineNo());
    }

    private static double number(Path path, String[] cells, int column, int lineNo) {
        String cell = cell(cells, column);
        try {
            return Double.parseDouble(cell);
        } catch (NumberFormatException e) {
            throw new DataFormatException(path, "line " + (lineNo + 1) + ": not a number '" + cell + "'", e);
        }
    }

    private static String cell(String[] cells, int column) {
        return column < cells.length ? cells[column].trim() : "";
    }

    private static boolean isBlank(String[] cells) {
        for (String cell : cells) {
            if (!cell.isBlank()) {
                return false;
            }
        }
        return true;
    }

    private record RuleRow(int ordinal, int lineNo, String[] cells, double sortValue) {}
}
