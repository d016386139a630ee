package com.rulesim.timeseries;

import com.rulesim.config.RulesimProperties;
import com.rulesim.exception.MissingInputException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Time-series store: loads an asset's full feature history from
 * {@code rulesim.input.data-file-pattern} with {@code {asset}} substituted.
 */
@Service
public class TimeSeriesRepository {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesRepository.class);

    private final RulesimProperties rulesimProperties;

    public TimeSeriesRepository(RulesimProperties rulesimProperties) {
        this.rulesimProperties = rulesimProperties;
    }

    /**
     * @throws MissingInputException if the file does not exist
     * @throws com.rulesim.exception.DataFormatException if it cannot be parsed
     */
    public TimeSeries load(String asset) {
        Path path = resolveDataFile(asset);
        if (!Files.isRegularFile(path)) {
            throw new MissingInputException("Time-series file", path);
        }
        TimeSeries series = new TimeSeriesReader().read(asset, path);
        log.info("Loaded {} ({} attributes) from {}", series, series.getAttributeNames().size(), path);
        return series;
    }

    Path resolveDataFile(String asset) {
        return Paths.get(rulesimProperties.getInput().getDataFilePattern().replace("{asset}", asset));
    }
}
