package com.rulesim.walkforward;

import com.rulesim.config.SimulationConfig;
import com.rulesim.domain.model.Period;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits {@code [startYear, endYear]} into rolling calendar-year train/test periods.
 *
 * <p>The first test year is {@code startYear + trainYears}; later ones step by
 * {@code testYears} while the test year does not exceed {@code endYear}. Each train window
 * covers the {@code trainYears} full years before its test year, and each test window covers
 * {@code testYears} full years, so consecutive test windows are contiguous.
 */
public final class PeriodGenerator {

    private PeriodGenerator() {}

    public static List<Period> generate(SimulationConfig config) {
        return generate(config.getTrainYears(), config.getTestYears(), config.getStartYear(), config.getEndYear());
    }

    public static List<Period> generate(int trainYears, int testYears, int startYear, int endYear) {
        if (trainYears < 1 || testYears < 1) {
            throw new IllegalArgumentException("trainYears and testYears must be positive");
        }
        List<Period> periods = new ArrayList<>();
        int index = 1;
        for (int testYear = startYear + trainYears; testYear <= endYear; testYear += testYears) {
            periods.add(Period.builder()
                    .index(index++)
                    .trainStart(LocalDate.of(testYear - trainYears, 1, 1))
                    .trainEnd(LocalDate.of(testYear - 1, 12, 31))
                    .testStart(LocalDate.of(testYear, 1, 1))
                    .testEnd(LocalDate.of(testYear + testYears - 1, 12, 31))
                    .testYear(testYear)
                    .build());
        }
        return periods;
    }
}
