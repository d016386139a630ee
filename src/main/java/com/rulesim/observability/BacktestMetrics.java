package com.rulesim.observability;

import com.rulesim.domain.enums.SkipReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the backtest engine's Micrometer metrics.
 *
 * <ul>
 *   <li><b>rulesim.signals.generated</b> (counter): signals surviving deduplication</li>
 *   <li><b>rulesim.trades.executed</b> (counter): trades settled by the simulator</li>
 *   <li><b>rulesim.conditions.dropped</b> (counter): malformed rule conditions discarded at load</li>
 *   <li><b>rulesim.units.skipped</b> (counter, tags unit/reason): assets or periods left out of
 *       aggregation</li>
 *   <li><b>rulesim.unit.duration</b> (timer, tag unit): wall time of one asset or period run</li>
 * </ul>
 */
@Service
public class BacktestMetrics {

    private static final Logger log = LoggerFactory.getLogger(BacktestMetrics.class);

    private final MeterRegistry meterRegistry;
    private final Counter signalsCounter;
    private final Counter tradesCounter;
    private final Counter droppedConditionsCounter;

    public BacktestMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.signalsCounter = Counter.builder("rulesim.signals.generated")
                .description("Signals emitted after deduplication")
                .register(meterRegistry);

        this.tradesCounter = Counter.builder("rulesim.trades.executed")
                .description("Trades settled by the trade simulator")
                .register(meterRegistry);

        this.droppedConditionsCounter = Counter.builder("rulesim.conditions.dropped")
                .description("Rule conditions discarded because they could not be parsed")
                .register(meterRegistry);
    }

    public void recordSignals(int count) {
        signalsCounter.increment(count);
    }

    public void recordTrades(int count) {
        tradesCounter.increment(count);
    }

    public void recordDroppedConditions(int count) {
        droppedConditionsCounter.increment(count);
    }

    /**
     * Counts a skipped unit.
     *
     * @param unit   unit kind, "asset" or "period"
     * @param reason why it was skipped
     */
    public void recordSkipped(String unit, SkipReason reason) {
        Counter.builder("rulesim.units.skipped")
                .description("Batch units excluded from aggregation")
                .tag("unit", unit)
                .tag("reason", reason.name())
                .register(meterRegistry)
                .increment();
        log.debug("Skipped {} unit recorded (reason={})", unit, reason);
    }

    /** Runs {@code work} and records its duration under the given unit kind. */
    public <T> T timeUnit(String unit, Supplier<T> work) {
        Timer timer = Timer.builder("rulesim.unit.duration")
                .description("Wall time of one asset or walk-forward period run")
                .tag("unit", unit)
                .register(meterRegistry);
        return timer.record(work);
    }

    public double getSignalCount() {
        return signalsCounter.count();
    }

    public double getTradeCount() {
        return tradesCounter.count();
    }

    public double getDroppedConditionCount() {
        return droppedConditionsCounter.count();
    }

    public double getSkippedCount(String unit) {
        return meterRegistry.find("rulesim.units.skipped").tag("unit", unit).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }
}
