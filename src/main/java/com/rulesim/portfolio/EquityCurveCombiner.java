package com.rulesim.portfolio;

import com.rulesim.domain.model.AssetResult;
import com.rulesim.domain.model.EquityPoint;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Blends per-asset equity curves into one portfolio curve.
 *
 * <p>The timeline is the union of all assets' trade timestamps. Each asset's equity is
 * forward-filled across it (1.0 before its first trade), and the portfolio value at each
 * timestamp is {@code 1 + sum(weight * (equity - 1))}. No rebalancing or compounding.
 */
public final class EquityCurveCombiner {

    private EquityCurveCombiner() {}

    public static SortedSet<LocalDateTime> timeline(Map<String, AssetResult> assets) {
        SortedSet<LocalDateTime> timeline = new TreeSet<>();
        assets.values().forEach(r -> r.getEquityCurve().forEach(p -> timeline.add(p.getTimestamp())));
        return timeline;
    }

    public static List<EquityPoint> combine(Map<String, AssetResult> assets, Map<String, Double> weights) {
        SortedSet<LocalDateTime> timeline = timeline(assets);

        // Later points at the same timestamp overwrite earlier ones
        Map<String, NavigableMap<LocalDateTime, Double>> curves = new LinkedHashMap<>();
        for (Map.Entry<String, AssetResult> entry : assets.entrySet()) {
            NavigableMap<LocalDateTime, Double> curve = new TreeMap<>();
            entry.getValue().getEquityCurve().forEach(p -> curve.put(p.getTimestamp(), p.getEquity()));
            curves.put(entry.getKey(), curve);
        }

        List<EquityPoint> combined = new ArrayList<>(timeline.size());
        for (LocalDateTime ts : timeline) {
            double equity = 1.0;
            for (Map.Entry<String, NavigableMap<LocalDateTime, Double>> entry : curves.entrySet()) {
                Map.Entry<LocalDateTime, Double> last = entry.getValue().floorEntry(ts);
                double assetEquity = last != null ? last.getValue() : 1.0;
                equity += weights.getOrDefault(entry.getKey(), 0.0) * (assetEquity - 1.0);
            }
            combined.add(new EquityPoint(ts, equity));
        }
        return combined;
    }
}
