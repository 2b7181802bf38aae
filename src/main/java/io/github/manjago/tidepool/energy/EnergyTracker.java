package io.github.manjago.tidepool.energy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Tracks energy flow by source during one simulation run.
 *
 * Keeps running totals since the start of the run and totals for the
 * current tick. Created by the simulator and passed to whoever needs it;
 * there is no shared instance.
 */
public class EnergyTracker implements EnergyAccounting {

    private final Map<String, Double> totals = new TreeMap<>();
    private final Map<String, Double> currentTick = new TreeMap<>();
    private long tick = 0;
    private long records = 0;

    /**
     * Start a new tick. Per-tick totals are cleared.
     */
    public void setTick(long tick) {
        this.tick = tick;
        currentTick.clear();
    }

    @Override
    public void record(String source, double delta) {
        if (delta == 0.0) {
            return;
        }
        totals.merge(source, delta, Double::sum);
        currentTick.merge(source, delta, Double::sum);
        records++;
    }

    /**
     * Net amount recorded for a source since the start of the run.
     */
    public double getTotal(String source) {
        return totals.getOrDefault(source, 0.0);
    }

    /**
     * Net amount recorded for a source in the current tick.
     */
    public double getTickTotal(String source) {
        return currentTick.getOrDefault(source, 0.0);
    }

    /**
     * @return all sources, sorted by name
     */
    public Map<String, Double> getTotals() {
        return Collections.unmodifiableMap(new TreeMap<>(totals));
    }

    /**
     * Sum over all sources.
     */
    public double getNet() {
        return totals.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    /**
     * Sources ordered by absolute volume, largest first.
     */
    public Map<String, Double> getTopSources(int limit) {
        return totals.entrySet().stream()
                .sorted((a, b) -> Double.compare(Math.abs(b.getValue()), Math.abs(a.getValue())))
                .limit(limit)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
    }

    public long getTick() {
        return tick;
    }

    public long getRecordCount() {
        return records;
    }

    /**
     * Clear all recorded flow.
     */
    public void clear() {
        totals.clear();
        currentTick.clear();
        records = 0;
    }

    /**
     * Get statistics about energy flow.
     */
    public String getStats() {
        if (totals.isEmpty()) {
            return "No energy flow recorded";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Energy flow (%,d records, net %+.1f):", records, getNet()));
        for (Map.Entry<String, Double> e : totals.entrySet()) {
            sb.append(String.format("%n  %-22s %+12.1f", e.getKey(), e.getValue()));
        }
        return sb.toString();
    }
}
