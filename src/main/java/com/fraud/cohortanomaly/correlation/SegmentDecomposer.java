package com.fraud.cohortanomaly.correlation;

import com.fraud.cohortanomaly.config.DetectionConfig;
import com.fraud.cohortanomaly.model.Segment;
import com.fraud.cohortanomaly.model.SegmentStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Breaks an anomaly's metric change down by the values of one dimension and
 * ranks the values by how much of the change they explain.
 *
 * Ranking:
 *   importance = |delta| * shareOfDelta * stabilityWeight * rarityWeight
 *
 *   stabilityWeight  0.5 below 2x minSupport combined support, 0.75 below 4x, else 1.0
 *   rarityWeight     1.2 when the value was rare in the baseline (< 2x minSupport)
 *                    but common during the anomaly (> 2x minSupport), else 1.0
 *
 * Values are filtered by minSupport separately in each window; a value present
 * in only one window counts as 0 metric and 0 support in the other.
 */
@Component
public class SegmentDecomposer {

    private static final Logger log = LoggerFactory.getLogger(SegmentDecomposer.class);

    static final double RARITY_BOOST = 1.2;

    private final DetectionConfig config;

    public SegmentDecomposer(DetectionConfig config) {
        this.config = config;
    }

    public List<Segment> decompose(String dimension, List<SegmentStats> baseline, List<SegmentStats> during) {
        DetectionConfig.Correlation correlation = config.getCorrelation();
        return decompose(dimension, baseline, during, correlation.getSegmentMinSupport(), correlation.getSegmentTopK());
    }

    public List<Segment> decompose(String dimension, List<SegmentStats> baseline, List<SegmentStats> during,
                                   long minSupport, int topK) {
        if (minSupport < 1) {
            throw new IllegalArgumentException("minSupport must be >= 1, got " + minSupport);
        }
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be >= 1, got " + topK);
        }

        Map<String, SegmentStats> base = supported(baseline, minSupport);
        Map<String, SegmentStats> dur = supported(during, minSupport);

        Set<String> values = new LinkedHashSet<>(dur.keySet());
        values.addAll(base.keySet());

        double totalAbsDelta = 0.0;
        Map<String, Double> deltas = new LinkedHashMap<>();
        for (String value : values) {
            double delta = metricOf(dur.get(value)) - metricOf(base.get(value));
            deltas.put(value, delta);
            totalAbsDelta += Math.abs(delta);
        }

        List<Segment> segments = new ArrayList<>(values.size());
        for (String value : values) {
            double delta = deltas.get(value);
            double share = totalAbsDelta > 0 ? Math.abs(delta) / totalAbsDelta : 0.0;
            long baseSupport = supportOf(base.get(value));
            long duringSupport = supportOf(dur.get(value));

            double importance = Math.abs(delta) * share
                    * stabilityWeight(baseSupport + duringSupport, minSupport)
                    * rarityWeight(baseSupport, duringSupport, minSupport);

            SegmentStats entitySource = dur.containsKey(value) ? dur.get(value) : base.get(value);
            segments.add(Segment.builder()
                    .dimension(dimension)
                    .dimensionValue(value)
                    .deltaMetric(delta)
                    .shareOfDelta(share)
                    .entityCount(entitySource.getEntityCount())
                    .importance(importance)
                    .build());
        }

        segments.sort(Comparator.comparingDouble(Segment::getImportance).reversed()
                .thenComparing(Segment::getDimensionValue));
        List<Segment> top = segments.size() > topK ? new ArrayList<>(segments.subList(0, topK)) : segments;

        log.debug("Decomposed {} into {} supported values (min support {}), returning {}",
                dimension, values.size(), minSupport, top.size());
        return top;
    }

    static double stabilityWeight(long combinedSupport, long minSupport) {
        if (combinedSupport < minSupport * 2) return 0.5;
        if (combinedSupport < minSupport * 4) return 0.75;
        return 1.0;
    }

    static double rarityWeight(long baseSupport, long duringSupport, long minSupport) {
        return baseSupport < minSupport * 2 && duringSupport > minSupport * 2 ? RARITY_BOOST : 1.0;
    }

    private static Map<String, SegmentStats> supported(List<SegmentStats> stats, long minSupport) {
        Map<String, SegmentStats> out = new LinkedHashMap<>();
        if (stats == null) return out;
        for (SegmentStats s : stats) {
            if (s.getDimensionValue() != null && s.getSupport() >= minSupport) {
                out.put(s.getDimensionValue(), s);
            }
        }
        return out;
    }

    private static double metricOf(SegmentStats stats) {
        return stats == null ? 0.0 : stats.getMetricValue();
    }

    private static long supportOf(SegmentStats stats) {
        return stats == null ? 0L : stats.getSupport();
    }
}
