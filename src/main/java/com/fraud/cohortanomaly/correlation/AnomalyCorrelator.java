package com.fraud.cohortanomaly.correlation;

import com.fraud.cohortanomaly.config.DetectionConfig;
import com.fraud.cohortanomaly.engine.stats.RobustStats;
import com.fraud.cohortanomaly.model.AnomalyEvent;
import com.fraud.cohortanomaly.model.CandidateEntityGroup;
import com.fraud.cohortanomaly.model.Confidence;
import com.fraud.cohortanomaly.model.DetectorParams;
import com.fraud.cohortanomaly.model.EntityActivity;
import com.fraud.cohortanomaly.model.PatternType;
import com.fraud.cohortanomaly.model.RootPattern;
import com.fraud.cohortanomaly.model.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a confirmed anomaly plus its segment breakdown and candidate entities
 * into ranked root-cause hypotheses.
 *
 * Patterns:
 *   CONCENTRATION  one segment carries more than the concentration share of the delta
 *   BURST          many entities of one type with near-uniform activity
 *   MULTI_SEGMENT  the top two segments jointly carry most of the delta
 *
 * Results are ordered HIGH confidence first, then by impact descending.
 * Pure: no I/O, same inputs give the same output.
 */
@Component
public class AnomalyCorrelator {

    private static final Logger log = LoggerFactory.getLogger(AnomalyCorrelator.class);

    private static final Comparator<RootPattern> RANKING = Comparator
            .comparing((RootPattern p) -> p.getConfidence() == Confidence.HIGH ? 0 : 1)
            .thenComparing(RootPattern::getImpact, Comparator.reverseOrder())
            .thenComparing(RootPattern::getPatternType);

    private final DetectionConfig config;

    public AnomalyCorrelator(DetectionConfig config) {
        this.config = config;
    }

    public List<RootPattern> correlate(AnomalyEvent anomaly, List<Segment> segments,
                                       List<CandidateEntityGroup> candidates) {
        return correlate(anomaly, segments, candidates, null);
    }

    /**
     * @param params detector parameters whose correlation overrides take precedence; may be null
     */
    public List<RootPattern> correlate(AnomalyEvent anomaly, List<Segment> segments,
                                       List<CandidateEntityGroup> candidates, DetectorParams params) {
        String anomalyId = anomaly == null ? null : anomaly.getEventId();
        List<Segment> safeSegments = segments == null ? List.of() : segments;
        List<CandidateEntityGroup> safeCandidates = candidates == null ? List.of() : candidates;

        List<RootPattern> patterns = new ArrayList<>();
        patterns.addAll(concentrations(anomalyId, safeSegments, concentrationThreshold(params)));
        patterns.addAll(bursts(anomalyId, safeCandidates, burstEntityThreshold(params)));

        RootPattern multiSegment = multiSegment(anomalyId, safeSegments, multiSegmentThreshold(params));
        if (multiSegment != null) {
            patterns.add(multiSegment);
        }

        patterns.sort(RANKING);
        log.debug("Correlated anomaly {}: {} hypotheses from {} segments, {} entity groups",
                anomalyId, patterns.size(), safeSegments.size(), safeCandidates.size());
        return patterns;
    }

    private List<RootPattern> concentrations(String anomalyId, List<Segment> segments, double threshold) {
        double dominantThreshold = config.getCorrelation().getDominantThreshold();
        List<RootPattern> out = new ArrayList<>();
        for (Segment segment : segments) {
            double share = segment.getShareOfDelta();
            if (!(share > threshold)) continue;

            boolean dominant = share > dominantThreshold;
            out.add(RootPattern.builder()
                    .patternType(PatternType.CONCENTRATION)
                    .description(String.format("%s accounts for %.0f%% of the change across %d entities",
                            segment.label(), share * 100, segment.getEntityCount()))
                    .confidence(dominant ? Confidence.HIGH : Confidence.MEDIUM)
                    .mitigationHint("Review or throttle traffic from " + segment.label())
                    .impact(share)
                    .dominant(dominant)
                    .anomalyId(anomalyId)
                    .evidence(List.of(segment.label()))
                    .build());
        }
        return out;
    }

    private List<RootPattern> bursts(String anomalyId, List<CandidateEntityGroup> groups, int entityThreshold) {
        double maxCv = config.getCorrelation().getBurstMaxCv();
        long totalActivity = 0;
        for (CandidateEntityGroup group : groups) {
            totalActivity += group.totalActivity();
        }

        List<RootPattern> out = new ArrayList<>();
        for (CandidateEntityGroup group : groups) {
            List<EntityActivity> entities = group.getEntities();
            if (entities == null || entities.size() <= entityThreshold) continue;

            double[] counts = new double[entities.size()];
            for (int i = 0; i < counts.length; i++) {
                counts[i] = entities.get(i).getActivityCount();
            }
            double cv = RobustStats.coefficientOfVariation(counts);
            if (Double.isNaN(cv) || cv > maxCv) continue;

            double impact = totalActivity > 0 ? (double) group.totalActivity() / totalActivity : 0.0;
            boolean high = entities.size() >= 2 * entityThreshold;
            out.add(RootPattern.builder()
                    .patternType(PatternType.BURST)
                    .description(String.format("%d %s entities with near-uniform activity (cv=%.2f)",
                            entities.size(), group.getEntityType(), cv))
                    .confidence(high ? Confidence.HIGH : Confidence.MEDIUM)
                    .mitigationHint("Check " + group.getEntityType()
                            + " entities for coordinated or scripted creation")
                    .impact(impact)
                    .anomalyId(anomalyId)
                    .evidence(List.of(group.getEntityType()))
                    .build());
        }
        return out;
    }

    private RootPattern multiSegment(String anomalyId, List<Segment> segments, double threshold) {
        if (segments.size() < 2) return null;

        List<Segment> ranked = new ArrayList<>(segments);
        ranked.sort(Comparator.comparingDouble(Segment::getShareOfDelta).reversed());
        Segment first = ranked.get(0);
        Segment second = ranked.get(1);
        double combined = first.getShareOfDelta() + second.getShareOfDelta();
        if (!(combined > threshold)) return null;

        boolean high = combined >= config.getCorrelation().getMultiSegmentHighConfidence();
        return RootPattern.builder()
                .patternType(PatternType.MULTI_SEGMENT)
                .description(String.format("%s and %s together account for %.0f%% of the change",
                        first.label(), second.label(), combined * 100))
                .confidence(high ? Confidence.HIGH : Confidence.MEDIUM)
                .mitigationHint("Look for a shared actor behind " + first.label() + " and " + second.label())
                .impact(Math.min(1.0, combined))
                .anomalyId(anomalyId)
                .evidence(List.of(first.label(), second.label()))
                .build();
    }

    private double concentrationThreshold(DetectorParams params) {
        if (params != null && params.getConcentrationThreshold() != null) {
            return params.getConcentrationThreshold();
        }
        return config.getCorrelation().getConcentrationThreshold();
    }

    private int burstEntityThreshold(DetectorParams params) {
        if (params != null && params.getBurstEntityThreshold() != null) {
            return params.getBurstEntityThreshold();
        }
        return config.getCorrelation().getBurstEntityThreshold();
    }

    private double multiSegmentThreshold(DetectorParams params) {
        if (params != null && params.getMultiSegmentThreshold() != null) {
            return params.getMultiSegmentThreshold();
        }
        return config.getCorrelation().getMultiSegmentThreshold();
    }
}
