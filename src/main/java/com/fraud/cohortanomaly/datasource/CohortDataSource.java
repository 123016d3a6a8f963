package com.fraud.cohortanomaly.datasource;

import com.fraud.cohortanomaly.model.CohortKey;
import com.fraud.cohortanomaly.model.DetectionWindow;
import com.fraud.cohortanomaly.model.Detector;
import com.fraud.cohortanomaly.model.MetricSeries;

import java.util.List;

/**
 * Supplier of cohorts and their metric series. Implementations wrap the
 * warehouse or store that holds the pre-aggregated metric rows.
 *
 * Failure contract:
 * - {@link com.fraud.cohortanomaly.exception.DataSourceConnectionException}: the source is
 *   unreachable; the whole run is aborted.
 * - {@link com.fraud.cohortanomaly.exception.EmptyResultException}: nothing stored for one
 *   cohort/metric; that cohort is skipped.
 */
public interface CohortDataSource {

    /**
     * Distinct cohorts over the detector's cohort dimensions with data in the window.
     */
    List<CohortKey> getCohorts(Detector detector, DetectionWindow window);

    /**
     * The metric's observations for one cohort, ordered by time.
     */
    MetricSeries getSeries(CohortKey cohort, String metric, DetectionWindow window);
}
