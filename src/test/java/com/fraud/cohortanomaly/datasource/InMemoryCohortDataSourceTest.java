package com.fraud.cohortanomaly.datasource;

import com.fraud.cohortanomaly.exception.EmptyResultException;
import com.fraud.cohortanomaly.model.CohortKey;
import com.fraud.cohortanomaly.model.DetectionWindow;
import com.fraud.cohortanomaly.model.MetricSeries;
import com.fraud.cohortanomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.fraud.cohortanomaly.testutil.TestDataFactory.merchant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryCohortDataSourceTest {

    private InMemoryCohortDataSource dataSource;

    @BeforeEach
    void setUp() {
        dataSource = new InMemoryCohortDataSource();
        dataSource.load(merchant("M-2"), "tx_count", TestDataFactory.constantSeries(20, 1.0));
        dataSource.load(merchant("M-1"), "tx_count", TestDataFactory.constantSeries(20, 2.0));

        Map<String, String> dims = new LinkedHashMap<>();
        dims.put("merchant_id", "M-1");
        dims.put("device_type", "ios");
        dataSource.load(CohortKey.of(dims), "tx_count", TestDataFactory.constantSeries(20, 3.0));
    }

    @Test
    void getCohorts_matchesDetectorDimensionsSorted() {
        assertThat(dataSource.getCohorts(TestDataFactory.createStlDetector("DET-1"), TestDataFactory.windowFor(20)))
                .containsExactly(merchant("M-1"), merchant("M-2"));
    }

    @Test
    void getSeries_trimsToWindow() {
        DetectionWindow firstFive = TestDataFactory.windowFor(5);

        MetricSeries series = dataSource.getSeries(merchant("M-1"), "tx_count", firstFive);

        assertThat(series.size()).isEqualTo(5);
    }

    @Test
    void getSeries_unknownMetric_throwsEmptyResult() {
        assertThatThrownBy(() -> dataSource.getSeries(merchant("M-1"), "decline_rate", TestDataFactory.windowFor(5)))
                .isInstanceOf(EmptyResultException.class);
    }

    @Test
    void clear_removesEverything() {
        dataSource.clear();

        assertThat(dataSource.getCohorts(TestDataFactory.createStlDetector("DET-1"), TestDataFactory.windowFor(20)))
                .isEmpty();
    }
}
