package com.fraud.cohortanomaly.repository;

import com.fraud.cohortanomaly.model.Detector;

import java.util.List;

public interface DetectorRepository {

    void save(Detector detector);

    /**
     * @return the detector, or null if none is stored under {@code detectorId}
     */
    Detector findById(String detectorId);

    List<Detector> findAll();

    boolean delete(String detectorId);
}
