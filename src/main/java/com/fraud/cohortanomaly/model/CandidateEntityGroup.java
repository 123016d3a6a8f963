package com.fraud.cohortanomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Entities of one type (accounts, devices, emails...) active in the anomaly window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateEntityGroup {

    private String entityType;

    @Builder.Default
    private List<EntityActivity> entities = new ArrayList<>();

    public long totalActivity() {
        long total = 0;
        for (EntityActivity e : entities) {
            total += e.getActivityCount();
        }
        return total;
    }
}
