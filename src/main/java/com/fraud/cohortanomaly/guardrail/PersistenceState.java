package com.fraud.cohortanomaly.guardrail;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Debounce state of one guardrail key. Only mutated while the key's lock is held.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PersistenceState {

    // Consecutive observations above threshold
    private int consecutiveExceedances;

    // Epoch millis of the last confirmation; 0 if never confirmed
    private long lastAlertAt;
}
