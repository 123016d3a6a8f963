package com.fraud.cohortanomaly.guardrail;

import java.util.Set;

/**
 * Storage for per-key debounce state. Guardrails serializes access per key,
 * so implementations only need to be safe for concurrent access to distinct keys.
 */
public interface GuardrailStateStore {

    /**
     * @return the stored state, or null if the key has never been observed
     */
    PersistenceState get(GuardrailKey key);

    void put(GuardrailKey key, PersistenceState state);

    void remove(GuardrailKey key);

    Set<GuardrailKey> keys();

    void clear();
}
