package com.fraud.cohortanomaly.guardrail;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime guardrail state.
 */
@Component
public class InMemoryGuardrailStateStore implements GuardrailStateStore {

    private final Map<GuardrailKey, PersistenceState> states = new ConcurrentHashMap<>();

    @Override
    public PersistenceState get(GuardrailKey key) {
        PersistenceState state = states.get(key);
        return state == null ? null : new PersistenceState(state.getConsecutiveExceedances(), state.getLastAlertAt());
    }

    @Override
    public void put(GuardrailKey key, PersistenceState state) {
        states.put(key, new PersistenceState(state.getConsecutiveExceedances(), state.getLastAlertAt()));
    }

    @Override
    public void remove(GuardrailKey key) {
        states.remove(key);
    }

    @Override
    public Set<GuardrailKey> keys() {
        return Collections.unmodifiableSet(new HashSet<>(states.keySet()));
    }

    @Override
    public void clear() {
        states.clear();
    }
}
