package com.conveyor.engine.model;

import com.conveyor.engine.exception.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value state shared by the stages of one run.
 *
 * Three partitions:
 * <ul>
 *   <li>parameters: supplied by the caller, read-only</li>
 *   <li>environment: computed once from the parameters at run start, read-only</li>
 *   <li>outputs: written by stages; each key belongs to exactly one stage and
 *       only that stage may (over)write it, e.g. when it is retried</li>
 * </ul>
 * Values are String, Integer or Boolean. Reading a key that no partition
 * declares is a {@link ConfigurationException}; reading a declared output
 * whose stage has not produced it yields nothing.
 *
 * All access is synchronized: parallel stages evaluate predicates against the
 * same instance while the controller thread applies a finished group's writes.
 */
public final class PipelineState {

    private final Map<String, Object> parameters;
    private final Map<String, Object> environment;
    private final Map<String, String> outputOwners;
    private final Map<String, Object> outputs = new LinkedHashMap<>();

    /**
     * @param outputOwners output key → id of the only stage allowed to write it
     */
    public PipelineState(Map<String, Object> parameters,
                         Map<String, Object> environment,
                         Map<String, String> outputOwners) {
        parameters.forEach(PipelineState::checkValueType);
        environment.forEach(PipelineState::checkValueType);
        this.parameters   = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.environment  = Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        this.outputOwners = Map.copyOf(outputOwners);
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    /**
     * @return the value, or empty if the key is a declared output not yet produced
     * @throws ConfigurationException if no partition declares the key
     */
    public synchronized Optional<Object> find(String key) {
        if (parameters.containsKey(key))  return Optional.of(parameters.get(key));
        if (environment.containsKey(key)) return Optional.of(environment.get(key));
        if (outputOwners.containsKey(key)) return Optional.ofNullable(outputs.get(key));
        throw new ConfigurationException("Undeclared state key '" + key + "'");
    }

    public boolean has(String key) {
        return find(key).isPresent();
    }

    /** String value, or null if not (yet) produced. Integers and booleans are rendered as text. */
    public String getString(String key) {
        return find(key).map(Object::toString).orElse(null);
    }

    /** Integer value, or the fallback if not (yet) produced. */
    public int getInt(String key, int fallback) {
        Object value = find(key).orElse(null);
        if (value == null) return fallback;
        if (value instanceof Integer i) return i;
        throw new ConfigurationException("State key '" + key + "' is not an integer: " + value);
    }

    /** Boolean value; absent counts as false. */
    public boolean getBoolean(String key) {
        Object value = find(key).orElse(null);
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        throw new ConfigurationException("State key '" + key + "' is not a boolean: " + value);
    }

    public Map<String, Object> parameters()  { return parameters; }
    public Map<String, Object> environment() { return environment; }

    /** Copy of every partition merged, parameters first. */
    public synchronized Map<String, Object> snapshot() {
        Map<String, Object> all = new LinkedHashMap<>(parameters);
        all.putAll(environment);
        all.putAll(outputs);
        return all;
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    /** Apply one stage's outputs atomically. */
    public void apply(String stageId, Map<String, Object> produced) {
        applyAll(Map.of(stageId, produced));
    }

    /**
     * Apply the outputs of several stages (one parallel group) in one step, so
     * readers never observe part of a group's writes.
     *
     * @throws ConfigurationException if a stage writes a key it does not own
     */
    public synchronized void applyAll(Map<String, Map<String, Object>> producedByStage) {
        producedByStage.forEach(this::checkWrites);
        producedByStage.values().forEach(outputs::putAll);
    }

    /**
     * Check that a stage may write every key it produced, with a supported value.
     *
     * @throws ConfigurationException naming the first offending key
     */
    public void checkWrites(String stageId, Map<String, Object> produced) {
        produced.forEach((key, value) -> {
            String owner = outputOwners.get(key);
            if (!stageId.equals(owner)) {
                throw new ConfigurationException("Stage '" + stageId + "' may not write '" + key + "'"
                        + (owner == null ? " (undeclared output)" : " (owned by '" + owner + "')"));
            }
            checkValueType(key, value);
        });
    }

    /** @throws ConfigurationException unless the value is a String, Integer or Boolean */
    public static void checkValueType(String key, Object value) {
        if (!(value instanceof String || value instanceof Integer || value instanceof Boolean)) {
            throw new ConfigurationException("State key '" + key + "' must hold a String, Integer or Boolean, got "
                    + (value == null ? "null" : value.getClass().getSimpleName()));
        }
    }
}
