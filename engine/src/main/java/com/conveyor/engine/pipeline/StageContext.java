package com.conveyor.engine.pipeline;

import com.conveyor.engine.exception.ConfigurationException;
import com.conveyor.engine.model.PipelineState;
import com.conveyor.engine.retry.AbortSignal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Everything one attempt of a stage body may see and touch.
 *
 * Reads are restricted to the keys the stage declared (reads plus its own
 * outputs). Writes are buffered here and restricted to declared outputs.
 */
public final class StageContext {

    private final String        runId;
    private final Stage         stage;
    private final PipelineState state;
    private final AbortSignal   abortSignal;
    private final int           attempt;
    private final Map<String, Object> outputs = new LinkedHashMap<>();

    StageContext(String runId, Stage stage, PipelineState state, AbortSignal abortSignal, int attempt) {
        this.runId       = runId;
        this.stage       = stage;
        this.state       = state;
        this.abortSignal = abortSignal;
        this.attempt     = attempt;
    }

    public String      runId()       { return runId; }
    public String      stageId()     { return stage.id(); }
    public int         attempt()     { return attempt; }
    public AbortSignal abortSignal() { return abortSignal; }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    public Optional<Object> find(String key) {
        checkReadable(key);
        if (outputs.containsKey(key)) {
            return Optional.of(outputs.get(key));
        }
        return state.find(key);
    }

    public String getString(String key) {
        return find(key).map(Object::toString).orElse(null);
    }

    /**
     * A value this stage cannot do without.
     *
     * @throws IllegalStateException if the producing stage did not run
     */
    public String require(String key) {
        return find(key).map(Object::toString).orElseThrow(() -> new IllegalStateException(
                "'" + key + "' has not been produced; stage '" + stage.id() + "' cannot continue"));
    }

    public int getInt(String key, int fallback) {
        Object value = find(key).orElse(null);
        if (value == null) return fallback;
        if (value instanceof Integer i) return i;
        throw new ConfigurationException("State key '" + key + "' is not an integer: " + value);
    }

    public boolean getBoolean(String key) {
        Object value = find(key).orElse(null);
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        throw new ConfigurationException("State key '" + key + "' is not a boolean: " + value);
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    /**
     * Record an output value.
     *
     * @throws ConfigurationException if the stage did not declare the key, or
     *         the value is not a String, Integer or Boolean
     */
    public void put(String key, Object value) {
        if (!stage.declaredOutputs().contains(key)) {
            throw new ConfigurationException("Stage '" + stage.id() + "' wrote undeclared output '" + key + "'");
        }
        PipelineState.checkValueType(key, value);
        outputs.put(key, value);
    }

    Map<String, Object> outputs() {
        return Collections.unmodifiableMap(outputs);
    }

    private void checkReadable(String key) {
        if (!stage.reads().contains(key) && !stage.declaredOutputs().contains(key)) {
            throw new ConfigurationException("Stage '" + stage.id() + "' read '" + key + "' without declaring it");
        }
    }
}
