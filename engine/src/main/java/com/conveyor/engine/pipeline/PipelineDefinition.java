package com.conveyor.engine.pipeline;

import com.conveyor.engine.exception.ConfigurationException;
import com.conveyor.engine.model.Parameter;
import com.conveyor.engine.model.PipelineState;
import com.conveyor.engine.notify.NotificationChannel;
import com.conveyor.engine.notify.ReportTemplate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * An immutable, validated stage graph plus its declared parameters,
 * environment and post-run actions. Create through {@link PipelineDefinitionBuilder}.
 *
 * @param environment  key → function of the parameters (and earlier environment entries),
 *                     evaluated once at run start in declaration order
 * @param groups       execution order; each group is one sequential stage or a parallel fan-out
 * @param outputOwners output key → id of the stage that owns it
 * @param notification null when the pipeline sends no report
 * @param downstream   null when no job is triggered on success
 */
public record PipelineDefinition(
        String                        name,
        List<Parameter>               parameters,
        Map<String, EnvironmentValue> environment,
        List<StageGroup>              groups,
        Map<String, String>           outputOwners,
        Notification                  notification,
        Downstream                    downstream
) {
    public PipelineDefinition {
        parameters   = List.copyOf(parameters);
        environment  = Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        groups       = List.copyOf(groups);
        outputOwners = Map.copyOf(outputOwners);
    }

    /** Computes one environment entry from the values resolved so far. */
    @FunctionalInterface
    public interface EnvironmentValue {
        Object compute(Map<String, Object> resolved);
    }

    /** Where the run report goes and how it is rendered. */
    public record Notification(Function<PipelineState, NotificationChannel> channel, ReportTemplate template) {}

    /** Job triggered after a successful run, with parameters derived from the final state. */
    public record Downstream(String jobName, Function<PipelineState, Map<String, String>> parameters) {}

    public List<Stage> stages() {
        return groups.stream().flatMap(g -> g.stages().stream()).toList();
    }

    public Optional<Parameter> parameter(String name) {
        return parameters.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /**
     * Validate and convert caller-supplied values.
     *
     * @throws ConfigurationException for an unknown parameter, a missing required
     *                                one, or a value that does not fit its type
     */
    public Map<String, Object> resolveParameters(Map<String, String> raw) {
        for (String supplied : raw.keySet()) {
            if (parameter(supplied).isEmpty()) {
                throw new ConfigurationException("Unknown parameter '" + supplied + "' for pipeline '" + name + "'");
            }
        }
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Parameter p : parameters) {
            resolved.put(p.name(), p.resolve(raw.get(p.name())));
        }
        return resolved;
    }

    /**
     * Compute the environment partition. Each entry sees the parameters and
     * the entries declared before it.
     */
    public Map<String, Object> resolveEnvironment(Map<String, Object> parameters) {
        Map<String, Object> visible = new LinkedHashMap<>(parameters);
        Map<String, Object> env = new LinkedHashMap<>();
        environment.forEach((key, value) -> {
            Object computed;
            try {
                computed = value.compute(Collections.unmodifiableMap(visible));
            } catch (ConfigurationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ConfigurationException("Environment value '" + key + "' could not be computed: "
                        + e.getMessage(), e);
            }
            if (computed == null) {
                throw new ConfigurationException("Environment value '" + key + "' computed to null");
            }
            env.put(key, computed);
            visible.put(key, computed);
        });
        return env;
    }
}
