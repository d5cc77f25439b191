package com.conveyor.engine.pipeline;

import com.conveyor.engine.exception.ConfigurationException;
import com.conveyor.engine.model.Parameter;
import com.conveyor.engine.model.PipelineState;
import com.conveyor.engine.notify.NotificationChannel;
import com.conveyor.engine.notify.ReportTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Declares a pipeline once and checks it before anything can run.
 *
 * {@link #build()} rejects, with a {@link ConfigurationException}:
 * <ul>
 *   <li>duplicate parameter, environment or stage names</li>
 *   <li>an output key owned by two stages, or shadowing a parameter/environment key</li>
 *   <li>a stage reading a key that is not a parameter, an environment entry,
 *       its own output, or the output of a stage in an earlier group</li>
 *   <li>members of one parallel group that are not declared consecutively</li>
 * </ul>
 */
public final class PipelineDefinitionBuilder {

    private final String name;
    private final List<Parameter> parameters = new ArrayList<>();
    private final Map<String, PipelineDefinition.EnvironmentValue> environment = new LinkedHashMap<>();
    private final List<Stage> stages = new ArrayList<>();
    private PipelineDefinition.Notification notification;
    private PipelineDefinition.Downstream downstream;

    private PipelineDefinitionBuilder(String name) {
        this.name = name;
    }

    public static PipelineDefinitionBuilder pipeline(String name) {
        return new PipelineDefinitionBuilder(name);
    }

    public PipelineDefinitionBuilder parameter(Parameter parameter) {
        parameters.add(parameter);
        return this;
    }

    public PipelineDefinitionBuilder environment(String key, PipelineDefinition.EnvironmentValue value) {
        if (environment.putIfAbsent(key, value) != null) {
            throw new ConfigurationException("Duplicate environment key '" + key + "'");
        }
        return this;
    }

    public PipelineDefinitionBuilder stage(Stage stage) {
        stages.add(stage);
        return this;
    }

    public PipelineDefinitionBuilder notifyWith(Function<PipelineState, NotificationChannel> channel,
                                                ReportTemplate template) {
        this.notification = new PipelineDefinition.Notification(channel, template);
        return this;
    }

    public PipelineDefinitionBuilder triggerOnSuccess(String jobName,
                                                      Function<PipelineState, Map<String, String>> parameters) {
        this.downstream = new PipelineDefinition.Downstream(jobName, parameters);
        return this;
    }

    public PipelineDefinition build() {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Pipeline name must not be blank");
        }

        Set<String> inputs = new HashSet<>();
        for (Parameter p : parameters) {
            if (!inputs.add(p.name())) {
                throw new ConfigurationException("Duplicate parameter '" + p.name() + "'");
            }
        }
        for (String key : environment.keySet()) {
            if (!inputs.add(key)) {
                throw new ConfigurationException("Environment key '" + key + "' shadows a parameter");
            }
        }

        Map<String, String> owners = collectOwners(inputs);
        List<StageGroup> groups = group();
        checkReads(groups, inputs, owners);

        return new PipelineDefinition(name, parameters, environment, groups, owners, notification, downstream);
    }

    // ------------------------------------------------------------------
    // Validation steps
    // ------------------------------------------------------------------

    private Map<String, String> collectOwners(Set<String> inputs) {
        Set<String> ids = new HashSet<>();
        Map<String, String> owners = new HashMap<>();
        for (Stage stage : stages) {
            if (!ids.add(stage.id())) {
                throw new ConfigurationException("Duplicate stage id '" + stage.id() + "'");
            }
            for (String key : stage.declaredOutputs()) {
                if (inputs.contains(key)) {
                    throw new ConfigurationException("Output '" + key + "' of stage '" + stage.id()
                            + "' shadows a parameter or environment key");
                }
                String previous = owners.putIfAbsent(key, stage.id());
                if (previous != null) {
                    throw new ConfigurationException("Output '" + key + "' declared by both '"
                            + previous + "' and '" + stage.id() + "'");
                }
            }
        }
        return owners;
    }

    private List<StageGroup> group() {
        List<StageGroup> groups = new ArrayList<>();
        Set<String> closedGroups = new HashSet<>();
        String openGroup = null;
        List<Stage> members = new ArrayList<>();

        for (Stage stage : stages) {
            String groupId = stage.parallelGroup();
            if (groupId != null && groupId.equals(openGroup)) {
                members.add(stage);
                continue;
            }
            if (openGroup != null) {
                groups.add(new StageGroup(openGroup, members));
                closedGroups.add(openGroup);
                members = new ArrayList<>();
                openGroup = null;
            }
            if (groupId == null) {
                groups.add(new StageGroup(null, List.of(stage)));
            } else if (closedGroups.contains(groupId)) {
                throw new ConfigurationException("Parallel group '" + groupId
                        + "' is not declared consecutively (stage '" + stage.id() + "')");
            } else {
                openGroup = groupId;
                members.add(stage);
            }
        }
        if (openGroup != null) {
            groups.add(new StageGroup(openGroup, members));
        }
        return groups;
    }

    private static void checkReads(List<StageGroup> groups, Set<String> inputs, Map<String, String> owners) {
        Set<String> available = new HashSet<>(inputs);
        for (StageGroup group : groups) {
            for (Stage stage : group.stages()) {
                for (String key : stage.reads()) {
                    if (available.contains(key) || stage.declaredOutputs().contains(key)) {
                        continue;
                    }
                    String owner = owners.get(key);
                    if (owner == null) {
                        throw new ConfigurationException("Stage '" + stage.id() + "' reads undeclared key '" + key + "'");
                    }
                    throw new ConfigurationException("Stage '" + stage.id() + "' reads '" + key
                            + "' before its producer '" + owner + "' has completed");
                }
            }
            group.stages().forEach(s -> available.addAll(s.declaredOutputs()));
        }
    }
}
