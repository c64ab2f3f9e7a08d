package com.tether.plugin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration blueprint for a worker: executable and arguments, environment, health-check
 * command and cadence, restart policy and device trigger. Immutable; string fields may contain
 * {@code {name}} and {@code ${NAME}} placeholders expanded at start time.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PluginDefinition {

    private final String id;
    private final PluginType type;
    private final String executable;
    private final List<String> arguments;
    private final String workingDirectory;
    private final Map<String, String> environmentVariables;
    private final String healthCheckCommand;
    private final List<String> healthCheckArguments;
    private final Integer healthCheckIntervalSeconds;
    private final Integer healthCheckTimeoutSeconds;
    private final String healthCheckRuntime;
    private final String runtime;
    private final RestartPolicy restartPolicy;
    private final boolean enabled;
    private final TriggerRule triggerOn;
    private final boolean stopOnDisconnect;

    @JsonCreator
    public PluginDefinition(
            @JsonProperty("id") String id,
            @JsonProperty("type") PluginType type,
            @JsonProperty("executable") String executable,
            @JsonProperty("arguments") List<String> arguments,
            @JsonProperty("workingDirectory") String workingDirectory,
            @JsonProperty("environmentVariables") Map<String, String> environmentVariables,
            @JsonProperty("healthCheckCommand") String healthCheckCommand,
            @JsonProperty("healthCheckArguments") List<String> healthCheckArguments,
            @JsonProperty("healthCheckIntervalSeconds") Integer healthCheckIntervalSeconds,
            @JsonProperty("healthCheckTimeoutSeconds") Integer healthCheckTimeoutSeconds,
            @JsonProperty("healthCheckRuntime") String healthCheckRuntime,
            @JsonProperty("runtime") String runtime,
            @JsonProperty("restartPolicy") RestartPolicy restartPolicy,
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("triggerOn") TriggerRule triggerOn,
            @JsonProperty("stopOnDisconnect") Boolean stopOnDisconnect) {
        this.id = id;
        this.type = type != null ? type : PluginType.PROCESS;
        this.executable = executable;
        this.arguments = arguments != null ? List.copyOf(arguments) : List.of();
        this.workingDirectory = workingDirectory;
        this.environmentVariables = environmentVariables != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(environmentVariables))
                : Map.of();
        this.healthCheckCommand = healthCheckCommand;
        this.healthCheckArguments = healthCheckArguments != null ? List.copyOf(healthCheckArguments) : List.of();
        this.healthCheckIntervalSeconds = healthCheckIntervalSeconds;
        this.healthCheckTimeoutSeconds = healthCheckTimeoutSeconds;
        this.healthCheckRuntime = healthCheckRuntime;
        this.runtime = runtime;
        this.restartPolicy = restartPolicy != null ? restartPolicy : RestartPolicy.ON_FAILURE;
        this.enabled = enabled == null || enabled;
        this.triggerOn = triggerOn;
        this.stopOnDisconnect = Boolean.TRUE.equals(stopOnDisconnect);
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("type")
    public PluginType getType() {
        return type;
    }

    /** Program (process type) or script path (script type). */
    @JsonProperty("executable")
    public String getExecutable() {
        return executable;
    }

    @JsonProperty("arguments")
    public List<String> getArguments() {
        return arguments;
    }

    /** Working directory; null = the context's install folder. */
    @JsonProperty("workingDirectory")
    public String getWorkingDirectory() {
        return workingDirectory;
    }

    @JsonProperty("environmentVariables")
    public Map<String, String> getEnvironmentVariables() {
        return environmentVariables;
    }

    @JsonProperty("healthCheckCommand")
    public String getHealthCheckCommand() {
        return healthCheckCommand;
    }

    @JsonProperty("healthCheckArguments")
    public List<String> getHealthCheckArguments() {
        return healthCheckArguments;
    }

    /** Minimum seconds between probes of one instance; null or non-positive = monitor interval. */
    @JsonProperty("healthCheckIntervalSeconds")
    public Integer getHealthCheckIntervalSeconds() {
        return healthCheckIntervalSeconds;
    }

    /** Probe timeout; null = global default. */
    @JsonProperty("healthCheckTimeoutSeconds")
    public Integer getHealthCheckTimeoutSeconds() {
        return healthCheckTimeoutSeconds;
    }

    /** Script workers only: {@code bash} runs the probe through {@code bash -c}. */
    @JsonProperty("healthCheckRuntime")
    public String getHealthCheckRuntime() {
        return healthCheckRuntime;
    }

    /** Script workers only: interpreter hint (bash, sh, python, node, powershell, ...). */
    @JsonProperty("runtime")
    public String getRuntime() {
        return runtime;
    }

    @JsonProperty("restartPolicy")
    public RestartPolicy getRestartPolicy() {
        return restartPolicy;
    }

    @JsonProperty("enabled")
    public boolean isEnabled() {
        return enabled;
    }

    /** Device event that starts this definition; null = none. */
    @JsonProperty("triggerOn")
    public TriggerRule getTriggerOn() {
        return triggerOn;
    }

    /** For {@code device-connected} definitions: stop the device's instance when the device disconnects. */
    @JsonProperty("stopOnDisconnect")
    public boolean isStopOnDisconnect() {
        return stopOnDisconnect;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id).type(type).executable(executable).arguments(arguments)
                .workingDirectory(workingDirectory).environmentVariables(environmentVariables)
                .healthCheckCommand(healthCheckCommand).healthCheckArguments(healthCheckArguments)
                .healthCheckIntervalSeconds(healthCheckIntervalSeconds)
                .healthCheckTimeoutSeconds(healthCheckTimeoutSeconds)
                .healthCheckRuntime(healthCheckRuntime).runtime(runtime)
                .restartPolicy(restartPolicy).enabled(enabled)
                .triggerOn(triggerOn).stopOnDisconnect(stopOnDisconnect);
    }

    public static Builder builder(String id) {
        return new Builder().id(id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PluginDefinition that = (PluginDefinition) o;
        return enabled == that.enabled && stopOnDisconnect == that.stopOnDisconnect
                && Objects.equals(id, that.id) && type == that.type
                && Objects.equals(executable, that.executable)
                && Objects.equals(arguments, that.arguments)
                && Objects.equals(workingDirectory, that.workingDirectory)
                && Objects.equals(environmentVariables, that.environmentVariables)
                && Objects.equals(healthCheckCommand, that.healthCheckCommand)
                && Objects.equals(healthCheckArguments, that.healthCheckArguments)
                && Objects.equals(healthCheckIntervalSeconds, that.healthCheckIntervalSeconds)
                && Objects.equals(healthCheckTimeoutSeconds, that.healthCheckTimeoutSeconds)
                && Objects.equals(healthCheckRuntime, that.healthCheckRuntime)
                && Objects.equals(runtime, that.runtime)
                && restartPolicy == that.restartPolicy && triggerOn == that.triggerOn;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, executable, arguments, workingDirectory, environmentVariables,
                healthCheckCommand, healthCheckArguments, healthCheckIntervalSeconds, healthCheckTimeoutSeconds,
                healthCheckRuntime, runtime, restartPolicy, enabled, triggerOn, stopOnDisconnect);
    }

    @Override
    public String toString() {
        return "PluginDefinition{" + id + ", " + type.toValue() + ", " + executable + "}";
    }

    public static final class Builder {
        private String id;
        private PluginType type = PluginType.PROCESS;
        private String executable;
        private List<String> arguments = new ArrayList<>();
        private String workingDirectory;
        private Map<String, String> environmentVariables = new LinkedHashMap<>();
        private String healthCheckCommand;
        private List<String> healthCheckArguments = new ArrayList<>();
        private Integer healthCheckIntervalSeconds;
        private Integer healthCheckTimeoutSeconds;
        private String healthCheckRuntime;
        private String runtime;
        private RestartPolicy restartPolicy = RestartPolicy.ON_FAILURE;
        private boolean enabled = true;
        private TriggerRule triggerOn;
        private boolean stopOnDisconnect;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(PluginType type) {
            this.type = type;
            return this;
        }

        public Builder executable(String executable) {
            this.executable = executable;
            return this;
        }

        public Builder arguments(List<String> arguments) {
            this.arguments = new ArrayList<>(arguments);
            return this;
        }

        public Builder workingDirectory(String workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder environmentVariables(Map<String, String> environmentVariables) {
            this.environmentVariables = new LinkedHashMap<>(environmentVariables);
            return this;
        }

        public Builder environmentVariable(String name, String value) {
            this.environmentVariables.put(name, value);
            return this;
        }

        public Builder healthCheckCommand(String healthCheckCommand) {
            this.healthCheckCommand = healthCheckCommand;
            return this;
        }

        public Builder healthCheckArguments(List<String> healthCheckArguments) {
            this.healthCheckArguments = new ArrayList<>(healthCheckArguments);
            return this;
        }

        public Builder healthCheckIntervalSeconds(Integer healthCheckIntervalSeconds) {
            this.healthCheckIntervalSeconds = healthCheckIntervalSeconds;
            return this;
        }

        public Builder healthCheckTimeoutSeconds(Integer healthCheckTimeoutSeconds) {
            this.healthCheckTimeoutSeconds = healthCheckTimeoutSeconds;
            return this;
        }

        public Builder healthCheckRuntime(String healthCheckRuntime) {
            this.healthCheckRuntime = healthCheckRuntime;
            return this;
        }

        public Builder runtime(String runtime) {
            this.runtime = runtime;
            return this;
        }

        public Builder restartPolicy(RestartPolicy restartPolicy) {
            this.restartPolicy = restartPolicy;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder triggerOn(TriggerRule triggerOn) {
            this.triggerOn = triggerOn;
            return this;
        }

        public Builder stopOnDisconnect(boolean stopOnDisconnect) {
            this.stopOnDisconnect = stopOnDisconnect;
            return this;
        }

        public PluginDefinition build() {
            return new PluginDefinition(id, type, executable, arguments, workingDirectory, environmentVariables,
                    healthCheckCommand, healthCheckArguments, healthCheckIntervalSeconds, healthCheckTimeoutSeconds,
                    healthCheckRuntime, runtime, restartPolicy, enabled, triggerOn, stopOnDisconnect);
        }
    }
}
