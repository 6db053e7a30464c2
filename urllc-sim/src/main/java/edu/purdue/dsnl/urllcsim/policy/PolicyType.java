package edu.purdue.dsnl.urllcsim.policy;

import edu.purdue.dsnl.urllcsim.config.ConfigException;
import edu.purdue.dsnl.urllcsim.config.SimulationConfig;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum PolicyType {
    PREEMPTIVE_PRIORITY("preemptive", cfg -> new PreemptivePriorityPolicy()),
    NON_PREEMPTIVE_PRIORITY("non-preemptive", cfg -> new NonPreemptivePriorityPolicy()),
    ROUND_ROBIN("round-robin", cfg -> new RoundRobinPolicy(cfg.getRrQuantum())),
    EDF("edf", cfg -> new EdfPolicy()),
    PROPORTIONAL_FAIR("proportional-fair", cfg -> new ProportionalFairPolicy()),
    HYBRID_EDF_PREEMPTIVE("hybrid-edf-preemptive", cfg -> new HybridEdfPreemptivePolicy(cfg.getUrgencyThreshold()),
            "hybrid-edf"),
    FIVEG_FIXED_PRIORITY("5g-fixed", cfg -> new FixedPriorityQciPolicy(), "fiveg-fixed");

    @Getter
    private final String configName;

    private final List<String> aliases;

    private final Function<SimulationConfig, SchedulingPolicy> factory;

    PolicyType(String configName, Function<SimulationConfig, SchedulingPolicy> factory, String... aliases) {
        this.configName = configName;
        this.factory = factory;
        this.aliases = List.of(aliases);
    }

    public SchedulingPolicy create(SimulationConfig config) {
        return factory.apply(config);
    }

    /** Resolves a configuration name such as {@code "edf"} or {@code "5g-fixed"}; case-insensitive. */
    public static PolicyType fromName(String name) {
        if (name != null) {
            var n = name.trim().toLowerCase();
            for (var t : values()) {
                if (t.configName.equals(n) || t.aliases.contains(n) || t.name().equalsIgnoreCase(n)) {
                    return t;
                }
            }
        }
        throw new ConfigException(String.format("Unknown scheduling policy '%s', expected one of %s", name,
                Arrays.stream(values()).map(PolicyType::getConfigName).collect(Collectors.joining(", "))));
    }
}
