package edu.purdue.dsnl.urllcsim.log;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public enum EventTag {
    GENERATED("generated"),
    REQUEST("request"),
    TRANSMISSION_START("transmission_start"),
    PREEMPTED("preempted"),
    REQUEUED("requeued"),
    FRAGMENT("fragment"),
    TRANSMISSION_END("transmission_end"),
    // A transmission that finished after its packet had already been dropped
    LATE_RELEASE("late_release"),
    DROPPED_DEADLINE("dropped_deadline"),
    DROPPED_SINR("dropped_sinr"),
    ERROR("error"),
    INTERFERENCE("interference"),
    DEVICE_SUMMARY("device_summary"),
    SIMULATION_SUMMARY("simulation_summary");

    @Getter
    private final String tag;

    @Override
    public String toString() {
        return tag;
    }
}
