package edu.purdue.dsnl.urllcsim.config;

import lombok.Builder;
import lombok.Data;

/**
 * A group of identical devices in a heterogeneous population. A {@code null} max latency inherits the run-wide
 * value.
 */
@Data
@Builder(toBuilder = true)
public class DeviceClass {
    private final int count;

    private final double arrivalRate;

    private final double packetSize;

    private final int priority;

    private final Double maxLatency;
}
