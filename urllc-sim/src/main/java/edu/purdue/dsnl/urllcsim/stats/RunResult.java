package edu.purdue.dsnl.urllcsim.stats;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * Outcome of one {@code (config, seed)} run. Latency figures pool every delivered packet across devices; AoI is the
 * mean of per-device final ages; fairness is Jain's index over per-device throughput.
 */
@Data
@Builder
public class RunResult {
    private final String policy;

    private final long seed;

    private final double duration;

    private final double avgLatency;

    private final double p99Latency;

    private final double totalThroughput;

    private final double reliability;

    private final double deadlineMissRate;

    private final double avgAoi;

    private final double fairnessIndex;

    private final int packetsGenerated;

    private final int packetsSent;

    private final int packetsDropped;

    private final int preemptions;

    private final int fragments;

    @Singular("deviceStats")
    private final List<DeviceStats> perDeviceStats;
}
