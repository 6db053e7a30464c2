package edu.purdue.dsnl.urllcsim.stats;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DeviceStats {
    private final int deviceId;

    private final int priority;

    private final double distance;

    private final double arrivalRate;

    private final double maxLatency;

    private final int packetsGenerated;

    private final int packetsSent;

    private final int packetsDropped;

    private final int deadlineMisses;

    private final double avgLatency;

    private final double p99Latency;

    /** Delivered bits per second of simulated time. */
    private final double throughput;

    /** Sent over terminated packets. */
    private final double reliability;

    private final double deadlineMissRate;

    private final double aoi;
}
