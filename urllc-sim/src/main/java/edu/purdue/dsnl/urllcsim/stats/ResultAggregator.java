package edu.purdue.dsnl.urllcsim.stats;

import edu.purdue.dsnl.urllcsim.BaseStation;
import edu.purdue.dsnl.urllcsim.Device;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

import java.util.List;

/** Folds device counters into a {@link RunResult}. */
public final class ResultAggregator {
    public static final double PERCENTILE = 99;

    private ResultAggregator() {
    }

    public static DeviceStats deviceStats(Device d, double duration) {
        int terminated = d.getPacketsSent() + d.getPacketsDropped();
        return DeviceStats.builder()
                .deviceId(d.getId())
                .priority(d.getStaticPriority())
                .distance(d.getLocation())
                .arrivalRate(d.getArrivalRate())
                .maxLatency(d.getMaxLatency())
                .packetsGenerated(d.getPacketsGenerated())
                .packetsSent(d.getPacketsSent())
                .packetsDropped(d.getPacketsDropped())
                .deadlineMisses(d.getDeadlineMisses())
                .avgLatency(Stats.mean(d.getLatencies()))
                .p99Latency(Stats.percentile(d.getLatencies(), PERCENTILE))
                .throughput(Stats.ratio(d.getBitsDelivered(), duration))
                .reliability(Stats.ratio(d.getPacketsSent(), terminated))
                .deadlineMissRate(Stats.ratio(d.getDeadlineMisses(), terminated))
                .aoi(d.getAoi())
                .build();
    }

    public static RunResult aggregate(String policy, long seed, double duration, List<Device> devices,
            BaseStation baseStation) {
        var builder = RunResult.builder()
                .policy(policy)
                .seed(seed)
                .duration(duration)
                .preemptions(baseStation.getPreemptions())
                .fragments(baseStation.getFragments());

        var pooled = new DoubleArrayList();
        var throughputs = new double[devices.size()];
        double aoiSum = 0;
        int generated = 0;
        int sent = 0;
        int dropped = 0;
        int misses = 0;
        for (int i = 0; i < devices.size(); i++) {
            var d = devices.get(i);
            var stats = deviceStats(d, duration);
            builder.deviceStats(stats);
            pooled.addAll(d.getLatencies());
            throughputs[i] = stats.getThroughput();
            aoiSum += stats.getAoi();
            generated += d.getPacketsGenerated();
            sent += d.getPacketsSent();
            dropped += d.getPacketsDropped();
            misses += d.getDeadlineMisses();
        }

        double total = 0;
        for (double t : throughputs) {
            total += t;
        }
        return builder
                .avgLatency(Stats.mean(pooled))
                .p99Latency(Stats.percentile(pooled, PERCENTILE))
                .totalThroughput(total)
                .reliability(Stats.ratio(sent, sent + dropped))
                .deadlineMissRate(Stats.ratio(misses, sent + dropped))
                .avgAoi(Stats.ratio(aoiSum, devices.size()))
                .fairnessIndex(Stats.jainIndex(throughputs))
                .packetsGenerated(generated)
                .packetsSent(sent)
                .packetsDropped(dropped)
                .build();
    }
}
