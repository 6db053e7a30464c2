package edu.purdue.dsnl.urllcsim.stats;

import tech.tablesaw.api.DoubleColumn;
import tech.tablesaw.api.IntColumn;
import tech.tablesaw.api.LongColumn;
import tech.tablesaw.api.StringColumn;
import tech.tablesaw.api.Table;

import java.io.File;
import java.io.IOException;
import java.util.List;

/** Tabular views of run results, one row per run or one row per device per run. */
public final class SummaryTables {
    private SummaryTables() {
    }

    public static Table runTable(List<RunResult> results) {
        var policy = StringColumn.create("policy");
        var seed = LongColumn.create("seed");
        var avgLatency = DoubleColumn.create("avg_latency");
        var p99Latency = DoubleColumn.create("p99_latency");
        var throughput = DoubleColumn.create("total_throughput");
        var reliability = DoubleColumn.create("reliability");
        var missRate = DoubleColumn.create("deadline_miss_rate");
        var aoi = DoubleColumn.create("avg_aoi");
        var fairness = DoubleColumn.create("fairness");
        var sent = IntColumn.create("packets_sent");
        var dropped = IntColumn.create("packets_dropped");
        var preemptions = IntColumn.create("preemptions");
        for (var r : results) {
            policy.append(r.getPolicy());
            seed.append(r.getSeed());
            avgLatency.append(r.getAvgLatency());
            p99Latency.append(r.getP99Latency());
            throughput.append(r.getTotalThroughput());
            reliability.append(r.getReliability());
            missRate.append(r.getDeadlineMissRate());
            aoi.append(r.getAvgAoi());
            fairness.append(r.getFairnessIndex());
            sent.append(r.getPacketsSent());
            dropped.append(r.getPacketsDropped());
            preemptions.append(r.getPreemptions());
        }
        return Table.create("runs", policy, seed, avgLatency, p99Latency, throughput, reliability, missRate, aoi,
                fairness, sent, dropped, preemptions);
    }

    public static Table deviceTable(List<RunResult> results) {
        var policy = StringColumn.create("policy");
        var seed = LongColumn.create("seed");
        var deviceId = IntColumn.create("device_id");
        var priority = IntColumn.create("priority");
        var distance = DoubleColumn.create("distance");
        var avgLatency = DoubleColumn.create("avg_latency");
        var p99Latency = DoubleColumn.create("percentile_99");
        var throughput = DoubleColumn.create("throughput");
        var reliability = DoubleColumn.create("reliability");
        var aoi = DoubleColumn.create("aoi");
        var sent = IntColumn.create("packets_sent");
        var dropped = IntColumn.create("packets_dropped");
        for (var r : results) {
            for (var d : r.getPerDeviceStats()) {
                policy.append(r.getPolicy());
                seed.append(r.getSeed());
                deviceId.append(d.getDeviceId());
                priority.append(d.getPriority());
                distance.append(d.getDistance());
                avgLatency.append(d.getAvgLatency());
                p99Latency.append(d.getP99Latency());
                throughput.append(d.getThroughput());
                reliability.append(d.getReliability());
                aoi.append(d.getAoi());
                sent.append(d.getPacketsSent());
                dropped.append(d.getPacketsDropped());
            }
        }
        return Table.create("devices", policy, seed, deviceId, priority, distance, avgLatency, p99Latency,
                throughput, reliability, aoi, sent, dropped);
    }

    public static void writeCsv(Table table, File file) throws IOException {
        table.write().csv(file);
    }
}
