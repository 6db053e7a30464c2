package edu.purdue.dsnl.urllcsim.stats;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SummaryTablesTest {

    private static RunResult result(String policy, long seed, int devices) {
        var b = RunResult.builder().policy(policy).seed(seed).duration(1.0).avgLatency(0.001).reliability(0.9);
        for (int i = 0; i < devices; i++) {
            b.deviceStats(DeviceStats.builder().deviceId(i).priority(1 + i % 3).throughput(1000 * i).build());
        }
        return b.build();
    }

    @Test
    public void testRunTableHasOneRowPerRun() {
        var table = SummaryTables.runTable(List.of(result("edf", 1, 2), result("edf", 2, 2)));
        assertEquals(2, table.rowCount());
        assertEquals("edf", table.stringColumn("policy").get(0));
        assertEquals(2L, table.longColumn("seed").get(1));
        assertEquals(0.9, table.doubleColumn("reliability").get(0));
    }

    @Test
    public void testDeviceTableFlattensRuns() {
        var table = SummaryTables.deviceTable(List.of(result("round-robin", 1, 3), result("round-robin", 2, 4)));
        assertEquals(7, table.rowCount());
        assertEquals(3, table.intColumn("device_id").get(6));
        assertEquals(2000.0, table.doubleColumn("throughput").get(2));
    }

    @Test
    public void testWriteCsv(@TempDir Path dir) throws Exception {
        var file = dir.resolve("summary.csv").toFile();
        SummaryTables.writeCsv(SummaryTables.runTable(List.of(result("5g-fixed", 42, 1))), file);
        var lines = Files.readAllLines(file.toPath());
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).startsWith("policy,seed,avg_latency"));
        assertTrue(lines.get(1).startsWith("5g-fixed,42,"));
    }
}
