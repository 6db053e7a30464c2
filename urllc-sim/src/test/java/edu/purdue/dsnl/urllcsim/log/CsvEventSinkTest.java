package edu.purdue.dsnl.urllcsim.log;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CsvEventSinkTest {
    private static final String HEADER = "time,device_id,packet_id,event,latency,percentile_latency,throughput,"
            + "reliability,aoi,sinr,fairness,data_rate,bits";

    @Test
    public void testWritesHeaderAndRows(@TempDir Path dir) throws Exception {
        var file = dir.resolve("events.csv").toFile();
        var sink = new CsvEventSink(file);
        sink.open();
        assertTrue(sink.record(new EventRecord(0.5, 1, 7, EventTag.TRANSMISSION_END).setLatency(0.001)).isOk());
        assertTrue(sink.record(new EventRecord(0.75, -1, -1, EventTag.SIMULATION_SUMMARY).setFairness(0.5)).isOk());

        // rows are flushed as they are written
        var beforeClose = Files.readAllLines(file.toPath());
        assertEquals(3, beforeClose.size());
        sink.close();

        var lines = Files.readAllLines(file.toPath());
        assertEquals(HEADER, lines.get(0));
        var row = lines.get(1).split(",", -1);
        assertEquals(13, row.length);
        assertEquals("0.5", row[0]);
        assertEquals("1", row[1]);
        assertEquals("7", row[2]);
        assertEquals("transmission_end", row[3]);
        assertEquals("0.001", row[4]);
        assertEquals("", row[5]);
        assertTrue(lines.get(2).startsWith("0.75,-1,-1,simulation_summary,"));
    }

    @Test
    public void testRecordBeforeOpenFails(@TempDir Path dir) throws Exception {
        var sink = new CsvEventSink(dir.resolve("events.csv").toFile());
        var result = sink.record(new EventRecord(0, 0, 0, EventTag.GENERATED));
        assertFalse(result.isOk());
        assertTrue(result.getFailure().isPresent());
        sink.close();
    }
}
