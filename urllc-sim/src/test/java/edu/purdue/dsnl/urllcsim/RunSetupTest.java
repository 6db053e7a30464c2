package edu.purdue.dsnl.urllcsim;

import edu.purdue.dsnl.urllcsim.policy.PolicyType;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RunSetupTest {

    private static RunSetup parse(String... args) {
        var cmd = new CommandLine(new Main());
        var parsed = cmd.parseArgs(args);
        return (RunSetup) parsed.subcommand().commandSpec().userObject();
    }

    @Test
    public void testOptionsOverrideDefaults() {
        var config = parse("run", "-p", "edf", "-d", "0.5", "-s", "3,4").resolveConfig();
        assertEquals(PolicyType.EDF, config.getSchedulingPolicy());
        assertEquals(0.5, config.getSimDuration());
        assertEquals(List.of(3L, 4L), config.effectiveSeeds());
        assertEquals(10, config.getNumDevices());
    }

    @Test
    public void testOptionsOverrideConfigFile() throws Exception {
        var file = new File(getClass().getResource("/config/mixed-priority.json").toURI());
        var config = parse("run", "-c", file.getPath(), "-s", "9").resolveConfig();
        assertEquals(PolicyType.FIVEG_FIXED_PRIORITY, config.getSchedulingPolicy());
        assertEquals(2.0, config.getSimDuration());
        assertEquals(List.of(9L), config.effectiveSeeds());
        assertEquals(5, config.totalDevices());
    }

    @Test
    public void testRunWritesLogsAndSummaries(@TempDir Path dir) throws Exception {
        int code = new CommandLine(new Main()).execute("run", "-d", "0.2", "-s", "1,2", "-p", "round-robin", "-l",
                dir.toString());
        assertEquals(0, code);
        for (var name : List.of("sim_urllc_log_seed_1.csv", "sim_urllc_log_seed_2.csv", "sim_urllc_summary.csv",
                "sim_urllc_devices.csv")) {
            assertTrue(Files.exists(dir.resolve(name)), name);
        }
        var summary = Files.readAllLines(dir.resolve("sim_urllc_summary.csv"));
        assertEquals(3, summary.size());
        var log = Files.readAllLines(dir.resolve("sim_urllc_log_seed_1.csv"));
        assertTrue(log.get(0).startsWith("time,device_id,packet_id,event"));
        assertTrue(log.get(log.size() - 1).contains("simulation_summary"));
    }

    @Test
    public void testUnknownPolicyFails() {
        assertNotEquals(0, new CommandLine(new Main()).execute("run", "-p", "lottery", "-d", "0.1"));
    }

    @Test
    public void testPoliciesCommand() {
        assertEquals(0, new CommandLine(new Main()).execute("policies"));
    }

    @Test
    public void testUnusableLogDirectoryFailsBeforeRunning(@TempDir Path dir) throws Exception {
        var file = Files.writeString(dir.resolve("not-a-dir"), "x");
        int code = new CommandLine(new Main()).execute("run", "-d", "0.1", "-l", file.toString());
        assertEquals(1, code);
        assertEquals("x", Files.readString(file));
        assertFalse(Files.exists(dir.resolve("sim_urllc_summary.csv")));
    }
}
