package edu.purdue.dsnl.urllcsim;

import edu.purdue.dsnl.urllcsim.config.ConfigLoader;
import edu.purdue.dsnl.urllcsim.config.SimulationConfig;
import edu.purdue.dsnl.urllcsim.log.CsvEventSink;
import edu.purdue.dsnl.urllcsim.log.EventSink;
import edu.purdue.dsnl.urllcsim.policy.PolicyType;
import edu.purdue.dsnl.urllcsim.stats.RunResult;
import edu.purdue.dsnl.urllcsim.stats.SummaryTables;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import picocli.CommandLine;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/** Runs one configuration once per seed and reports a summary row per run. */
@CommandLine.Command(name = "run")
public class RunSetup extends Main.ParentOptions implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(RunSetup.class);

    @Override
    public Integer call() throws Exception {
        SimulationConfig config = resolveConfig();
        if (logDir != null && !logDir.isDirectory() && !logDir.mkdirs()) {
            logger.error("Cannot create log directory {}", logDir);
            return 1;
        }

        List<RunResult> results = new ArrayList<>();
        for (long seed : config.effectiveSeeds()) {
            EventSink sink = logDir == null ? EventSink.NONE
                    : new CsvEventSink(new File(logDir, String.format("sim_urllc_log_seed_%d.csv", seed)));
            try {
                results.add(UrllcSimulation.run(config, seed, sink));
            } catch (SimulationException e) {
                logger.error("Run with seed {} failed", seed, e);
                return 1;
            }
        }

        var runs = SummaryTables.runTable(results);
        System.out.println(runs.print());
        if (logDir != null) {
            SummaryTables.writeCsv(runs, new File(logDir, "sim_urllc_summary.csv"));
            SummaryTables.writeCsv(SummaryTables.deviceTable(results), new File(logDir, "sim_urllc_devices.csv"));
        }
        return 0;
    }

    SimulationConfig resolveConfig() {
        var config = configFile.map(ConfigLoader::load).orElseGet(SimulationConfig::defaults);
        var b = config.toBuilder();
        policy.ifPresent(p -> b.schedulingPolicy(PolicyType.fromName(p)));
        duration.ifPresent(b::simDuration);
        if (seeds != null && !seeds.isEmpty()) {
            b.clearRandomSeeds().randomSeeds(seeds);
        }
        return b.build().validate();
    }
}
