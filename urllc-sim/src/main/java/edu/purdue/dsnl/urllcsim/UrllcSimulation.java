package edu.purdue.dsnl.urllcsim;

import edu.purdue.dsnl.urllcsim.config.DeviceClass;
import edu.purdue.dsnl.urllcsim.config.SimulationConfig;
import edu.purdue.dsnl.urllcsim.log.EventLog;
import edu.purdue.dsnl.urllcsim.log.EventSink;
import edu.purdue.dsnl.urllcsim.log.EventTag;
import edu.purdue.dsnl.urllcsim.stats.ResultAggregator;
import edu.purdue.dsnl.urllcsim.stats.RunResult;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SplittableRandom;

/**
 * One simulation run for a {@code (config, seed)} pair. Results are reproducible bit for bit for the same pair.
 *
 * <p>Construction builds the base station, channel, interference process and device population and consumes random
 * draws for device placement and priorities, in device order. {@link #run()} then advances the clock to the
 * configured duration, when generation stops, and keeps running for the largest device {@code max_latency} so that
 * every generated packet ends up either sent or dropped.
 */
public class UrllcSimulation {
    private static final Logger logger = LogManager.getLogger(UrllcSimulation.class);

    @Getter
    private final SimulationConfig config;

    @Getter
    private final long seed;

    @Getter
    private final Simulator simulator = new Simulator();

    @Getter
    private final SimulationContext context;

    @Getter
    private final ChannelModel channel;

    @Getter
    private final BaseStation baseStation;

    @Getter
    private final InterferenceProcess interference;

    @Getter
    private final List<Device> devices;

    private final EventLog log;

    private boolean started = false;

    public UrllcSimulation(SimulationConfig config, long seed, EventSink sink) {
        this.config = config.validate();
        this.seed = seed;
        var policy = config.getSchedulingPolicy().create(config);
        var random = new SplittableRandom(seed);
        this.log = new EventLog(sink, simulator);
        this.context = new SimulationContext(simulator, log, random);
        this.channel = new ChannelModel(config, simulator);
        this.baseStation = new BaseStation(context, channel, policy, config.getNumResourceBlocks(),
                config.getSubcarriers(), config.getSlotDuration(), config.getPreemptionPenalty());
        this.interference = new InterferenceProcess(simulator, baseStation, channel, random,
                config.getInterferenceRate(), config.getInterferenceMin(), config.getInterferenceMax(),
                config.getInterferenceBaseline(), config.getInterferenceBurstDuration());
        this.devices = Collections.unmodifiableList(createDevices());
    }

    public static RunResult run(SimulationConfig config, long seed) {
        return run(config, seed, EventSink.NONE);
    }

    public static RunResult run(SimulationConfig config, long seed, EventSink sink) {
        return new UrllcSimulation(config, seed, sink).run();
    }

    public RunResult run() {
        if (started) {
            throw new IllegalStateException("A simulation instance runs once");
        }
        started = true;
        double duration = config.getSimDuration();
        logger.info("Starting run: policy={} seed={} devices={} blocks={} duration={}s",
                config.getSchedulingPolicy().getConfigName(), seed, devices.size(),
                config.getNumResourceBlocks(), duration);

        log.open();
        try {
            interference.start();
            for (var d : devices) {
                d.start(duration);
            }
            simulator.runUntil(duration);
            // Generation has stopped; every open packet is decided by its deadline guard.
            simulator.runUntil(duration + maxDeviceLatency());
            int undecided = undecidedPackets();
            if (undecided > 0) {
                throw new SimulationException(undecided + " packets still open after the drain window");
            }

            for (var d : devices) {
                d.refreshAoi(duration);
            }
            var result = ResultAggregator.aggregate(config.getSchedulingPolicy().getConfigName(), seed, duration,
                    devices, baseStation);
            emitSummaries(result);
            logger.info("Finished run: seed={} sent={} dropped={} avgLatency={} reliability={} fairness={}", seed,
                    result.getPacketsSent(), result.getPacketsDropped(), result.getAvgLatency(),
                    result.getReliability(), result.getFairnessIndex());
            return result;
        } finally {
            log.close();
        }
    }

    private double maxDeviceLatency() {
        return devices.stream().mapToDouble(Device::getMaxLatency).max().orElse(0);
    }

    private int undecidedPackets() {
        return devices.stream()
                .mapToInt(d -> d.getPacketsGenerated() - d.getPacketsSent() - d.getPacketsDropped())
                .sum();
    }

    private List<Device> createDevices() {
        var random = context.getRandom();
        var list = new ArrayList<Device>();
        if (config.isHeterogeneous()) {
            for (DeviceClass dc : config.getDeviceConfigs()) {
                double maxLatency = dc.getMaxLatency() != null ? dc.getMaxLatency() : config.getMaxLatency();
                for (int i = 0; i < dc.getCount(); i++) {
                    list.add(new Device(context, baseStation, list.size(), randomDistance(),
                            dc.getArrivalRate(), dc.getPacketSize(), dc.getPriority(), maxLatency,
                            config.getPfWindow()));
                }
            }
        } else {
            var levels = config.effectivePriorityLevels();
            for (int i = 0; i < config.getNumDevices(); i++) {
                double distance = randomDistance();
                int priority = levels.get(random.nextInt(levels.size()));
                list.add(new Device(context, baseStation, i, distance, config.getArrivalRate(),
                        config.getPacketSize(), priority, config.getMaxLatency(), config.getPfWindow()));
            }
        }
        return list;
    }

    private double randomDistance() {
        double lo = config.getDeviceDistanceMin();
        double hi = config.getDeviceDistanceMax();
        return lo == hi ? lo : context.getRandom().nextDouble(lo, hi);
    }

    private void emitSummaries(RunResult result) {
        for (var d : result.getPerDeviceStats()) {
            log.emit(log.at(d.getDeviceId(), -1, EventTag.DEVICE_SUMMARY)
                    .setLatency(d.getAvgLatency())
                    .setPercentileLatency(d.getP99Latency())
                    .setThroughput(d.getThroughput())
                    .setReliability(d.getReliability())
                    .setAoi(d.getAoi()));
        }
        log.emit(log.at(-1, -1, EventTag.SIMULATION_SUMMARY)
                .setLatency(result.getAvgLatency())
                .setPercentileLatency(result.getP99Latency())
                .setThroughput(result.getTotalThroughput())
                .setReliability(result.getReliability())
                .setAoi(result.getAvgAoi())
                .setFairness(result.getFairnessIndex()));
    }
}
