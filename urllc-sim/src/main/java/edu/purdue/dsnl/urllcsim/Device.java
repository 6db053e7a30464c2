package edu.purdue.dsnl.urllcsim;

import edu.purdue.dsnl.urllcsim.log.EventLog;
import edu.purdue.dsnl.urllcsim.log.EventTag;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import lombok.Getter;

/**
 * A traffic source with a Poisson arrival process. Each generated packet races its transmission through the base
 * station against a deadline guard of {@code maxLatency}.
 *
 * <p>Counters are touched only by this device's own generation process and by the completion path of its packets.
 */
public class Device extends Event {
    private static final Logger logger = LogManager.getLogger(Device.class);

    static final double MIN_INTERARRIVAL = 1e-6;

    // Inter-arrival draws are capped at this many mean intervals
    static final double MAX_INTERARRIVAL_MEANS = 10;

    private final SimulationContext ctx;

    private final Simulator simulator;

    private final EventLog log;

    private final BaseStation baseStation;

    @Getter
    private final int id;

    /** Distance to the base station in metres. */
    @Getter
    private final double location;

    @Getter
    private final double arrivalRate;

    @Getter
    private final double packetSize;

    @Getter
    private final int staticPriority;

    @Getter
    private final double maxLatency;

    private final int throughputWindow;

    private double generateUntil;

    @Getter
    private int packetsGenerated = 0;

    @Getter
    private int packetsSent = 0;

    @Getter
    private int packetsDropped = 0;

    @Getter
    private int deadlineMisses = 0;

    @Getter
    private double bitsDelivered = 0;

    @Getter
    private final DoubleArrayList latencies = new DoubleArrayList();

    @Getter
    private final DoubleArrayList throughputSamples = new DoubleArrayList();

    @Getter
    private double aoi = 0.0;

    @Getter
    private double lastUpdateTime = 0.0;

    public Device(SimulationContext ctx, BaseStation baseStation, int id, double location, double arrivalRate,
            double packetSize, int staticPriority, double maxLatency, int throughputWindow) {
        this.ctx = ctx;
        this.simulator = ctx.getSimulator();
        this.log = ctx.getLog();
        this.baseStation = baseStation;
        this.id = id;
        this.location = location;
        this.arrivalRate = arrivalRate;
        this.packetSize = packetSize;
        this.staticPriority = staticPriority;
        this.maxLatency = maxLatency;
        this.throughputWindow = throughputWindow;
    }

    /** Starts packet generation; no packet is created at or after {@code until}. */
    public void start(double until) {
        generateUntil = until;
        if (arrivalRate <= 0) {
            return;
        }
        time = simulator.getTime() + nextInterarrival();
        if (time < generateUntil) {
            simulator.addEvent(this);
        }
    }

    @Override
    public void execute() {
        sendPacket();
        time += nextInterarrival();
        if (time < generateUntil) {
            simulator.addEvent(this);
        }
    }

    double nextInterarrival() {
        double mean = 1 / arrivalRate;
        double draw = ctx.getRandom().nextExponential() * mean;
        return Math.min(Math.max(draw, MIN_INTERARRIVAL), MAX_INTERARRIVAL_MEANS * mean);
    }

    /** Creates a packet now and hands it to the base station. */
    public Packet sendPacket() {
        double now = simulator.getTime();
        var packet = new Packet(ctx.nextPacketId(), id, now, packetSize, staticPriority, maxLatency);
        packetsGenerated++;
        log.emit(log.at(id, packet.getId(), EventTag.GENERATED));
        logger.debug("t={} device {} generated packet {}", now, id, packet.getId());

        var race = new PacketRace(ctx, this, packet);
        race.arm();
        try {
            baseStation.dispatch(this, packet, race);
        } catch (PacketProcessingException e) {
            race.abort(e);
        }
        return packet;
    }

    /**
     * Records the terminal outcome of one packet. A success resets the age of information to the packet's age at
     * delivery; either way the age is then brought up to date.
     */
    public void recordMetrics(Packet packet, double latency, boolean success, double now) {
        if (success) {
            packetsSent++;
            latencies.add(latency);
            bitsDelivered += packet.getOriginalSizeBits();
            lastUpdateTime = packet.getCreationTime();
            aoi = 0.0;
            throughputSamples.add(latency > 0 ? packet.getOriginalSizeBits() / latency : 0.0);
        } else {
            packetsDropped++;
        }
        refreshAoi(now);
    }

    void markDeadlineMiss() {
        deadlineMisses++;
    }

    public void refreshAoi(double now) {
        aoi = Math.max(aoi, now - lastUpdateTime);
    }

    /** Mean of the most recent per-packet throughput samples, 0 before the first delivery. */
    public double averageThroughput() {
        int n = throughputSamples.size();
        if (n == 0) {
            return 0.0;
        }
        int from = Math.max(0, n - throughputWindow);
        double sum = 0;
        for (int i = from; i < n; i++) {
            sum += throughputSamples.getDouble(i);
        }
        return sum / (n - from);
    }
}
