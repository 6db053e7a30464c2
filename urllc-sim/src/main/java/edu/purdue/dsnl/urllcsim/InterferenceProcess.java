package edu.purdue.dsnl.urllcsim;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.random.RandomGenerator;

/**
 * Background interference. Quiet for an exponentially distributed interval, then raises the interference level to
 * a uniform draw from {@code [min, max]} for a fixed burst duration, then drops back to the baseline.
 *
 * <p>Each change refreshes the SINR recorded on occupied blocks. Transmissions already under way keep the
 * duration they were scheduled with.
 */
public class InterferenceProcess extends Event {
    private static final Logger logger = LogManager.getLogger(InterferenceProcess.class);

    private final Simulator simulator;

    private final BaseStation baseStation;

    private final ChannelModel channel;

    private final RandomGenerator random;

    private final double rate;

    private final double minDbm;

    private final double maxDbm;

    private final double baselineDbm;

    private final double burstDuration;

    private boolean inBurst = false;

    private int bursts = 0;

    public InterferenceProcess(Simulator simulator, BaseStation baseStation, ChannelModel channel,
            RandomGenerator random, double rate, double minDbm, double maxDbm, double baselineDbm,
            double burstDuration) {
        this.simulator = simulator;
        this.baseStation = baseStation;
        this.channel = channel;
        this.random = random;
        this.rate = rate;
        this.minDbm = minDbm;
        this.maxDbm = maxDbm;
        this.baselineDbm = baselineDbm;
        this.burstDuration = burstDuration;
    }

    /** Schedules the first burst. Does nothing when the rate is zero. */
    public void start() {
        if (rate > 0) {
            simulator.scheduleAfter(this, random.nextExponential() / rate);
        }
    }

    public int getBursts() {
        return bursts;
    }

    public boolean isInBurst() {
        return inBurst;
    }

    @Override
    public void execute() {
        if (!inBurst) {
            inBurst = true;
            bursts++;
            channel.setInterferenceLevelDbm(minDbm == maxDbm ? minDbm : random.nextDouble(minDbm, maxDbm));
            logger.debug("t={} interference burst at {} dBm", time, channel.getInterferenceLevelDbm());
            time += burstDuration;
        } else {
            inBurst = false;
            channel.setInterferenceLevelDbm(baselineDbm);
            time += random.nextExponential() / rate;
        }
        baseStation.refreshSinr();
        simulator.addEvent(this);
    }
}
