package edu.purdue.dsnl.urllcsim;

import edu.purdue.dsnl.urllcsim.log.EventLog;

import lombok.Getter;

import java.util.random.RandomGenerator;

/** Per-run collaborators shared by every entity: the clock, the event stream and the seeded random source. */
@Getter
public class SimulationContext {
    private final Simulator simulator;

    private final EventLog log;

    private final RandomGenerator random;

    private long packetIdCounter = 0;

    public SimulationContext(Simulator simulator, EventLog log, RandomGenerator random) {
        this.simulator = simulator;
        this.log = log;
        this.random = random;
    }

    public long nextPacketId() {
        return packetIdCounter++;
    }
}
