package edu.purdue.dsnl.urllcsim;

import edu.purdue.dsnl.urllcsim.log.EventLog;
import edu.purdue.dsnl.urllcsim.log.EventTag;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * First-of-two select between a packet's transmission and its deadline guard. Whichever side finishes first
 * classifies the packet, exactly once; the other side becomes a no-op.
 *
 * <p>Ties go to the transmission. When the guard fires at the same instant the final fragment is due to complete,
 * it re-schedules itself behind the completion and only drops the packet if the race is still open when it runs
 * again.
 */
public class PacketRace {
    private static final Logger logger = LogManager.getLogger(PacketRace.class);

    public enum Outcome {
        PENDING,
        SENT,
        DROPPED
    }

    private final Simulator simulator;

    private final EventLog log;

    @Getter
    private final Device device;

    @Getter
    private final Packet packet;

    private final DeadlineGuard guard = new DeadlineGuard();

    @Getter
    private Outcome outcome = Outcome.PENDING;

    /** Fragment currently holding a block, or null while queued. */
    @Getter
    @Setter(AccessLevel.PACKAGE)
    private TransmissionHandle inFlight;

    public PacketRace(SimulationContext ctx, Device device, Packet packet) {
        this.simulator = ctx.getSimulator();
        this.log = ctx.getLog();
        this.device = device;
        this.packet = packet;
    }

    public boolean isDecided() {
        return outcome != Outcome.PENDING;
    }

    void arm() {
        simulator.schedule(guard, Math.max(packet.getDeadline(), simulator.getTime()));
    }

    /**
     * Transmission side. Classifies the packet as sent or, when {@code success} is false, dropped, unless the
     * deadline already won. Returns whether this call decided the race.
     */
    boolean complete(double latency, boolean success) {
        if (isDecided()) {
            return false;
        }
        simulator.removeEvent(guard);
        outcome = success ? Outcome.SENT : Outcome.DROPPED;
        device.recordMetrics(packet, latency, success, simulator.getTime());
        return true;
    }

    /** Drops the packet after a processing error. */
    boolean abort(PacketProcessingException e) {
        if (isDecided()) {
            return false;
        }
        simulator.removeEvent(guard);
        outcome = Outcome.DROPPED;
        double now = simulator.getTime();
        device.recordMetrics(packet, now - packet.getCreationTime(), false, now);
        log.emit(log.at(device.getId(), packet.getId(), EventTag.ERROR));
        logger.warn("t={} device {} packet {} dropped: {}", now, device.getId(), packet.getId(), e.getMessage());
        return true;
    }

    private class DeadlineGuard extends Event {
        private boolean deferred = false;

        @Override
        public void execute() {
            if (isDecided()) {
                return;
            }
            if (!deferred && inFlight != null && inFlight.isFinalFragment() && simulator.containsEvent(inFlight)
                    && inFlight.getCompletionTime() <= time) {
                deferred = true;
                simulator.addEvent(this);
                return;
            }
            outcome = Outcome.DROPPED;
            double latency = time - packet.getCreationTime();
            device.markDeadlineMiss();
            device.recordMetrics(packet, latency, false, time);
            log.emit(log.at(device.getId(), packet.getId(), EventTag.DROPPED_DEADLINE).setLatency(latency));
            logger.debug("t={} device {} packet {} missed its deadline", time, device.getId(), packet.getId());
        }
    }
}
