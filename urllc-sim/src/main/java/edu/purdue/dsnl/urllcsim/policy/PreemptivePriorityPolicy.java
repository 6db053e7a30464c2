package edu.purdue.dsnl.urllcsim.policy;

import edu.purdue.dsnl.urllcsim.Device;
import edu.purdue.dsnl.urllcsim.Packet;
import edu.purdue.dsnl.urllcsim.TransmissionHandle;

import java.util.Collection;
import java.util.Optional;

/**
 * Static priority, lower number first. A packet that outranks the worst in-flight transmission evicts it; among
 * equally bad victims the lowest block id goes.
 */
public class PreemptivePriorityPolicy implements SchedulingPolicy {
    @Override
    public PolicyType getType() {
        return PolicyType.PREEMPTIVE_PRIORITY;
    }

    @Override
    public double dispatchKey(Packet packet, Device device, double now) {
        return packet.getStaticPriority();
    }

    @Override
    public Optional<TransmissionHandle> selectVictim(Packet candidate, Collection<TransmissionHandle> active,
            double now) {
        return lowestPriorityVictim(candidate, active);
    }

    static Optional<TransmissionHandle> lowestPriorityVictim(Packet candidate, Collection<TransmissionHandle> active) {
        TransmissionHandle worst = null;
        for (var h : active) {
            if (worst == null || h.getPacket().getStaticPriority() > worst.getPacket().getStaticPriority()) {
                worst = h;
            }
        }
        if (worst != null && candidate.getStaticPriority() < worst.getPacket().getStaticPriority()) {
            return Optional.of(worst);
        }
        return Optional.empty();
    }
}
