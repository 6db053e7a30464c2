package edu.purdue.dsnl.urllcsim.policy;

import edu.purdue.dsnl.urllcsim.Device;
import edu.purdue.dsnl.urllcsim.Packet;
import edu.purdue.dsnl.urllcsim.TransmissionHandle;
import edu.purdue.dsnl.urllcsim.WaitingEntry;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Two regimes keyed on urgency, the time left until the deadline.
 *
 * <p>An urgent packet (urgency below the threshold) evicts the in-flight transmission with the most slack, provided
 * that slack exceeds its own urgency. A packet that is not urgent follows the preemptive priority rule. The waiting
 * set is ordered by absolute deadline, which ranks entries the same way urgency does at any single instant.
 */
@RequiredArgsConstructor
public class HybridEdfPreemptivePolicy implements SchedulingPolicy {
    @Getter
    private final double urgencyThreshold;

    @Override
    public PolicyType getType() {
        return PolicyType.HYBRID_EDF_PREEMPTIVE;
    }

    @Override
    public double dispatchKey(Packet packet, Device device, double now) {
        return packet.getDeadline() - now;
    }

    @Override
    public Comparator<WaitingEntry> waitingOrder() {
        return Comparator.comparingDouble(e -> e.getPacket().getDeadline());
    }

    @Override
    public Optional<TransmissionHandle> selectVictim(Packet candidate, Collection<TransmissionHandle> active,
            double now) {
        double urgency = candidate.getDeadline() - now;
        if (urgency >= urgencyThreshold) {
            return PreemptivePriorityPolicy.lowestPriorityVictim(candidate, active);
        }
        TransmissionHandle slackest = null;
        for (var h : active) {
            if (slackest == null || h.slack(now) > slackest.slack(now)) {
                slackest = h;
            }
        }
        if (slackest != null && slackest.slack(now) > urgency) {
            return Optional.of(slackest);
        }
        return Optional.empty();
    }
}
