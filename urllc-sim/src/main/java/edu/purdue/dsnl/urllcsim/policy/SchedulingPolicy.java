package edu.purdue.dsnl.urllcsim.policy;

import edu.purdue.dsnl.urllcsim.Device;
import edu.purdue.dsnl.urllcsim.Packet;
import edu.purdue.dsnl.urllcsim.TransmissionHandle;
import edu.purdue.dsnl.urllcsim.WaitingEntry;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Decides how the base station orders competing packets. Every policy allocates a free block when one exists and
 * queues otherwise; they differ in the dispatch key, the waiting-set order and whether they may evict an in-flight
 * transmission.
 *
 * <p>The base station appends insertion order to {@link #waitingOrder()}, so equal keys are served first come,
 * first served.
 */
public interface SchedulingPolicy {
    PolicyType getType();

    /** Ordering value for {@code packet} at simulated time {@code now}; smaller is served earlier. */
    double dispatchKey(Packet packet, Device device, double now);

    default Comparator<WaitingEntry> waitingOrder() {
        return Comparator.comparingDouble(WaitingEntry::getDispatchKey);
    }

    /**
     * Picks the transmission to evict in favour of {@code candidate}, or empty to queue the candidate instead.
     * {@code active} is iterated in ascending block id.
     */
    default Optional<TransmissionHandle> selectVictim(Packet candidate, Collection<TransmissionHandle> active,
            double now) {
        return Optional.empty();
    }

    /** Airtime limit per acquisition, if the policy time-slices. */
    default OptionalDouble quantum() {
        return OptionalDouble.empty();
    }

    /** Multiplier applied to the channel's achievable rate for {@code packet}. */
    default double rateFactor(Packet packet) {
        return 1.0;
    }
}
