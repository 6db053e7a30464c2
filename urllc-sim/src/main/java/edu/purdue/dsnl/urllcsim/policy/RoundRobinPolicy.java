package edu.purdue.dsnl.urllcsim.policy;

import edu.purdue.dsnl.urllcsim.Device;
import edu.purdue.dsnl.urllcsim.Packet;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.OptionalDouble;

/**
 * Arrival order with a fixed airtime quantum. A packet that needs more than one quantum sends what fits and goes
 * back to the tail of the queue with the remainder.
 */
@RequiredArgsConstructor
public class RoundRobinPolicy implements SchedulingPolicy {
    @Getter
    private final double quantumSeconds;

    @Override
    public PolicyType getType() {
        return PolicyType.ROUND_ROBIN;
    }

    @Override
    public double dispatchKey(Packet packet, Device device, double now) {
        return now;
    }

    @Override
    public OptionalDouble quantum() {
        return OptionalDouble.of(quantumSeconds);
    }
}
