package edu.purdue.dsnl.urllcsim.policy;

import edu.purdue.dsnl.urllcsim.Device;
import edu.purdue.dsnl.urllcsim.Packet;

/**
 * Weight {@code priority / (average throughput + epsilon)}, ascending. The average is the device's rolling mean over
 * its most recent completed transmissions.
 */
public class ProportionalFairPolicy implements SchedulingPolicy {
    static final double EPSILON = 1e-6;

    @Override
    public PolicyType getType() {
        return PolicyType.PROPORTIONAL_FAIR;
    }

    @Override
    public double dispatchKey(Packet packet, Device device, double now) {
        return packet.getStaticPriority() / (device.averageThroughput() + EPSILON);
    }
}
