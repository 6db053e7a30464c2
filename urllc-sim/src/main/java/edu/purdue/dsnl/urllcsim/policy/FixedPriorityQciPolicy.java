package edu.purdue.dsnl.urllcsim.policy;

import edu.purdue.dsnl.urllcsim.Device;
import edu.purdue.dsnl.urllcsim.Packet;

/**
 * 5G fixed priority by QoS class identifier. Static priority is clamped to QCI 1..9, lower served first, and the
 * achievable rate is derated by a per-class efficiency factor.
 */
public class FixedPriorityQciPolicy implements SchedulingPolicy {
    public static final int MIN_QCI = 1;

    public static final int MAX_QCI = 9;

    // Index 0 is QCI 1
    private static final double[] EFFICIENCY = { 1.0, 0.95, 0.9, 0.85, 0.8, 0.75, 0.7, 0.65, 0.6 };

    @Override
    public PolicyType getType() {
        return PolicyType.FIVEG_FIXED_PRIORITY;
    }

    public static int qci(Packet packet) {
        return Math.max(MIN_QCI, Math.min(MAX_QCI, packet.getStaticPriority()));
    }

    public static double efficiency(int qci) {
        return EFFICIENCY[qci - MIN_QCI];
    }

    @Override
    public double dispatchKey(Packet packet, Device device, double now) {
        return qci(packet);
    }

    @Override
    public double rateFactor(Packet packet) {
        return efficiency(qci(packet));
    }
}
