package edu.purdue.dsnl.urllcsim.policy;

import edu.purdue.dsnl.urllcsim.Device;
import edu.purdue.dsnl.urllcsim.Packet;

/** Earliest absolute deadline first, no eviction. */
public class EdfPolicy implements SchedulingPolicy {
    @Override
    public PolicyType getType() {
        return PolicyType.EDF;
    }

    @Override
    public double dispatchKey(Packet packet, Device device, double now) {
        return packet.getDeadline();
    }
}
