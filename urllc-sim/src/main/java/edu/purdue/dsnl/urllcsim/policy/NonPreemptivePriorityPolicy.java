package edu.purdue.dsnl.urllcsim.policy;

import edu.purdue.dsnl.urllcsim.Device;
import edu.purdue.dsnl.urllcsim.Packet;

/** Static priority without eviction. */
public class NonPreemptivePriorityPolicy implements SchedulingPolicy {
    @Override
    public PolicyType getType() {
        return PolicyType.NON_PREEMPTIVE_PRIORITY;
    }

    @Override
    public double dispatchKey(Packet packet, Device device, double now) {
        return packet.getStaticPriority();
    }
}
