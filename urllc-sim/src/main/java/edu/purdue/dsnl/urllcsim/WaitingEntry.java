package edu.purdue.dsnl.urllcsim;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * A packet parked in the base station's waiting set. The dispatch key is captured on insertion; {@code sequence}
 * breaks ties in insertion order.
 */
@Getter
@RequiredArgsConstructor
public class WaitingEntry {
    private final Device device;

    private final Packet packet;

    private final PacketRace race;

    private final double dispatchKey;

    private final long sequence;
}
