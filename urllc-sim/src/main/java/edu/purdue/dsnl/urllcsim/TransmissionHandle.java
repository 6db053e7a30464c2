package edu.purdue.dsnl.urllcsim;

import lombok.Getter;

/**
 * Sole owner of an in-flight packet. Doubles as the wake-up that ends the transmission: either the packet is fully
 * sent or, under a time quantum, the quantum expires with bits left over.
 */
@Getter
public class TransmissionHandle extends Event {
    private final BaseStation baseStation;

    private final Device device;

    private final Packet packet;

    private final PacketRace race;

    private final ResourceBlock block;

    private final double startTime;

    private final double dataRate;

    /** Bits carried before this handle ends; less than the packet size when the quantum cuts it short. */
    private final double bits;

    TransmissionHandle(BaseStation baseStation, Device device, Packet packet, PacketRace race, ResourceBlock block,
            double startTime, double dataRate, double bits) {
        this.baseStation = baseStation;
        this.device = device;
        this.packet = packet;
        this.race = race;
        this.block = block;
        this.startTime = startTime;
        this.dataRate = dataRate;
        this.bits = bits;
    }

    public int getDeviceId() {
        return device.getId();
    }

    public boolean isFinalFragment() {
        return bits >= packet.getSizeBits();
    }

    public double getCompletionTime() {
        return time;
    }

    /** Time until the packet's deadline, measured at {@code now}. */
    public double slack(double now) {
        return packet.getDeadline() - now;
    }

    @Override
    public void execute() {
        baseStation.release(this);
    }
}
