package edu.purdue.dsnl.urllcsim;

import lombok.Getter;
import lombok.Setter;

import java.util.Optional;

/** An exclusive, single-capacity transmission resource. Either free or holding exactly one transmission. */
public class ResourceBlock {
    @Getter
    private final int id;

    @Getter
    private final int subcarriers;

    /** Slot length in milliseconds. */
    @Getter
    private final double slotDuration;

    @Getter
    @Setter
    private double currentSinr = 10.0;

    private TransmissionHandle occupant;

    public ResourceBlock(int id, int subcarriers, double slotDuration) {
        this.id = id;
        this.subcarriers = subcarriers;
        this.slotDuration = slotDuration;
    }

    public boolean isFree() {
        return occupant == null;
    }

    public Optional<TransmissionHandle> getOccupant() {
        return Optional.ofNullable(occupant);
    }

    void bind(TransmissionHandle handle) {
        if (occupant != null) {
            throw new IllegalStateException(
                    String.format("Resource block %d already carries packet %d", id, occupant.getPacket().getId()));
        }
        occupant = handle;
    }

    TransmissionHandle unbind() {
        var h = occupant;
        occupant = null;
        return h;
    }
}
