package edu.purdue.dsnl.urllcsim;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A unit of traffic. Traffic attributes are immutable; the scheduling policy writes its ordering value into
 * {@link #dispatchKey} instead of overwriting the static priority.
 *
 * <p>A round-robin continuation keeps the id, creation time and deadline of the packet it continues, carries only
 * the bits not yet sent, and has a higher {@link #fragment} index.
 */
@Getter
@ToString
public class Packet {
    private final long id;

    private final int deviceId;

    private final double creationTime;

    private final double sizeBits;

    private final double originalSizeBits;

    private final int staticPriority;

    private final double maxLatency;

    private final double deadline;

    private final int fragment;

    @Setter
    private double dispatchKey;

    public Packet(long id, int deviceId, double creationTime, double sizeBits, int staticPriority,
            double maxLatency) {
        this(id, deviceId, creationTime, sizeBits, sizeBits, staticPriority, maxLatency, 0);
    }

    private Packet(long id, int deviceId, double creationTime, double sizeBits, double originalSizeBits,
            int staticPriority, double maxLatency, int fragment) {
        this.id = id;
        this.deviceId = deviceId;
        this.creationTime = creationTime;
        this.sizeBits = sizeBits;
        this.originalSizeBits = originalSizeBits;
        this.staticPriority = staticPriority;
        this.maxLatency = maxLatency;
        this.deadline = creationTime + maxLatency;
        this.fragment = fragment;
    }

    public Packet continuation(double remainingBits) {
        if (remainingBits <= 0 || remainingBits >= sizeBits) {
            throw new IllegalArgumentException(
                    String.format("Continuation of packet %d must carry (0, %f) bits, got %f", id, sizeBits,
                            remainingBits));
        }
        return new Packet(id, deviceId, creationTime, remainingBits, originalSizeBits, staticPriority, maxLatency,
                fragment + 1);
    }

    public boolean isContinuation() {
        return fragment > 0;
    }
}
