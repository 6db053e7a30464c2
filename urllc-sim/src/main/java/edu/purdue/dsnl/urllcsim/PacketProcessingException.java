package edu.purdue.dsnl.urllcsim;

import lombok.Getter;

/**
 * Malformed per-packet state. The offending packet is dropped and the run continues.
 */
public class PacketProcessingException extends RuntimeException {
    @Getter
    private final long packetId;

    public PacketProcessingException(long packetId, String message) {
        super(message);
        this.packetId = packetId;
    }
}
