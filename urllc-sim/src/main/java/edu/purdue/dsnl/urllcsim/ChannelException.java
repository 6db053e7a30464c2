package edu.purdue.dsnl.urllcsim;

/** A channel computation produced a non-physical value. Fatal to the run. */
public class ChannelException extends SimulationException {
    public ChannelException(String message) {
        super(message);
    }
}
