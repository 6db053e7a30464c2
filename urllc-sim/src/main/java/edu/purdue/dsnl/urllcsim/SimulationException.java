package edu.purdue.dsnl.urllcsim;

/** Aborts a run. Device counters committed before the failure are left untouched. */
public class SimulationException extends RuntimeException {
    public SimulationException(String message) {
        super(message);
    }

    public SimulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
