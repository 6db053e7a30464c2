package edu.purdue.dsnl.urllcsim.log;

import edu.purdue.dsnl.urllcsim.SimulationException;
import edu.purdue.dsnl.urllcsim.Simulator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.io.IOException;

/**
 * Stamps records with the simulated clock and hands them to the injected {@link EventSink}. A failed record aborts
 * the run; callers record metrics before logging so committed counters survive.
 */
@RequiredArgsConstructor
public class EventLog {
    private static final Logger logger = LogManager.getLogger(EventLog.class);

    @Getter
    private final EventSink sink;

    private final Simulator simulator;

    @Getter
    private long recordCount;

    public EventRecord at(int deviceId, long packetId, EventTag tag) {
        return new EventRecord(simulator.getTime(), deviceId, packetId, tag);
    }

    public void emit(EventRecord record) {
        var result = sink.record(record);
        if (!result.isOk()) {
            var cause = result.getFailure().orElse(null);
            logger.warn("Event sink rejected {} at t={}", record.getEvent(), record.getTime());
            throw new SimulationException(
                    String.format("Event sink failed at t=%f on %s", record.getTime(), record.getEvent()), cause);
        }
        recordCount++;
    }

    public void emit(int deviceId, long packetId, EventTag tag) {
        emit(at(deviceId, packetId, tag));
    }

    public void open() {
        try {
            sink.open();
        } catch (IOException e) {
            throw new SimulationException("Cannot open event sink", e);
        }
    }

    public void close() {
        try {
            sink.close();
        } catch (IOException e) {
            throw new SimulationException("Cannot close event sink", e);
        }
    }
}
