package edu.purdue.dsnl.urllcsim.log;

import java.io.IOException;

/**
 * Append-only destination for the analysis event stream. The simulation opens the sink when a run starts, records
 * into it while the run progresses, and closes it when the run ends. It never reads records back.
 */
@FunctionalInterface
public interface EventSink {
    EventSink NONE = record -> RecordResult.ok();

    default void open() throws IOException {
    }

    RecordResult record(EventRecord record);

    default void close() throws IOException {
    }
}
