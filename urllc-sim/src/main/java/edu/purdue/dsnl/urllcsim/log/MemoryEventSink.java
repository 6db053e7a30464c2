package edu.purdue.dsnl.urllcsim.log;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/** Keeps every record in memory. */
public class MemoryEventSink implements EventSink {
    @Getter
    private final List<EventRecord> records = new ArrayList<>();

    @Getter
    private boolean open;

    @Getter
    private boolean closed;

    @Override
    public void open() {
        open = true;
    }

    @Override
    public RecordResult record(EventRecord record) {
        records.add(record);
        return RecordResult.ok();
    }

    @Override
    public void close() {
        closed = true;
    }

    public List<EventRecord> records(EventTag tag) {
        return records.stream().filter(r -> r.getTag() == tag).toList();
    }

    public List<EventRecord> recordsFor(long packetId) {
        return records.stream().filter(r -> r.getPacketId() == packetId).toList();
    }
}
