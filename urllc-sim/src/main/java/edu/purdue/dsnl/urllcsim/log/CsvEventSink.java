package edu.purdue.dsnl.urllcsim.log;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.io.File;
import java.io.IOException;

/** Writes the event stream to a CSV file with a header row, flushing after every record. */
@RequiredArgsConstructor
public class CsvEventSink implements EventSink {
    @Getter
    private final File file;

    private SequenceWriter writer;

    @Override
    public void open() throws IOException {
        var mapper = new CsvMapper();
        var schema = mapper.schemaFor(EventRecord.class).withHeader();
        writer = mapper.writer(schema).writeValues(file);
    }

    @Override
    public RecordResult record(EventRecord record) {
        if (writer == null) {
            return RecordResult.failed(new IOException("Event log " + file + " is not open"));
        }
        try {
            writer.write(record);
            writer.flush();
            return RecordResult.ok();
        } catch (IOException e) {
            return RecordResult.failed(e);
        }
    }

    @Override
    public void close() throws IOException {
        if (writer != null) {
            writer.close();
            writer = null;
        }
    }
}
