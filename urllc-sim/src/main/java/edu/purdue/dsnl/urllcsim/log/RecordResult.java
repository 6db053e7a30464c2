package edu.purdue.dsnl.urllcsim.log;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.io.IOException;
import java.util.Optional;

/** Outcome of handing one record to an {@link EventSink}. */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class RecordResult {
    private static final RecordResult OK = new RecordResult(null);

    private final IOException failure;

    public static RecordResult ok() {
        return OK;
    }

    public static RecordResult failed(IOException cause) {
        return new RecordResult(cause);
    }

    public boolean isOk() {
        return failure == null;
    }

    public Optional<IOException> getFailure() {
        return Optional.ofNullable(failure);
    }
}
