package edu.purdue.dsnl.urllcsim;

import lombok.Getter;

import java.util.TreeSet;

/**
 * Single-threaded discrete-event engine. Owns the simulated clock and the pending event set.
 *
 * <p>Nothing here is thread-safe; every mutation of simulation state happens inside {@link Event#execute()}.
 */
public class Simulator {
    private final TreeSet<Event> events = new TreeSet<>();

    private long sequence = 0;

    @Getter
    private double time;

    @Getter
    private long executedEvents;

    public boolean containsEvent(Event e) {
        return e.scheduled;
    }

    /** Schedules {@code e} at its own {@link Event#time}. */
    public void addEvent(Event e) {
        if (e.scheduled) {
            throw new IllegalStateException("Event is already scheduled at t=" + e.time);
        }
        if (e.time < time) {
            throw new IllegalArgumentException(
                    String.format("Cannot schedule into the past: t=%f, now=%f", e.time, time));
        }
        e.sequence = sequence++;
        e.scheduled = true;
        events.add(e);
    }

    public void schedule(Event e, double at) {
        if (e.scheduled) {
            throw new IllegalStateException("Event is already scheduled at t=" + e.time);
        }
        e.time = at;
        addEvent(e);
    }

    public void scheduleAfter(Event e, double delay) {
        schedule(e, time + delay);
    }

    /** Runs {@code action} at simulated time {@code at}. */
    public Event call(double at, Runnable action) {
        var e = new Event() {
            @Override
            public void execute() {
                action.run();
            }
        };
        schedule(e, at);
        return e;
    }

    public void removeEvent(Event e) {
        if (e.scheduled) {
            events.remove(e);
            e.scheduled = false;
        }
    }

    public int pendingEvents() {
        return events.size();
    }

    public void doAllEvents() {
        while (true) {
            var e = events.pollFirst();
            if (e == null) {
                break;
            }
            fire(e);
        }
    }

    /** Executes every event due at or before {@code end}, then parks the clock at {@code end}. */
    public void runUntil(double end) {
        while (!events.isEmpty() && events.first().time <= end) {
            fire(events.pollFirst());
        }
        time = Math.max(time, end);
    }

    private void fire(Event e) {
        e.scheduled = false;
        time = e.time;
        executedEvents++;
        e.execute();
    }
}
